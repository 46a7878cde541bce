package space.ketterling.tidegate.model;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * A predicted high or low water.
 */
public record TideExtreme(Instant instant, double height, Type type) {
    public TideExtreme {
        Objects.requireNonNull(instant, "instant");
        Objects.requireNonNull(type, "type");
    }

    public enum Type {
        HIGH, LOW;

        /**
         * Parses provider labels such as "High" or "Low".
         */
        public static Type parse(String s) {
            if (s == null)
                throw new IllegalArgumentException("missing extreme type");
            return Type.valueOf(s.trim().toUpperCase(Locale.ROOT));
        }

        public String label() {
            return this == HIGH ? "High" : "Low";
        }
    }
}
