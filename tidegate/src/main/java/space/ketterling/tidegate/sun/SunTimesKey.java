package space.ketterling.tidegate.sun;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Cache key for a sunrise/sunset lookup.
 */
public record SunTimesKey(double lat, double lng, LocalDate date) {
    public SunTimesKey {
        Objects.requireNonNull(date, "date");
    }
}
