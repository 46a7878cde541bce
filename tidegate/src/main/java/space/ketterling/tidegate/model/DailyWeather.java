package space.ketterling.tidegate.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Daily forecast objects keyed by local day. Stored nodes are never handed
 * out directly; readers get deep copies.
 */
public final class DailyWeather {
    private static final DailyWeather EMPTY = new DailyWeather(Collections.emptyNavigableMap());

    private final Map<LocalDate, ObjectNode> days;

    private DailyWeather(Map<LocalDate, ObjectNode> days) {
        this.days = days;
    }

    public static DailyWeather empty() {
        return EMPTY;
    }

    public static DailyWeather of(Map<LocalDate, ObjectNode> days) {
        return new DailyWeather(Collections.unmodifiableNavigableMap(new TreeMap<>(days)));
    }

    public Optional<JsonNode> forDay(LocalDate day) {
        ObjectNode n = days.get(day);
        return n == null ? Optional.empty() : Optional.of(n.deepCopy());
    }

    public int size() {
        return days.size();
    }

    public boolean isEmpty() {
        return days.isEmpty();
    }

    @Override
    public String toString() {
        return "DailyWeather" + days.keySet();
    }
}
