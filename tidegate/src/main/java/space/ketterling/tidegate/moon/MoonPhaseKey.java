package space.ketterling.tidegate.moon;

import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Cache key for a moon phase lookup: unix seconds of UTC midnight of the
 * requested day.
 */
public record MoonPhaseKey(long unixTime) {

    public static MoonPhaseKey forDate(LocalDate date) {
        return new MoonPhaseKey(date.atStartOfDay(ZoneOffset.UTC).toEpochSecond());
    }
}
