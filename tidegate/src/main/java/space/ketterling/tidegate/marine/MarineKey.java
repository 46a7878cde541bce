package space.ketterling.tidegate.marine;

import java.util.Objects;

/**
 * Cache key for a marine forecast request.
 *
 * @param lat           latitude
 * @param lon           longitude
 * @param hourly        comma separated hourly variables
 * @param timeformat    {@code unixtime} or {@code iso8601}
 * @param forecastHours hours of forecast to return
 */
public record MarineKey(double lat, double lon, String hourly, String timeformat, int forecastHours) {
    public static final String DEFAULT_HOURLY = "sea_level_height_msl,ocean_current_velocity,ocean_current_direction";
    public static final String DEFAULT_TIMEFORMAT = "unixtime";
    public static final int DEFAULT_FORECAST_HOURS = 48;

    public MarineKey {
        Objects.requireNonNull(hourly, "hourly");
        Objects.requireNonNull(timeformat, "timeformat");
    }

    /**
     * Default variables for a location.
     */
    public static MarineKey defaults(double lat, double lon) {
        return new MarineKey(lat, lon, DEFAULT_HOURLY, DEFAULT_TIMEFORMAT, DEFAULT_FORECAST_HOURS);
    }
}
