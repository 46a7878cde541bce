package space.ketterling.tidegate.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.*;
import java.util.*;

/**
 * Application configuration loaded from environment variables or properties.
 *
 * <p>
 * This record groups all runtime settings for the API, the tide/weather
 * providers, the refresh schedule and the per-cache staleness bounds.
 * </p>
 */
public record AppConfig(
        // API
        int apiPort,

        // Providers (blank key = fetches skipped, caches stay stale)
        String worldTidesKey,
        String openWeatherKey,

        // Site
        double siteLat,
        double siteLon,
        ZoneId clockZoneId,

        // Gate
        double gateOpenHeight,

        // Schedules / staleness
        Duration refreshInterval,
        Duration tideHeightsMaxAge,
        Duration tideExtremesMaxAge,
        Duration weatherMaxAge,
        Duration readerWait,

        // Windows
        int tideHeightsDays,
        int tideExtremesDays,
        int tideExtremesChunkDays,
        int weatherHorizonDays,

        // HTTP
        int httpMaxAttempts,
        Duration httpTimeout) {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    /**
     * Loads configuration using environment variables, system properties, and
     * application.properties (in that order).
     */
    public static AppConfig load() {
        Properties p = new Properties();
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream("application.properties")) {
            if (in != null)
                p.load(in);
        } catch (IOException e) {
            log.warn("Could not read application.properties, using env and defaults", e);
        }
        return fromProperties(p);
    }

    /**
     * Builds a config from the given properties, still letting env vars and
     * JVM properties override each key.
     */
    public static AppConfig fromProperties(Properties p) {
        int port = Integer.parseInt(envOr(p, "API_PORT", "api.port", "8080"));

        String worldTidesKey = envOr(p, "WORLDTIDES_KEY", "worldtides.key", "");
        String openWeatherKey = envOr(p, "OPENWEATHER_KEY", "openweather.key", "");

        double lat = Double.parseDouble(envOr(p, "SITE_LAT", "site.lat", "53.28"));
        double lon = Double.parseDouble(envOr(p, "SITE_LON", "site.lon", "-3.83"));
        ZoneId zoneId = ZoneId.of(envOr(p, "CLOCK_ZONE", "clock.zone", "Europe/London"));

        double openHeight = Double.parseDouble(envOr(p, "GATE_OPEN_HEIGHT", "gate.openHeight", "4"));

        // Schedules
        Duration refresh = Duration.parse(envOr(p, "SCHED_REFRESH", "schedule.refresh", "PT12H"));
        Duration heightsAge = Duration.parse(envOr(p, "MAX_AGE_TIDE_HEIGHTS", "maxAge.tideHeights", "P7D"));
        Duration extremesAge = Duration.parse(envOr(p, "MAX_AGE_TIDE_EXTREMES", "maxAge.tideExtremes", "PT12H"));
        Duration weatherAge = Duration.parse(envOr(p, "MAX_AGE_WEATHER", "maxAge.weather", "PT12H"));
        Duration readerWait = Duration.parse(envOr(p, "READER_WAIT", "refresh.readerWait", "PT30S"));

        // Windows
        int heightsDays = Integer.parseInt(envOr(p, "TIDE_HEIGHTS_DAYS", "tides.heightsDays", "180"));
        int extremesDays = Integer.parseInt(envOr(p, "TIDE_EXTREMES_DAYS", "tides.extremesDays", "365"));
        int chunkDays = Integer.parseInt(envOr(p, "TIDE_EXTREMES_CHUNK_DAYS", "tides.extremesChunkDays", "7"));
        int horizonDays = Integer.parseInt(envOr(p, "WEATHER_HORIZON_DAYS", "weather.horizonDays", "5"));

        // HTTP
        int maxAttempts = Integer.parseInt(envOr(p, "HTTP_MAX_ATTEMPTS", "http.maxAttempts", "3"));
        Duration httpTimeout = Duration.parse(envOr(p, "HTTP_TIMEOUT", "http.timeout", "PT10S"));

        // constructor args must match record field order exactly
        return new AppConfig(
                port,

                worldTidesKey,
                openWeatherKey,

                lat,
                lon,
                zoneId,

                openHeight,

                refresh,
                heightsAge,
                extremesAge,
                weatherAge,
                readerWait,

                requirePositive(heightsDays, "tides.heightsDays"),
                requirePositive(extremesDays, "tides.extremesDays"),
                requirePositive(chunkDays, "tides.extremesChunkDays"),
                horizonDays,

                Math.max(1, maxAttempts),
                httpTimeout);
    }

    /**
     * True when a WorldTides API key is configured.
     */
    public boolean hasWorldTidesKey() {
        return worldTidesKey != null && !worldTidesKey.isBlank();
    }

    /**
     * True when an OpenWeather API key is configured.
     */
    public boolean hasOpenWeatherKey() {
        return openWeatherKey != null && !openWeatherKey.isBlank();
    }

    // ----------------------------
    // helpers
    // ----------------------------
    /**
     * Reads a value from env, then JVM property, then properties file fallback.
     */
    private static String envOr(Properties p, String envKey, String propKey, String def) {
        String v = System.getenv(envKey);
        if (v != null && !v.isBlank())
            return v;
        String sys = System.getProperty(propKey);
        if (sys != null && !sys.isBlank())
            return sys;
        return p.getProperty(propKey, def);
    }

    private static int requirePositive(int v, String key) {
        if (v <= 0) {
            throw new IllegalStateException("Config value " + key + " must be positive, got " + v);
        }
        return v;
    }
}
