/*
* Copyright 2025 Taylor Ketterling
* Main application entry point for TideGate, a tide height and gate-time serving application.
*
* Loads configuration, builds the provider clients and in-memory caches, starts the
* refresh coordinator (first refresh runs immediately in the background) and the API
* server, and handles a graceful shutdown.
*/

package space.ketterling.tidegate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.tidegate.api.ApiServer;
import space.ketterling.tidegate.cache.KeyedCache;
import space.ketterling.tidegate.config.AppConfig;
import space.ketterling.tidegate.derive.EventDeriver;
import space.ketterling.tidegate.http.JsonHttp;
import space.ketterling.tidegate.ingest.RefreshCoordinator;
import space.ketterling.tidegate.ingest.TideIngestService;
import space.ketterling.tidegate.marine.MarineClient;
import space.ketterling.tidegate.marine.MarineKey;
import space.ketterling.tidegate.moon.MoonPhaseClient;
import space.ketterling.tidegate.moon.MoonPhaseKey;
import space.ketterling.tidegate.openweather.OpenWeatherClient;
import space.ketterling.tidegate.query.QueryFacade;
import space.ketterling.tidegate.sun.SunTimesKey;
import space.ketterling.tidegate.sun.SunriseSunsetClient;
import space.ketterling.tidegate.worldtides.WorldTidesClient;

import java.time.Clock;
import java.time.Duration;

public final class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        log.info("Starting application");
        AppConfig cfg = AppConfig.load();
        Clock clock = Clock.systemUTC();
        ObjectMapper om = new ObjectMapper();

        if (!cfg.hasWorldTidesKey())
            log.warn("WORLDTIDES_KEY not set; tide caches will stay empty");
        if (!cfg.hasOpenWeatherKey())
            log.warn("OPENWEATHER_KEY not set; weather cache will stay empty");

        // HTTP clients
        Duration backoff = Duration.ofSeconds(1);
        WorldTidesClient worldTides = new WorldTidesClient(cfg,
                new JsonHttp(om, "WorldTides", cfg.httpTimeout(), cfg.httpMaxAttempts(), backoff));
        OpenWeatherClient openWeather = new OpenWeatherClient(cfg,
                new JsonHttp(om, "OpenWeather", cfg.httpTimeout(), cfg.httpMaxAttempts(), backoff));
        SunriseSunsetClient sun = new SunriseSunsetClient(
                new JsonHttp(om, "SunriseSunset", cfg.httpTimeout(), cfg.httpMaxAttempts(), backoff),
                cfg.clockZoneId());
        MoonPhaseClient moon = new MoonPhaseClient(
                new JsonHttp(om, "FarmSense", cfg.httpTimeout(), cfg.httpMaxAttempts(), backoff));
        MarineClient marine = new MarineClient(
                new JsonHttp(om, "OpenMeteo", cfg.httpTimeout(), cfg.httpMaxAttempts(), backoff));

        // Caches + refresh
        TideIngestService tides = new TideIngestService(cfg, clock, worldTides, worldTides::fetchExtremes,
                openWeather::fetchDaily, new EventDeriver());
        RefreshCoordinator coordinator = new RefreshCoordinator(clock, cfg.refreshInterval(), cfg.readerWait());
        tides.registerWith(coordinator);
        KeyedCache<SunTimesKey, JsonNode> sunCache = new KeyedCache<>("sunrise-sunset", sun::sunTimes);
        KeyedCache<MoonPhaseKey, JsonNode> moonCache = new KeyedCache<>("moon-phase", moon::moonPhase);
        KeyedCache<MarineKey, JsonNode> marineCache = new KeyedCache<>("marine", marine::marine);

        QueryFacade query = new QueryFacade(coordinator, tides, sunCache, moonCache, marineCache, clock,
                cfg.clockZoneId(), cfg.weatherHorizonDays());

        // API server starts immediately; the first refresh runs in the background
        ApiServer api = new ApiServer(cfg, om, query);
        coordinator.start();
        api.start();
        log.info("API server started on port {}", cfg.apiPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                log.info("Shutting down...");
                api.stop();
                coordinator.stop();
            } catch (RuntimeException e) {
                log.error("Shutdown error", e);
            }
        }));
    }
}
