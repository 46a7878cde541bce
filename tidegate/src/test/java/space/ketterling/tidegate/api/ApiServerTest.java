package space.ketterling.tidegate.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import space.ketterling.tidegate.MutableClock;
import space.ketterling.tidegate.TestConfigs;
import space.ketterling.tidegate.cache.KeyedCache;
import space.ketterling.tidegate.derive.EventDeriver;
import space.ketterling.tidegate.http.FetchException;
import space.ketterling.tidegate.ingest.RefreshCoordinator;
import space.ketterling.tidegate.ingest.TideIngestService;
import space.ketterling.tidegate.marine.MarineKey;
import space.ketterling.tidegate.model.*;
import space.ketterling.tidegate.moon.MoonPhaseKey;
import space.ketterling.tidegate.query.QueryFacade;
import space.ketterling.tidegate.sun.SunTimesKey;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ApiServerTest {
    private final ObjectMapper om = new ObjectMapper();
    private final HttpClient http = HttpClient.newHttpClient();
    private final MutableClock clock = new MutableClock(Instant.parse("2025-01-15T08:00:00Z"));
    private RefreshCoordinator coordinator;
    private ApiServer api;

    @BeforeEach
    void setUp() {
        coordinator = new RefreshCoordinator(clock, Duration.ofHours(12), Duration.ofSeconds(2));
        TideIngestService tides = new TideIngestService(TestConfigs.config(), clock,
                (start, days) -> SampleSeries.of(
                        new Sample(Instant.parse("2025-01-15T09:00:00Z"), 3.0),
                        new Sample(Instant.parse("2025-01-15T09:30:00Z"), 4.5),
                        new Sample(Instant.parse("2025-01-15T15:00:00Z"), 5.0),
                        new Sample(Instant.parse("2025-01-15T15:30:00Z"), 3.0)),
                (start, days) -> ByDay.empty(),
                () -> {
                    throw FetchException.missingCredential("OpenWeather");
                },
                new EventDeriver());
        tides.registerWith(coordinator);
        KeyedCache<SunTimesKey, JsonNode> sun = new KeyedCache<>("sun", k -> {
            throw new FetchException(FetchException.Kind.NETWORK, "offline");
        });
        KeyedCache<MoonPhaseKey, JsonNode> moon = new KeyedCache<>("moon",
                k -> om.createObjectNode().put("Phase", "Full Moon").put("TargetDate", String.valueOf(k.unixTime())));
        KeyedCache<MarineKey, JsonNode> marine = new KeyedCache<>("marine", k -> om.createObjectNode()
                .put("latitude", k.lat())
                .put("timeformat", k.timeformat())
                .put("forecast_hours", k.forecastHours()));
        QueryFacade query = new QueryFacade(coordinator, tides, sun, moon, marine, clock, TestConfigs.LONDON, 5);
        api = new ApiServer(TestConfigs.config(), om, query);
        api.start();
    }

    @AfterEach
    void tearDown() {
        api.stop();
        coordinator.stop();
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest req = HttpRequest.newBuilder(URI.create("http://localhost:" + api.port() + path)).GET().build();
        return http.send(req, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void gateTimesForDay() throws Exception {
        HttpResponse<String> r = get("/api/gate-times/2025-01-15");

        assertEquals(200, r.statusCode());
        JsonNode arr = om.readTree(r.body());
        assertEquals(2, arr.size());
        assertEquals("2025-01-15T09:20Z", arr.get(0).get("datetime").asText());
        assertEquals("lower", arr.get(0).get("action").asText());
        assertEquals("raise", arr.get(1).get("action").asText());
        assertEquals(4.0, arr.get(1).get("height").asDouble());
    }

    @Test
    void allGateTimesKeyedByDay() throws Exception {
        JsonNode all = om.readTree(get("/api/gate-times").body());

        assertTrue(all.has("2025-01-15"));
        assertEquals(1, all.size());
    }

    @Test
    void unknownDayIsNotFoundAndBadDateIsBadRequest() throws Exception {
        assertEquals(404, get("/api/gate-times/2025-01-16").statusCode());
        assertEquals(404, get("/api/tides/2025-01-15").statusCode());
        assertEquals(400, get("/api/gate-times/15-01-2025").statusCode());
        assertEquals(400, get("/api/tide-heights/range?start=2025-01-15").statusCode());
    }

    @Test
    void tideHeightsArePaged() throws Exception {
        JsonNode page = om.readTree(get("/api/tide-heights?offset=1&limit=2").body());

        assertEquals(2, page.size());
        assertEquals(4.5, page.get(0).get("height").asDouble());
        assertEquals("2025-01-15", page.get(0).get("date").asText());
    }

    @Test
    void missingWeatherKeyGivesNotFound() throws Exception {
        assertEquals(404, get("/api/weather/2025-01-15").statusCode());
    }

    @Test
    void sunriseProviderFailureIsBadGateway() throws Exception {
        HttpResponse<String> r = get("/api/sunrise-sunset?date=2025-01-15");

        assertEquals(502, r.statusCode());
        assertEquals("sunrise_sunset_unavailable", om.readTree(r.body()).get("error").asText());
    }

    @Test
    void healthReportsCachesWithoutRefreshing() throws Exception {
        JsonNode h = om.readTree(get("/health").body());

        assertEquals("starting", h.get("status").asText());
        assertEquals(3, h.get("caches").size());
        assertEquals("STALE", h.get("caches").get(0).get("state").asText());

        get("/api/tide-heights");
        JsonNode after = om.readTree(get("/health").body());
        assertEquals("ok", after.get("status").asText());
    }

    @Test
    void cacheMetricsListRefreshState() throws Exception {
        get("/api/weather/2025-01-15");
        JsonNode rows = om.readTree(get("/api/metrics/caches").body());

        assertEquals(3, rows.size());
        JsonNode weather = rows.get(2);
        assertEquals("weather", weather.get("cache").asText());
        assertTrue(weather.get("last_successful_fetch").isNull());
        assertEquals("OpenWeather API key not set", weather.get("last_error").asText());
    }

    @Test
    void moonPhaseForDate() throws Exception {
        HttpResponse<String> r = get("/api/moon-phase?date=2025-01-15");

        assertEquals(200, r.statusCode());
        assertEquals("1736899200", om.readTree(r.body()).get("TargetDate").asText());
        assertEquals(400, get("/api/moon-phase?date=tomorrow").statusCode());
    }

    @Test
    void marineUsesSiteAndDefaults() throws Exception {
        JsonNode n = om.readTree(get("/api/marine").body());

        assertEquals(53.28, n.get("latitude").asDouble());
        assertEquals("unixtime", n.get("timeformat").asText());
        assertEquals(48, n.get("forecast_hours").asInt());

        JsonNode custom = om.readTree(get("/api/marine?forecast_hours=24&timeformat=iso8601").body());
        assertEquals(24, custom.get("forecast_hours").asInt());
        assertEquals(400, get("/api/marine?timeformat=rfc822").statusCode());
    }
}
