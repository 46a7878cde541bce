package space.ketterling.tidegate.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import space.ketterling.tidegate.MutableClock;
import space.ketterling.tidegate.TestConfigs;
import space.ketterling.tidegate.cache.KeyedCache;
import space.ketterling.tidegate.derive.EventDeriver;
import space.ketterling.tidegate.http.FetchException;
import space.ketterling.tidegate.ingest.CacheName;
import space.ketterling.tidegate.ingest.CacheState;
import space.ketterling.tidegate.ingest.RefreshCoordinator;
import space.ketterling.tidegate.ingest.TideIngestService;
import space.ketterling.tidegate.marine.MarineKey;
import space.ketterling.tidegate.model.*;
import space.ketterling.tidegate.moon.MoonPhaseKey;
import space.ketterling.tidegate.sun.SunTimesKey;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class QueryFacadeTest {
    private static final Instant NOW = Instant.parse("2025-06-14T23:30:00Z");
    private static final LocalDate TODAY = LocalDate.of(2025, 6, 15);

    private final ObjectMapper om = new ObjectMapper();
    private final MutableClock clock = new MutableClock(NOW);
    private final RefreshCoordinator coordinator = new RefreshCoordinator(clock, Duration.ofHours(12),
            Duration.ofSeconds(2));
    private final AtomicInteger heightLoads = new AtomicInteger();
    private final AtomicInteger weatherLoads = new AtomicInteger();
    private final AtomicInteger sunLoads = new AtomicInteger();
    private final AtomicInteger moonLoads = new AtomicInteger();
    private final AtomicInteger marineLoads = new AtomicInteger();

    private final QueryFacade query;

    QueryFacadeTest() {
        ObjectNode day = om.createObjectNode().put("summary", "Sunny");
        TideIngestService tides = new TideIngestService(TestConfigs.config(), clock,
                (start, days) -> {
                    heightLoads.incrementAndGet();
                    return SampleSeries.of(
                            new Sample(Instant.parse("2025-06-15T09:00:00Z"), 3.0),
                            new Sample(Instant.parse("2025-06-15T09:30:00Z"), 4.5),
                            new Sample(Instant.parse("2025-06-15T10:00:00Z"), 4.8));
                },
                (start, days) -> new ByDay.Builder<TideExtreme>()
                        .add(TODAY, new TideExtreme(Instant.parse("2025-06-15T10:10:00Z"), 5.0, TideExtreme.Type.HIGH))
                        .build(),
                () -> {
                    weatherLoads.incrementAndGet();
                    return DailyWeather.of(Map.of(TODAY, day, TODAY.plusDays(5), day.deepCopy()));
                },
                new EventDeriver());
        tides.registerWith(coordinator);
        KeyedCache<SunTimesKey, JsonNode> sun = new KeyedCache<>("sun", k -> {
            sunLoads.incrementAndGet();
            if (k.lat() > 90)
                throw new FetchException(FetchException.Kind.HTTP_STATUS, "INVALID_REQUEST");
            return om.createObjectNode().put("date", k.date().toString());
        });
        KeyedCache<MoonPhaseKey, JsonNode> moon = new KeyedCache<>("moon", k -> {
            moonLoads.incrementAndGet();
            return om.createObjectNode().put("TargetDate", String.valueOf(k.unixTime()));
        });
        KeyedCache<MarineKey, JsonNode> marine = new KeyedCache<>("marine", k -> {
            marineLoads.incrementAndGet();
            return om.createObjectNode().put("hours", k.forecastHours());
        });
        query = new QueryFacade(coordinator, tides, sun, moon, marine, clock, TestConfigs.LONDON, 5);
    }

    @AfterEach
    void tearDown() {
        coordinator.stop();
    }

    @Test
    void firstReadFetchesAndLaterReadsUseCache() {
        assertEquals(3, query.samples(0, 100).size());
        assertEquals(1, query.samples(1, 1).size());
        assertEquals(1, heightLoads.get());
        assertEquals(CacheState.FRESH, coordinator.state(CacheName.TIDE_HEIGHTS));
    }

    @Test
    void staleCacheIsRefreshedOnRead() {
        query.samples(0, 10);
        clock.advance(Duration.ofDays(7).plusSeconds(1));

        query.samples(0, 10);

        assertEquals(2, heightLoads.get());
    }

    @Test
    void eventsByDay() {
        List<CrossingEvent> events = query.events(TODAY).orElseThrow();
        assertEquals(1, events.size());
        assertEquals(CrossingEvent.Direction.UP, events.get(0).direction());

        assertTrue(query.events(TODAY.plusDays(1)).isEmpty());
        assertEquals(1, query.allEvents().eventCount());
    }

    @Test
    void extremesByDay() {
        assertEquals(TideExtreme.Type.HIGH, query.extremes(TODAY).orElseThrow().get(0).type());
        assertTrue(query.extremes(TODAY.minusDays(1)).isEmpty());
    }

    @Test
    void weatherOnlyWithinHorizon() {
        assertTrue(query.weather(TODAY.minusDays(1)).isEmpty());
        assertTrue(query.weather(TODAY.plusDays(6)).isEmpty());
        assertEquals(0, weatherLoads.get());

        assertEquals("Sunny", query.weather(TODAY).orElseThrow().get("summary").asText());
        assertTrue(query.weather(TODAY.plusDays(5)).isPresent());
        assertTrue(query.weather(TODAY.plusDays(1)).isEmpty());
        assertEquals(1, weatherLoads.get());
    }

    @Test
    void sunTimesAreCachedPerKeyAndFailuresRetried() throws Exception {
        query.sunTimes(53.28, -3.83, TODAY);
        JsonNode second = query.sunTimes(53.28, -3.83, TODAY);
        ((ObjectNode) second).put("date", "changed");

        assertEquals(TODAY.toString(), query.sunTimes(53.28, -3.83, TODAY).get("date").asText());
        assertEquals(1, sunLoads.get());

        assertThrows(FetchException.class, () -> query.sunTimes(99, 0, TODAY));
        assertThrows(FetchException.class, () -> query.sunTimes(99, 0, TODAY));
        assertEquals(3, sunLoads.get());
    }

    @Test
    void cacheStatusListsAllCaches() {
        assertEquals(3, query.cacheStatus().size());
        assertTrue(query.cacheStatus().stream().allMatch(s -> s.state() == CacheState.STALE));
    }

    @Test
    void moonPhaseIsKeyedByUtcMidnight() throws Exception {
        // 2025-06-15T00:00:00Z
        assertEquals("1749945600", query.moonPhase(TODAY).get("TargetDate").asText());
        query.moonPhase(TODAY);
        query.moonPhase(TODAY.plusDays(1));

        assertEquals(2, moonLoads.get());
    }

    @Test
    void marineIsCachedPerRequestShape() throws Exception {
        MarineKey defaults = MarineKey.defaults(53.28, -3.83);
        assertEquals(48, query.marine(defaults).get("hours").asInt());
        query.marine(MarineKey.defaults(53.28, -3.83));
        query.marine(new MarineKey(53.28, -3.83, MarineKey.DEFAULT_HOURLY, "iso8601", 48));

        assertEquals(2, marineLoads.get());
    }
}
