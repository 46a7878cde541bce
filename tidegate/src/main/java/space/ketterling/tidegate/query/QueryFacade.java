package space.ketterling.tidegate.query;

import com.fasterxml.jackson.databind.JsonNode;
import space.ketterling.tidegate.cache.KeyedCache;
import space.ketterling.tidegate.http.FetchException;
import space.ketterling.tidegate.ingest.CacheName;
import space.ketterling.tidegate.ingest.RefreshCoordinator;
import space.ketterling.tidegate.ingest.RefreshState;
import space.ketterling.tidegate.ingest.TideIngestService;
import space.ketterling.tidegate.marine.MarineKey;
import space.ketterling.tidegate.model.CrossingEvent;
import space.ketterling.tidegate.model.EventsByDay;
import space.ketterling.tidegate.model.Sample;
import space.ketterling.tidegate.model.TideExtreme;
import space.ketterling.tidegate.moon.MoonPhaseKey;
import space.ketterling.tidegate.sun.SunTimesKey;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

/**
 * Read-only access to the cached tide, gate and weather data.
 *
 * <p>
 * Every read first makes sure the cache it reads is fresh, waiting a bounded
 * time for a refresh when it is not. An empty {@link Optional} means there is
 * no data for the requested day.
 * </p>
 */
public final class QueryFacade {
    private final RefreshCoordinator coordinator;
    private final TideIngestService tides;
    private final KeyedCache<SunTimesKey, JsonNode> sunTimes;
    private final KeyedCache<MoonPhaseKey, JsonNode> moonPhases;
    private final KeyedCache<MarineKey, JsonNode> marine;
    private final Clock clock;
    private final ZoneId zone;
    private final int weatherHorizonDays;

    public QueryFacade(RefreshCoordinator coordinator, TideIngestService tides,
            KeyedCache<SunTimesKey, JsonNode> sunTimes, KeyedCache<MoonPhaseKey, JsonNode> moonPhases,
            KeyedCache<MarineKey, JsonNode> marine, Clock clock, ZoneId zone, int weatherHorizonDays) {
        this.coordinator = coordinator;
        this.tides = tides;
        this.sunTimes = sunTimes;
        this.moonPhases = moonPhases;
        this.marine = marine;
        this.clock = clock;
        this.zone = zone;
        this.weatherHorizonDays = weatherHorizonDays;
    }

    /**
     * A page of the current tide height series.
     */
    public List<Sample> samples(int offset, int limit) {
        coordinator.awaitFresh(CacheName.TIDE_HEIGHTS);
        return tides.sampleStore().slice(offset, limit);
    }

    /**
     * Tide heights whose local day lies in {@code [startDay, endDay]}.
     */
    public List<Sample> samplesBetween(LocalDate startDay, LocalDate endDay) {
        coordinator.awaitFresh(CacheName.TIDE_HEIGHTS);
        return tides.sampleStore().between(startDay, endDay, zone);
    }

    /**
     * Gate events for one local day.
     */
    public Optional<List<CrossingEvent>> events(LocalDate day) {
        coordinator.awaitFresh(CacheName.TIDE_HEIGHTS);
        return tides.eventStore().value().forDay(day);
    }

    public EventsByDay allEvents() {
        coordinator.awaitFresh(CacheName.TIDE_HEIGHTS);
        return tides.eventStore().value();
    }

    /**
     * High and low waters for one local day.
     */
    public Optional<List<TideExtreme>> extremes(LocalDate day) {
        coordinator.awaitFresh(CacheName.TIDE_EXTREMES);
        return tides.extremesStore().value().forDay(day);
    }

    /**
     * Forecast for one local day. Only today through today plus the forecast
     * horizon can be answered.
     */
    public Optional<JsonNode> weather(LocalDate day) {
        LocalDate today = LocalDate.now(clock.withZone(zone));
        if (day.isBefore(today) || day.isAfter(today.plusDays(weatherHorizonDays)))
            return Optional.empty();
        coordinator.awaitFresh(CacheName.WEATHER);
        return tides.weatherStore().value().forDay(day);
    }

    /**
     * Sunrise and sunset for a location and day, fetched on first use.
     */
    public JsonNode sunTimes(double lat, double lng, LocalDate day) throws FetchException, InterruptedException {
        return sunTimes.get(new SunTimesKey(lat, lng, day)).deepCopy();
    }

    /**
     * Moon phase at UTC midnight of {@code day}, fetched on first use.
     */
    public JsonNode moonPhase(LocalDate day) throws FetchException, InterruptedException {
        return moonPhases.get(MoonPhaseKey.forDate(day)).deepCopy();
    }

    /**
     * Marine forecast for the given request, fetched on first use.
     */
    public JsonNode marine(MarineKey key) throws FetchException, InterruptedException {
        return marine.get(key).deepCopy();
    }

    public List<RefreshState> cacheStatus() {
        return coordinator.status();
    }

    public ZoneId zone() {
        return zone;
    }
}
