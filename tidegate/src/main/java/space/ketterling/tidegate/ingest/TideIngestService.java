package space.ketterling.tidegate.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.tidegate.cache.DerivedEventStore;
import space.ketterling.tidegate.cache.SampleStore;
import space.ketterling.tidegate.cache.SnapshotStore;
import space.ketterling.tidegate.config.AppConfig;
import space.ketterling.tidegate.derive.EventDeriver;
import space.ketterling.tidegate.http.FetchException;
import space.ketterling.tidegate.model.ByDay;
import space.ketterling.tidegate.model.DailyWeather;
import space.ketterling.tidegate.model.EventsByDay;
import space.ketterling.tidegate.model.SampleSeries;
import space.ketterling.tidegate.model.TideExtreme;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Owns the tide and weather stores and registers them with the
 * {@link RefreshCoordinator}.
 *
 * <p>
 * This service handles three caches:
 * <ul>
 * <li>tide heights, with gate times re-derived after every refresh;</li>
 * <li>tide extremes (high/low water);</li>
 * <li>the daily weather forecast.</li>
 * </ul>
 */
public class TideIngestService {
    private static final Logger log = LoggerFactory.getLogger(TideIngestService.class);

    private final AppConfig cfg;
    private final Clock clock;
    private final SampleFetcher heights;
    private final ExtremesFetcher extremes;
    private final WeatherFetcher weather;
    private final EventDeriver deriver;

    private final SampleStore sampleStore = new SampleStore();
    private final DerivedEventStore eventStore = new DerivedEventStore();
    private final SnapshotStore<ByDay<TideExtreme>> extremesStore = new SnapshotStore<>(ByDay.empty());
    private final SnapshotStore<DailyWeather> weatherStore = new SnapshotStore<>(DailyWeather.empty());

    public TideIngestService(AppConfig cfg, Clock clock, SampleFetcher heights, ExtremesFetcher extremes,
            WeatherFetcher weather, EventDeriver deriver) {
        this.cfg = cfg;
        this.clock = clock;
        this.heights = heights;
        this.extremes = extremes;
        this.weather = weather;
        this.deriver = deriver;
    }

    /**
     * Registers all three caches. Only the tide height cache has a derivation
     * step.
     */
    public void registerWith(RefreshCoordinator coordinator) {
        coordinator.register(CacheName.TIDE_HEIGHTS, cfg.tideHeightsMaxAge(), sampleStore, this::loadHeights,
                this::deriveGateTimes);
        coordinator.register(CacheName.TIDE_EXTREMES, cfg.tideExtremesMaxAge(), extremesStore, this::loadExtremes);
        coordinator.register(CacheName.WEATHER, cfg.weatherMaxAge(), weatherStore, this::loadWeather);
    }

    SampleSeries loadHeights() throws FetchException, InterruptedException {
        return heights.fetchSamples(today(), cfg.tideHeightsDays());
    }

    ByDay<TideExtreme> loadExtremes() throws FetchException, InterruptedException {
        return extremes.fetchExtremes(today(), cfg.tideExtremesDays());
    }

    DailyWeather loadWeather() throws FetchException, InterruptedException {
        return weather.fetchDaily();
    }

    /**
     * Rebuilds gate times from a freshly published series. The derived
     * snapshot carries the series' fetch time.
     */
    void deriveGateTimes(SampleSeries series, Instant fetchedAt) {
        EventsByDay events = deriver.derive(series, cfg.gateOpenHeight(), cfg.clockZoneId());
        eventStore.replace(events, fetchedAt);
        log.info("Derived {} gate events over {} days from {} samples (threshold {})", events.eventCount(),
                events.days().size(), series.size(), cfg.gateOpenHeight());
    }

    private LocalDate today() {
        return LocalDate.now(clock.withZone(cfg.clockZoneId()));
    }

    public SampleStore sampleStore() {
        return sampleStore;
    }

    public DerivedEventStore eventStore() {
        return eventStore;
    }

    public SnapshotStore<ByDay<TideExtreme>> extremesStore() {
        return extremesStore;
    }

    public SnapshotStore<DailyWeather> weatherStore() {
        return weatherStore;
    }

    /**
     * Source of high/low water predictions.
     */
    @FunctionalInterface
    public interface ExtremesFetcher {
        ByDay<TideExtreme> fetchExtremes(LocalDate windowStart, int windowDays)
                throws FetchException, InterruptedException;
    }

    /**
     * Source of the daily weather forecast.
     */
    @FunctionalInterface
    public interface WeatherFetcher {
        DailyWeather fetchDaily() throws FetchException, InterruptedException;
    }
}
