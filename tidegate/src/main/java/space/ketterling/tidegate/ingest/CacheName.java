package space.ketterling.tidegate.ingest;

import java.util.Locale;

/**
 * Logical caches kept fresh by {@link RefreshCoordinator}.
 */
public enum CacheName {
    TIDE_HEIGHTS,
    TIDE_EXTREMES,
    WEATHER;

    /**
     * Name used for the MDC job key and in logs, e.g. {@code tide-heights}.
     */
    public String jobName() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
