package space.ketterling.tidegate.ingest;

import space.ketterling.tidegate.http.FetchException;
import space.ketterling.tidegate.model.SampleSeries;

import java.time.LocalDate;

/**
 * Source of tide height samples for a window of days.
 */
@FunctionalInterface
public interface SampleFetcher {
    SampleSeries fetchSamples(LocalDate windowStart, int windowDays) throws FetchException, InterruptedException;
}
