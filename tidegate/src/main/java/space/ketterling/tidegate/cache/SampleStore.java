package space.ketterling.tidegate.cache;

import space.ketterling.tidegate.model.Sample;
import space.ketterling.tidegate.model.SampleSeries;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

/**
 * Latest tide height series.
 */
public final class SampleStore extends SnapshotStore<SampleSeries> {
    public SampleStore() {
        super(SampleSeries.empty());
    }

    public List<Sample> slice(int offset, int limit) {
        return value().slice(offset, limit);
    }

    public List<Sample> between(LocalDate startDay, LocalDate endDay, ZoneId zone) {
        return value().between(startDay, endDay, zone);
    }
}
