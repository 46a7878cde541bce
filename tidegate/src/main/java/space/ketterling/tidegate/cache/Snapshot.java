package space.ketterling.tidegate.cache;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * An immutable value together with the time it was fetched. {@code fetchedAt}
 * is null for the empty start-up snapshot.
 */
public record Snapshot<T>(T value, Instant fetchedAt) {
    public Snapshot {
        Objects.requireNonNull(value, "value");
    }

    public Optional<Instant> lastFetched() {
        return Optional.ofNullable(fetchedAt);
    }
}
