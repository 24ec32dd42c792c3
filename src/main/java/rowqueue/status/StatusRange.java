package rowqueue.status;

import java.util.Objects;

/**
 * Inclusive range of raw status values, used to build {@code BETWEEN} filters
 * on the status column.
 *
 * @param min lowest matching value
 * @param max highest matching value
 */
public record StatusRange(long min, long max) {

    public StatusRange {
        if (min > max) {
            throw new IllegalArgumentException("Empty status range: " + min + " > " + max);
        }
    }

    /** Every status in the given state. */
    public static StatusRange of(State state) {
        Objects.requireNonNull(state, "state is required");
        return new StatusRange(state.minimum(), state.maximum());
    }

    /** Statuses in the given state that sort at or before {@code bound}. */
    public static StatusRange upTo(Status bound) {
        Objects.requireNonNull(bound, "bound is required");
        return new StatusRange(bound.state().minimum(), bound.value());
    }

    public boolean contains(long value) {
        return value >= min && value <= max;
    }

    public boolean contains(Status status) {
        return contains(status.value());
    }
}
