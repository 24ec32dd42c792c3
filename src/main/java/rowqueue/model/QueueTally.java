package rowqueue.model;

import rowqueue.status.State;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Row counts per queue state.
 */
public final class QueueTally {
    private final EnumMap<State, Long> counts;

    public QueueTally(Map<State, Long> counts) {
        this.counts = new EnumMap<>(State.class);
        for (State state : State.values()) {
            Long count = counts.get(state);
            this.counts.put(state, count != null ? count : 0L);
        }
    }

    public long count(State state) {
        return counts.get(state);
    }

    public long total() {
        long total = 0;
        for (long count : counts.values()) {
            total += count;
        }
        return total;
    }

    /** Counts keyed by state, in state order. */
    public Map<State, Long> asMap() {
        return Collections.unmodifiableMap(counts);
    }

    @Override
    public String toString() {
        return "QueueTally" + counts;
    }
}
