package rowqueue.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rowqueue.api.dto.QueueStatsResponse;
import rowqueue.api.dto.StatusView;
import rowqueue.model.QueueRow;
import rowqueue.repository.QueueTable;
import rowqueue.status.State;
import rowqueue.status.Status;
import rowqueue.status.StatusRange;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Monitoring and manual operations on a queue, outside the run cycle.
 */
public class QueueService {

    private static final Logger log = LoggerFactory.getLogger(QueueService.class);

    private final QueueTable table;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper();

    public QueueService(QueueTable table, Clock clock) {
        this.table = table;
        this.clock = clock;
    }

    /**
     * Row counts per state.
     */
    public QueueStatsResponse stats() {
        return QueueStatsResponse.from(table.name(), table.tally());
    }

    /**
     * Render stats as JSON.
     */
    public String toJson(QueueStatsResponse stats) {
        try {
            return mapper.writeValueAsString(stats);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to render stats for " + stats.queue(), e);
        }
    }

    /**
     * Decoded status of one row.
     */
    public Optional<StatusView> describe(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id is required");
        }
        return table.findById(id).map(row -> StatusView.from(row.id(), row.status()));
    }

    /**
     * Rows in a state, in queue order.
     */
    public List<StatusView> listByState(State state, int limit) {
        if (state == null) {
            throw new IllegalArgumentException("state is required");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }

        List<StatusView> views = new ArrayList<>();
        for (QueueRow row : table.findInRange(StatusRange.of(state), limit)) {
            views.add(StatusView.from(row.id(), row.status()));
        }
        return views;
    }

    /**
     * Move a finished or canceled row back to WAITING, eligible now.
     * Attempts are kept, so a row that ran out of attempts gets exactly one more try.
     *
     * @return true if requeued, false if the row is missing or not terminal
     */
    public boolean requeue(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id is required");
        }

        Optional<QueueRow> found = table.findById(id);
        if (found.isEmpty()) {
            log.warn("Cannot requeue row {} in {}: not found", id, table.name());
            return false;
        }

        QueueRow row = found.get();
        if (!row.state().isTerminal()) {
            log.warn("Cannot requeue row {} in {}: state is {}", id, table.name(), row.state());
            return false;
        }

        Status next = Status.waiting(clock.instant(), row.status().attempts());
        boolean requeued = table.inTransaction(tx -> tx.compareAndSet(row, next));
        if (requeued) {
            log.info("Row {} in {} requeued from {}", id, table.name(), row.state());
        }
        return requeued;
    }
}
