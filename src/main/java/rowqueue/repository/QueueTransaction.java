package rowqueue.repository;

import rowqueue.model.QueueRow;
import rowqueue.status.Status;
import rowqueue.status.StatusRange;

import java.util.Optional;

/**
 * Operations available inside a queue transaction.
 */
public interface QueueTransaction {

    /**
     * Select and exclusively lock the row with the lowest status in range.
     * The lock is held until the enclosing transaction ends.
     *
     * @param range inclusive status range
     * @return the locked row, or empty if no row matches
     */
    Optional<QueueRow> lockFirst(StatusRange range);

    /**
     * Overwrite the status of a row, but only if it still holds {@code row.status()}.
     *
     * @param row  the row as last read
     * @param next the status to write
     * @return true if written, false if the stored status had changed
     */
    boolean compareAndSet(QueueRow row, Status next);
}
