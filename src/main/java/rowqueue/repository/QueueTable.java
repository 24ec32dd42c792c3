package rowqueue.repository;

import rowqueue.model.QueueRow;
import rowqueue.model.QueueTally;
import rowqueue.status.StatusRange;

import java.util.List;
import java.util.Optional;

/**
 * A collection of rows plus the column holding their queue status.
 * Implementations delegate atomicity and locking to the backing store.
 */
public interface QueueTable {

    /**
     * Name of the collection, for logs and monitoring.
     */
    String name();

    /**
     * Run work in one atomic transaction.
     * The transaction commits when work returns and rolls back if it throws.
     *
     * @param work the work to run
     * @return whatever work returned
     */
    <T> T inTransaction(TransactionWork<T> work);

    /**
     * Find a row by its id, outside any queue transaction.
     *
     * @param id the row id
     * @return the row if present in this collection
     */
    Optional<QueueRow> findById(String id);

    /**
     * List rows whose status falls in a range, in status order.
     *
     * @param range inclusive status range
     * @param limit maximum number of rows
     * @return matching rows
     */
    List<QueueRow> findInRange(StatusRange range, int limit);

    /**
     * Count rows per state.
     *
     * @return counts for every state, zero where empty
     */
    QueueTally tally();

    /**
     * Unit of work executed inside {@link #inTransaction(TransactionWork)}.
     */
    @FunctionalInterface
    interface TransactionWork<T> {
        T execute(QueueTransaction tx);
    }
}
