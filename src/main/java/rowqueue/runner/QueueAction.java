package rowqueue.runner;

import rowqueue.model.QueueRow;

/**
 * Work applied to a claimed row.
 * Runs with no queue lock held. It may update application columns but must
 * never write the status column; the runner owns it.
 */
@FunctionalInterface
public interface QueueAction {

    /**
     * Process a claimed row.
     *
     * @param row the row, in WORKING state
     * @return how the row should be resolved
     * @throws Exception any failure; resolved as {@link Outcome.Kind#FAULT}
     */
    Outcome process(QueueRow row) throws Exception;

    /**
     * Adapt a handler that signals success by returning normally.
     */
    static QueueAction of(RowHandler handler) {
        return row -> {
            handler.handle(row);
            return Outcome.success();
        };
    }

    @FunctionalInterface
    interface RowHandler {
        void handle(QueueRow row) throws Exception;
    }
}
