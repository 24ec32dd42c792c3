package rowqueue.runner;

import rowqueue.model.QueueRow;

/**
 * Thrown by {@link QueueRunner#run} when the action threw an exception.
 * Errors are rethrown as they are.
 * The row has already been requeued or canceled when this is thrown;
 * {@link #row()} reflects the stored result.
 */
public class JobFailedException extends RuntimeException {

    private final transient QueueRow row;

    public JobFailedException(QueueRow row, Throwable cause) {
        super("Job " + row.id() + " failed: " + cause, cause);
        this.row = row;
    }

    public QueueRow row() {
        return row;
    }
}
