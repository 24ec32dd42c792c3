package rowqueue.status;

/**
 * Queue state, stored as the most significant digit of a {@link Status}.
 */
public enum State {
    /** Row exists but is not yet eligible; the application moves it to WAITING */
    CREATED(1),
    /** Eligible to be claimed once its priority time has passed */
    WAITING(2),
    /** Leased by a worker; priority holds the lease start */
    WORKING(3),
    /** Processed successfully */
    FINISHED(4),
    /** Given up: cancelled explicitly or out of attempts */
    CANCELED(5);

    private final int code;

    State(int code) {
        this.code = code;
    }

    /** The digit stored in the status column. */
    public int code() {
        return code;
    }

    /** Smallest status value carrying this state. */
    public long minimum() {
        return code * Status.STATE_UNIT;
    }

    /** Largest status value carrying this state. */
    public long maximum() {
        return (code + 1) * Status.STATE_UNIT - 1;
    }

    public boolean isTerminal() {
        return this == FINISHED || this == CANCELED;
    }

    /**
     * Decode a state digit.
     *
     * @throws IllegalArgumentException if the digit is not one of the five states
     */
    public static State fromCode(int code) {
        for (State state : values()) {
            if (state.code == code) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown queue state: " + code);
    }
}
