package rowqueue.runner;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of processing one claimed row.
 */
public final class Outcome {

    public enum Kind {
        /** Processed; the row finishes */
        SUCCESS,
        /** Try again later without spending an attempt */
        RETRY,
        /** Failed attempt; requeued while attempts remain, else canceled */
        ABORT,
        /** Stop now; the row is canceled */
        CANCEL,
        /** The action threw an exception or error; resolved like ABORT and rethrown to the caller */
        FAULT
    }

    private static final Outcome SUCCESS = new Outcome(Kind.SUCCESS, null, null);
    private static final Outcome CANCEL = new Outcome(Kind.CANCEL, null, null);

    private final Kind kind;
    private final Duration delay;
    private final Throwable fault;

    private Outcome(Kind kind, Duration delay, Throwable fault) {
        this.kind = kind;
        this.delay = delay;
        this.fault = fault;
    }

    public static Outcome success() {
        return SUCCESS;
    }

    /** Requeue without penalty after the policy delay. */
    public static Outcome retry() {
        return new Outcome(Kind.RETRY, null, null);
    }

    /** Requeue without penalty after the given delay. */
    public static Outcome retry(Duration delay) {
        return new Outcome(Kind.RETRY, requireDelay(delay), null);
    }

    /** Spend an attempt and requeue after the policy delay. */
    public static Outcome abort() {
        return new Outcome(Kind.ABORT, null, null);
    }

    /** Spend an attempt and requeue after the given delay. */
    public static Outcome abort(Duration delay) {
        return new Outcome(Kind.ABORT, requireDelay(delay), null);
    }

    public static Outcome cancel() {
        return CANCEL;
    }

    public static Outcome fault(Throwable fault) {
        return new Outcome(Kind.FAULT, null, Objects.requireNonNull(fault, "fault is required"));
    }

    public Kind kind() {
        return kind;
    }

    /** Delay override carried by RETRY or ABORT, if any. */
    public Optional<Duration> delay() {
        return Optional.ofNullable(delay);
    }

    /** The exception or error carried by FAULT, otherwise null. */
    public Throwable fault() {
        return fault;
    }

    private static Duration requireDelay(Duration delay) {
        Objects.requireNonNull(delay, "delay is required");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative: " + delay);
        }
        return delay;
    }

    @Override
    public String toString() {
        return "Outcome{" + kind + (delay != null ? ", delay=" + delay : "")
                + (fault != null ? ", fault=" + fault : "") + "}";
    }
}
