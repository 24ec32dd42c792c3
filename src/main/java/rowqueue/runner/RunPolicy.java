package rowqueue.runner;

import rowqueue.status.Status;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry, timeout and delay settings for one {@link QueueRunner#run} call.
 * Immutable; the {@code with*} methods return a copy.
 */
public final class RunPolicy {

    public static final int DEFAULT_RETRY = 3;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofHours(1);

    private final int retry;
    private final Duration timeout;
    private final Duration delay;
    private final InterruptPolicy interruptPolicy;

    private RunPolicy(int retry, Duration timeout, Duration delay, InterruptPolicy interruptPolicy) {
        if (retry < 0 || retry > Status.MAX_RETRY) {
            throw new IllegalArgumentException("retry must be within 0.." + Status.MAX_RETRY + ": " + retry);
        }
        Objects.requireNonNull(timeout, "timeout is required");
        Objects.requireNonNull(delay, "delay is required");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative: " + timeout);
        }
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative: " + delay);
        }
        this.retry = retry;
        this.timeout = timeout;
        this.delay = delay;
        this.interruptPolicy = Objects.requireNonNull(interruptPolicy, "interruptPolicy is required");
    }

    /** retry=3, timeout=1h, delay=0, interrupts penalized. */
    public static RunPolicy defaults() {
        return new RunPolicy(DEFAULT_RETRY, DEFAULT_TIMEOUT, Duration.ZERO, InterruptPolicy.PENALIZE);
    }

    /** Number of failed attempts tolerated before a job is canceled. */
    public int retry() {
        return retry;
    }

    /** Lease age after which a WORKING row is reclaimed. */
    public Duration timeout() {
        return timeout;
    }

    /** Wait before a requeued row becomes eligible again. */
    public Duration delay() {
        return delay;
    }

    public InterruptPolicy interruptPolicy() {
        return interruptPolicy;
    }

    public RunPolicy withRetry(int retry) {
        return new RunPolicy(retry, timeout, delay, interruptPolicy);
    }

    public RunPolicy withTimeout(Duration timeout) {
        return new RunPolicy(retry, timeout, delay, interruptPolicy);
    }

    public RunPolicy withDelay(Duration delay) {
        return new RunPolicy(retry, timeout, delay, interruptPolicy);
    }

    public RunPolicy withInterruptPolicy(InterruptPolicy interruptPolicy) {
        return new RunPolicy(retry, timeout, delay, interruptPolicy);
    }

    @Override
    public String toString() {
        return "RunPolicy{" +
                "retry=" + retry +
                ", timeout=" + timeout +
                ", delay=" + delay +
                ", interruptPolicy=" + interruptPolicy +
                '}';
    }
}
