package rowqueue.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rowqueue.model.QueueRow;
import rowqueue.repository.QueueTable;
import rowqueue.repository.QueueTransaction;
import rowqueue.status.State;
import rowqueue.status.Status;
import rowqueue.status.StatusRange;

import java.io.InterruptedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Claims, processes and resolves one row per call.
 *
 * Each call:
 * 1. In one transaction, reclaims the oldest expired lease (if any), then locks
 * the oldest eligible WAITING row and moves it to WORKING.
 * 2. Runs the action with no transaction held.
 * 3. In a new transaction, writes the row's next status based on the outcome.
 *
 * The runner keeps no state between calls; callers loop on {@link #run} and back
 * off when it returns empty.
 */
public class QueueRunner {

    private static final Logger log = LoggerFactory.getLogger(QueueRunner.class);

    /** Claim transactions retried after losing a row to a concurrent claimant. */
    static final int CLAIM_ATTEMPTS = 3;

    private final QueueTable table;
    private final Clock clock;

    public QueueRunner(QueueTable table) {
        this(table, Clock.systemUTC());
    }

    public QueueRunner(QueueTable table, Clock clock) {
        this.table = Objects.requireNonNull(table, "table is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public QueueTable table() {
        return table;
    }

    /**
     * Run one cycle with the default policy.
     *
     * @see #run(QueueAction, RunPolicy)
     */
    public Optional<QueueRow> run(QueueAction action) {
        return run(action, RunPolicy.defaults());
    }

    /**
     * Run one claim-process-resolve cycle.
     *
     * @param action work applied to the claimed row
     * @param policy retry, timeout and delay settings
     * @return the processed row with its resolved status, or empty if nothing was eligible
     * @throws JobFailedException if the action threw; the row is already resolved
     */
    public Optional<QueueRow> run(QueueAction action, RunPolicy policy) {
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(policy, "policy is required");

        Optional<QueueRow> claimed = claim(policy);
        if (claimed.isEmpty()) {
            log.debug("No eligible rows in {}", table.name());
            return Optional.empty();
        }

        QueueRow row = claimed.get();
        Outcome outcome;
        try {
            outcome = action.process(row);
            if (outcome == null) {
                outcome = Outcome.fault(new IllegalStateException("Action returned no outcome for row " + row.id()));
            }
        } catch (Exception | Error e) {
            outcome = Outcome.fault(e);
        }

        // Pool checkout fails on an interrupted thread; hold the flag until the row is stored
        boolean interrupted = Thread.interrupted();
        QueueRow resolved;
        try {
            resolved = resolve(row, outcome, policy);
        } catch (RuntimeException e) {
            if (outcome.fault() != null) {
                e.addSuppressed(outcome.fault());
            }
            throw e;
        } finally {
            if (interrupted || isInterrupt(outcome.fault())) {
                Thread.currentThread().interrupt();
            }
        }

        if (outcome.kind() == Outcome.Kind.FAULT) {
            Throwable fault = outcome.fault();
            log.warn("Job {} in {} failed, stored as {}", row.id(), table.name(), resolved.status(), fault);
            if (fault instanceof Error error) {
                throw error;
            }
            throw new JobFailedException(resolved, fault);
        }
        return Optional.of(resolved);
    }

    private Optional<QueueRow> claim(RunPolicy policy) {
        for (int attempt = 1; attempt <= CLAIM_ATTEMPTS; attempt++) {
            Claim claim = table.inTransaction(tx -> {
                reclaimExpired(tx, policy);

                Instant now = clock.instant();
                Optional<QueueRow> waiter = tx.lockFirst(
                        StatusRange.upTo(Status.waiting(now, Status.MAX_ATTEMPTS)));
                if (waiter.isEmpty()) {
                    return Claim.NONE;
                }

                QueueRow row = waiter.get();
                Status leased = Status.working(now, row.status().attempts());
                if (!tx.compareAndSet(row, leased)) {
                    return Claim.CONFLICT;
                }
                return new Claim(row.withStatus(leased), false);
            });

            if (!claim.conflict()) {
                if (claim.row() != null) {
                    log.debug("Claimed row {} in {} (attempts {})",
                            claim.row().id(), table.name(), claim.row().status().attempts());
                }
                return Optional.ofNullable(claim.row());
            }
            log.debug("Lost claim race in {} (try {} of {})", table.name(), attempt, CLAIM_ATTEMPTS);
        }
        return Optional.empty();
    }

    /**
     * Reclaim at most one expired lease. The boundary uses the highest attempts
     * digit so every lease older than the timeout qualifies.
     */
    private void reclaimExpired(QueueTransaction tx, RunPolicy policy) {
        Instant now = clock.instant();
        if (policy.timeout().compareTo(Duration.between(Status.MIN_MOMENT, now)) > 0) {
            return; // no lease can be older than the first encodable moment
        }
        Status boundary = Status.working(now.minus(policy.timeout()), Status.MAX_ATTEMPTS);

        tx.lockFirst(StatusRange.upTo(boundary)).ifPresent(expired -> {
            Status next = penalize(expired.status().attempts(), now, policy.delay(), policy);
            if (tx.compareAndSet(expired, next)) {
                if (next.is(State.CANCELED)) {
                    log.warn("Expired lease on row {} in {} canceled after {} attempts",
                            expired.id(), table.name(), next.attempts());
                } else {
                    log.info("Reclaimed expired lease on row {} in {} (attempt {} of {})",
                            expired.id(), table.name(), next.attempts(), policy.retry());
                }
            }
        });
    }

    private QueueRow resolve(QueueRow row, Outcome outcome, RunPolicy policy) {
        Status next = nextStatus(row.status(), outcome, policy, clock.instant());

        boolean written = table.inTransaction(tx -> tx.compareAndSet(row, next));
        if (!written) {
            // The lease expired and another caller reclaimed the row
            log.warn("Lease on row {} in {} was lost before resolving as {}; keeping stored status",
                    row.id(), table.name(), next.state());
            return table.findById(row.id()).orElse(row);
        }

        if (next.is(State.CANCELED)) {
            log.warn("Row {} in {} canceled after {} attempts ({})",
                    row.id(), table.name(), next.attempts(), outcome.kind());
        } else if (next.is(State.WAITING)) {
            log.info("Row {} in {} requeued at {} ({}, attempts {})",
                    row.id(), table.name(), next.moment(), outcome.kind(), next.attempts());
        } else {
            log.debug("Row {} in {} finished (attempts {})", row.id(), table.name(), next.attempts());
        }
        return row.withStatus(next);
    }

    /**
     * Status a leased row moves to for the given outcome.
     */
    static Status nextStatus(Status leased, Outcome outcome, RunPolicy policy, Instant now) {
        int attempts = leased.attempts();
        return switch (outcome.kind()) {
            case SUCCESS -> Status.finished(now, increment(attempts));
            case RETRY -> Status.waiting(after(now, outcome.delay().orElse(policy.delay())), attempts);
            case ABORT -> penalize(attempts, now, outcome.delay().orElse(policy.delay()), policy);
            case CANCEL -> Status.canceled(now, increment(attempts));
            case FAULT -> isInterrupt(outcome.fault()) && policy.interruptPolicy() == InterruptPolicy.CANCEL
                    ? Status.canceled(now, increment(attempts))
                    : penalize(attempts, now, policy.delay(), policy);
        };
    }

    private static Status penalize(int attempts, Instant now, Duration delay, RunPolicy policy) {
        int next = increment(attempts);
        return next <= policy.retry()
                ? Status.waiting(after(now, delay), next)
                : Status.canceled(now, next);
    }

    /** {@code now + delay}, parked at the last encodable moment when the delay reaches past it. */
    static Instant after(Instant now, Duration delay) {
        return delay.compareTo(Duration.between(now, Status.MAX_MOMENT)) > 0
                ? Status.MAX_MOMENT
                : now.plus(delay);
    }

    // Never past the single digit
    private static int increment(int attempts) {
        return Math.min(attempts + 1, Status.MAX_ATTEMPTS);
    }

    private static boolean isInterrupt(Throwable fault) {
        return fault instanceof InterruptedException || fault instanceof InterruptedIOException;
    }

    private record Claim(QueueRow row, boolean conflict) {
        static final Claim NONE = new Claim(null, false);
        static final Claim CONFLICT = new Claim(null, true);
    }
}
