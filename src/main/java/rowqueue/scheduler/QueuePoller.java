package rowqueue.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rowqueue.runner.JobFailedException;
import rowqueue.runner.QueueAction;
import rowqueue.runner.QueueRunner;
import rowqueue.runner.RunPolicy;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Background loop around a {@link QueueRunner}:
 * - drains the queue by calling run until it reports no work
 * - then waits the poll interval before trying again
 *
 * Job failures are logged and do not stop the loop. Uses a single-threaded
 * executor; run several pollers for parallel workers.
 */
public class QueuePoller implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(QueuePoller.class);

    private final QueueRunner runner;
    private final QueueAction action;
    private final RunPolicy policy;
    private final Duration pollInterval;
    private final ScheduledExecutorService executor;

    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    private volatile boolean running = false;
    private volatile boolean stopping = false;

    public QueuePoller(QueueRunner runner, QueueAction action, RunPolicy policy, Duration pollInterval) {
        this.runner = Objects.requireNonNull(runner, "runner is required");
        this.action = Objects.requireNonNull(action, "action is required");
        this.policy = Objects.requireNonNull(policy, "policy is required");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval is required");
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive: " + pollInterval);
        }
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "rowqueue-poller-" + runner.table().name());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start polling. A stopped poller cannot be restarted.
     */
    public void start() {
        if (stopping) {
            throw new IllegalStateException("Poller for " + runner.table().name() + " was stopped");
        }
        if (running) {
            log.warn("Poller for {} already running", runner.table().name());
            return;
        }

        running = true;

        long intervalMs = pollInterval.toMillis();
        executor.scheduleWithFixedDelay(this::tick, 0, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Poller for {} started, idle interval {}ms", runner.table().name(), intervalMs);
    }

    /**
     * Stop the poller gracefully.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        stopping = true;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Poller for {} forcefully stopped", runner.table().name());
            } else {
                log.info("Poller for {} stopped gracefully", runner.table().name());
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /** Rows resolved by this poller, failed ones included. */
    public long processedCount() {
        return processed.get();
    }

    /** Rows whose action threw. */
    public long failedCount() {
        return failed.get();
    }

    /**
     * Process rows until the queue reports no eligible work.
     * Usable directly, without starting the background loop.
     *
     * @return number of rows processed in this pass
     */
    public int drain() {
        int count = 0;
        while (!stopping && !Thread.currentThread().isInterrupted()) {
            try {
                if (runner.run(action, policy).isEmpty()) {
                    break;
                }
            } catch (JobFailedException e) {
                failed.incrementAndGet();
                log.debug("Job {} failed, continuing: {}", e.row().id(), e.getCause().toString());
            }
            processed.incrementAndGet();
            count++;
        }
        return count;
    }

    private void tick() {
        try {
            int count = drain();
            if (count > 0) {
                log.debug("Poller for {} processed {} rows", runner.table().name(), count);
            }
        } catch (Exception | Error e) {
            // An escaping throwable would cancel the schedule
            log.error("Poller for {} error", runner.table().name(), e);
        }
    }
}
