package rowqueue.config;

import rowqueue.runner.InterruptPolicy;
import rowqueue.runner.RunPolicy;

import java.time.Duration;
import java.util.Locale;

/**
 * Configuration holder for queue settings.
 * All settings have sensible defaults.
 */
public final class QueueConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/rowqueue;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Queue settings
    private String queueName = "default";
    private int retry = RunPolicy.DEFAULT_RETRY;
    private Duration timeout = RunPolicy.DEFAULT_TIMEOUT;
    private Duration delay = Duration.ZERO;
    private InterruptPolicy interruptPolicy = InterruptPolicy.PENALIZE;

    // Poller settings
    private Duration pollInterval = Duration.ofSeconds(1);

    private QueueConfig() {
    }

    public static QueueConfig defaults() {
        return new QueueConfig();
    }

    public static QueueConfig fromEnv() {
        QueueConfig config = new QueueConfig();

        // Override from environment variables
        String dbUrl = System.getenv("ROWQUEUE_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String queue = System.getenv("ROWQUEUE_QUEUE");
        if (queue != null && !queue.isBlank()) {
            config.queueName = queue;
        }

        String retry = System.getenv("ROWQUEUE_RETRY");
        if (retry != null && !retry.isBlank()) {
            config.retry = Integer.parseInt(retry.trim());
        }

        String timeout = System.getenv("ROWQUEUE_TIMEOUT_SECONDS");
        if (timeout != null && !timeout.isBlank()) {
            config.timeout = Duration.ofSeconds(Long.parseLong(timeout.trim()));
        }

        String delay = System.getenv("ROWQUEUE_DELAY_SECONDS");
        if (delay != null && !delay.isBlank()) {
            config.delay = Duration.ofSeconds(Long.parseLong(delay.trim()));
        }

        String pollMs = System.getenv("ROWQUEUE_POLL_MS");
        if (pollMs != null && !pollMs.isBlank()) {
            config.pollInterval = Duration.ofMillis(Long.parseLong(pollMs.trim()));
        }

        String interrupts = System.getenv("ROWQUEUE_INTERRUPT_POLICY");
        if (interrupts != null && !interrupts.isBlank()) {
            config.interruptPolicy = InterruptPolicy.valueOf(interrupts.trim().toUpperCase(Locale.ROOT));
        }

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public String queueName() {
        return queueName;
    }

    public int retry() {
        return retry;
    }

    public Duration timeout() {
        return timeout;
    }

    public Duration delay() {
        return delay;
    }

    public InterruptPolicy interruptPolicy() {
        return interruptPolicy;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    /**
     * Run policy built from these settings.
     *
     * @throws IllegalArgumentException if retry, timeout or delay are out of range
     */
    public RunPolicy runPolicy() {
        return RunPolicy.defaults()
                .withRetry(retry)
                .withTimeout(timeout)
                .withDelay(delay)
                .withInterruptPolicy(interruptPolicy);
    }

    // Fluent setters for testing/customization
    public QueueConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public QueueConfig withDatabasePoolSize(int poolSize) {
        this.databasePoolSize = poolSize;
        return this;
    }

    public QueueConfig withQueueName(String queueName) {
        this.queueName = queueName;
        return this;
    }

    public QueueConfig withRetry(int retry) {
        this.retry = retry;
        return this;
    }

    public QueueConfig withTimeout(Duration timeout) {
        this.timeout = timeout;
        return this;
    }

    public QueueConfig withDelay(Duration delay) {
        this.delay = delay;
        return this;
    }

    public QueueConfig withInterruptPolicy(InterruptPolicy interruptPolicy) {
        this.interruptPolicy = interruptPolicy;
        return this;
    }

    public QueueConfig withPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
        return this;
    }

    @Override
    public String toString() {
        return "QueueConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", queue='" + queueName + '\'' +
                ", retry=" + retry +
                ", timeout=" + timeout +
                ", delay=" + delay +
                ", pollInterval=" + pollInterval +
                ", interruptPolicy=" + interruptPolicy +
                '}';
    }
}
