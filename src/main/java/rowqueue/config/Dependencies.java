package rowqueue.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rowqueue.repository.QueueTable;
import rowqueue.repository.TaskRepository;
import rowqueue.runner.QueueAction;
import rowqueue.runner.QueueRunner;
import rowqueue.scheduler.QueuePoller;
import rowqueue.service.QueueService;
import rowqueue.store.Database;
import rowqueue.store.JdbcTaskRepository;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Manual dependency injection container.
 * Creates and wires the queue over the bundled task table.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(QueueConfig.fromEnv());
 * deps.startPoller(row -> { ... return Outcome.success(); });
 * // ... enqueue tasks through deps.taskRepository() ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final QueueConfig config;
    private final Clock clock;
    private final Database database;
    private final TaskRepository taskRepository;
    private final QueueTable queueTable;
    private final QueueRunner queueRunner;
    private final QueueService queueService;

    private final List<QueuePoller> pollers = new ArrayList<>();

    private Dependencies(QueueConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.taskRepository = new JdbcTaskRepository(database);
        this.queueTable = taskRepository.queueTable(config.queueName());

        // Queue
        this.queueRunner = new QueueRunner(queueTable, clock);
        this.queueService = new QueueService(queueTable, clock);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(QueueConfig config) {
        return new Dependencies(config, Clock.systemUTC());
    }

    /**
     * Create dependencies with the given config and time source.
     */
    public static Dependencies create(QueueConfig config, Clock clock) {
        return new Dependencies(config, clock);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(QueueConfig.fromEnv());
    }

    // Getters
    public QueueConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public Database database() {
        return database;
    }

    public TaskRepository taskRepository() {
        return taskRepository;
    }

    public QueueTable queueTable() {
        return queueTable;
    }

    public QueueRunner queueRunner() {
        return queueRunner;
    }

    public QueueService queueService() {
        return queueService;
    }

    /**
     * Create a poller for the configured queue. The caller starts it;
     * it is stopped on {@link #close()}.
     */
    public synchronized QueuePoller poller(QueueAction action) {
        QueuePoller poller = new QueuePoller(queueRunner, action, config.runPolicy(), config.pollInterval());
        pollers.add(poller);
        return poller;
    }

    /**
     * Create and start a poller for the configured queue.
     */
    public QueuePoller startPoller(QueueAction action) {
        QueuePoller poller = poller(action);
        poller.start();
        return poller;
    }

    @Override
    public synchronized void close() {
        log.info("Closing dependencies...");

        // Stop pollers first
        for (QueuePoller poller : pollers) {
            try {
                poller.stop();
            } catch (Exception e) {
                log.warn("Error stopping poller: {}", e.getMessage());
            }
        }
        pollers.clear();

        // Close database
        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
