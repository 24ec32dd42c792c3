package rowqueue.config;

import org.junit.jupiter.api.Test;
import rowqueue.runner.InterruptPolicy;
import rowqueue.runner.RunPolicy;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class QueueConfigTest {

    @Test
    void defaults() {
        QueueConfig config = QueueConfig.defaults();

        assertEquals("default", config.queueName());
        assertEquals(10, config.databasePoolSize());
        assertEquals(3, config.retry());
        assertEquals(Duration.ofHours(1), config.timeout());
        assertEquals(Duration.ZERO, config.delay());
        assertEquals(InterruptPolicy.PENALIZE, config.interruptPolicy());
        assertEquals(Duration.ofSeconds(1), config.pollInterval());
        assertTrue(config.databaseUrl().startsWith("jdbc:h2:"));
    }

    @Test
    void runPolicyReflectsSettings() {
        RunPolicy policy = QueueConfig.defaults()
                .withRetry(5)
                .withTimeout(Duration.ofMinutes(10))
                .withDelay(Duration.ofSeconds(30))
                .withInterruptPolicy(InterruptPolicy.CANCEL)
                .runPolicy();

        assertEquals(5, policy.retry());
        assertEquals(Duration.ofMinutes(10), policy.timeout());
        assertEquals(Duration.ofSeconds(30), policy.delay());
        assertEquals(InterruptPolicy.CANCEL, policy.interruptPolicy());
    }

    @Test
    void invalidRetryFailsWhenPolicyIsBuilt() {
        QueueConfig config = QueueConfig.defaults().withRetry(12);

        assertThrows(IllegalArgumentException.class, config::runPolicy);
    }
}
