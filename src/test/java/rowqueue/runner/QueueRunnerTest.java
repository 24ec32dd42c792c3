package rowqueue.runner;

import org.junit.jupiter.api.*;
import rowqueue.MutableClock;
import rowqueue.model.QueueRow;
import rowqueue.model.Task;
import rowqueue.repository.QueueTable;
import rowqueue.status.State;
import rowqueue.status.Status;
import rowqueue.store.Database;
import rowqueue.store.JdbcQueueTable;
import rowqueue.store.JdbcTaskRepository;

import java.io.InterruptedIOException;
import java.sql.Connection;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class QueueRunnerTest {

    private static Database db;
    private static JdbcTaskRepository repo;

    private MutableClock clock;
    private QueueRunner runner;

    @BeforeAll
    static void setupDb() {
        db = new Database("jdbc:h2:mem:runner-test;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 4);
        repo = new JdbcTaskRepository(db);
    }

    @AfterAll
    static void closeDb() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanup() throws Exception {
        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement()) {
            st.execute("DELETE FROM tasks");
            conn.commit();
        }
        clock = MutableClock.at("2024-05-01T12:00:00Z");
        runner = new QueueRunner(repo.queueTable("default"), clock);
    }

    @Test
    void successFinishesRowWithOneAttempt() {
        save("t1", Status.waiting(clock.instant()));

        Optional<QueueRow> result = runner.run(row -> Outcome.success());

        assertTrue(result.isPresent());
        assertEquals("t1", result.get().id());
        assertEquals(State.FINISHED, result.get().state());
        assertEquals(1, result.get().status().attempts());
        assertEquals(result.get().status(), stored("t1"));
    }

    @Test
    void actionSeesLeasedRow() {
        save("t1", Status.waiting(clock.instant()));

        runner.run(row -> {
            assertEquals(State.WORKING, row.state());
            assertEquals(clock.instant(), row.status().moment());
            // Lease is committed before the action runs
            assertEquals(State.WORKING, stored("t1").state());
            assertEquals("payload-t1", row.getString("payload"));
            return Outcome.success();
        });

        assertEquals(State.FINISHED, stored("t1").state());
    }

    @Test
    void handlerAdapterSucceedsWhenHandlerReturns() {
        save("t1", Status.waiting(clock.instant()));
        List<String> seen = new ArrayList<>();

        runner.run(QueueAction.of(row -> seen.add(row.id())));

        assertEquals(List.of("t1"), seen);
        assertEquals(State.FINISHED, stored("t1").state());
    }

    @Test
    void rowsRunInPriorityOrder() {
        Instant now = clock.instant();
        for (int i = 0; i < 10; i++) {
            // Saved newest first so insertion order differs from priority order
            save("t" + (9 - i), Status.waiting(now.minusSeconds(i + 1)));
        }
        List<String> order = new ArrayList<>();

        for (int i = 0; i < 10; i++) {
            runner.run(row -> {
                order.add(row.id());
                return Outcome.success();
            });
        }

        assertEquals(List.of("t0", "t1", "t2", "t3", "t4", "t5", "t6", "t7", "t8", "t9"), order);
        assertTrue(runner.run(row -> Outcome.success()).isEmpty());
    }

    @Test
    void createdRowsAreNeverClaimed() {
        save("t1", Status.created(clock.instant().minusSeconds(60)));

        assertTrue(runner.run(row -> fail("created row must not run")).isEmpty());
        assertEquals(State.CREATED, stored("t1").state());
    }

    @Test
    void terminalRowsAreIgnored() {
        save("done", Status.finished(clock.instant().minusSeconds(60), 1));
        save("gone", Status.canceled(clock.instant().minusSeconds(60), 4));

        assertTrue(runner.run(row -> fail("terminal row must not run")).isEmpty());
    }

    @Test
    void futureRowWaitsForItsTime() {
        save("later", Status.waiting(clock.instant().plus(Duration.ofHours(1))));

        assertTrue(runner.run(row -> Outcome.success()).isEmpty());

        clock.advance(Duration.ofHours(1));
        Optional<QueueRow> result = runner.run(row -> Outcome.success());
        assertTrue(result.isPresent());
        assertEquals("later", result.get().id());
    }

    @Test
    void otherQueuesAreNotClaimed() {
        repo.save(Task.builder()
                .id("elsewhere")
                .queue("other")
                .payload("x")
                .status(Status.waiting(clock.instant().minusSeconds(1)))
                .build());

        assertTrue(runner.run(row -> Outcome.success()).isEmpty());

        QueueRunner other = new QueueRunner(repo.queueTable("other"), clock);
        assertEquals("elsewhere", other.run(row -> Outcome.success()).orElseThrow().id());
    }

    // Timeouts

    @Test
    void expiredLeaseIsReclaimedAndRunInSameCall() {
        save("stuck", Status.working(clock.instant().minus(Duration.ofHours(2))));

        Optional<QueueRow> result = runner.run(row -> Outcome.success());

        assertTrue(result.isPresent());
        assertEquals(State.FINISHED, result.get().state());
        assertEquals(2, result.get().status().attempts());
    }

    @Test
    void recentLeaseIsLeftAlone() {
        save("busy", Status.working(clock.instant().minus(Duration.ofMinutes(30))));

        assertTrue(runner.run(row -> Outcome.success()).isEmpty());
        assertEquals(State.WORKING, stored("busy").state());
        assertEquals(0, stored("busy").attempts());
    }

    @Test
    void expiredLeaseWithDelayIsRequeuedForLater() {
        save("stuck", Status.working(clock.instant().minus(Duration.ofHours(1))));
        RunPolicy policy = RunPolicy.defaults().withDelay(Duration.ofHours(1));

        assertTrue(runner.run(row -> Outcome.success(), policy).isEmpty());

        Status status = stored("stuck");
        assertEquals(State.WAITING, status.state());
        assertEquals(1, status.attempts());
        assertEquals(clock.instant().plus(Duration.ofHours(1)), status.moment());

        assertTrue(runner.run(row -> Outcome.success(), policy).isEmpty());
    }

    @Test
    void onlyOneExpiredLeaseIsReclaimedPerCall() {
        save("older", Status.working(clock.instant().minus(Duration.ofHours(3))));
        save("newer", Status.working(clock.instant().minus(Duration.ofHours(2))));
        RunPolicy policy = RunPolicy.defaults().withDelay(Duration.ofMinutes(10));

        runner.run(row -> Outcome.success(), policy);

        assertEquals(State.WAITING, stored("older").state());
        assertEquals(State.WORKING, stored("newer").state());

        runner.run(row -> Outcome.success(), policy);

        assertEquals(State.WAITING, stored("newer").state());
    }

    @Test
    void reclaimHappensEvenWhenAnotherRowIsClaimed() {
        save("stuck", Status.working(clock.instant().minus(Duration.ofHours(2))));
        save("ready", Status.waiting(clock.instant().minusSeconds(5)));

        Optional<QueueRow> result = runner.run(row -> Outcome.success());

        assertEquals("ready", result.orElseThrow().id());
        Status stuck = stored("stuck");
        assertEquals(State.WAITING, stuck.state());
        assertEquals(1, stuck.attempts());
    }

    @Test
    void expiredLeaseOutOfAttemptsIsCanceled() {
        save("stuck", Status.working(clock.instant().minus(Duration.ofHours(2)), 3));

        assertTrue(runner.run(row -> Outcome.success()).isEmpty());

        Status status = stored("stuck");
        assertEquals(State.CANCELED, status.state());
        assertEquals(4, status.attempts());
    }

    // Failures

    @Test
    void failingJobIsCanceledOnceRetriesRunOut() {
        save("bad", Status.waiting(clock.instant()));
        QueueAction alwaysFails = row -> {
            throw new IllegalStateException("boom");
        };

        for (int attempt = 1; attempt <= 3; attempt++) {
            JobFailedException e = assertThrows(JobFailedException.class, () -> runner.run(alwaysFails));
            assertEquals("boom", e.getCause().getMessage());
            assertEquals(State.WAITING, e.row().state());
            assertEquals(attempt, e.row().status().attempts());
            assertEquals(e.row().status(), stored("bad"));
        }

        JobFailedException last = assertThrows(JobFailedException.class, () -> runner.run(alwaysFails));
        assertEquals(State.CANCELED, last.row().state());
        assertEquals(4, last.row().status().attempts());

        assertTrue(runner.run(alwaysFails).isEmpty());
    }

    @Test
    void failureUsesPolicyDelay() {
        save("bad", Status.waiting(clock.instant()));
        RunPolicy policy = RunPolicy.defaults().withDelay(Duration.ofMinutes(15));

        assertThrows(JobFailedException.class, () -> runner.run(row -> {
            throw new Exception("checked");
        }, policy));

        Status status = stored("bad");
        assertEquals(State.WAITING, status.state());
        assertEquals(clock.instant().plus(Duration.ofMinutes(15)), status.moment());
        assertTrue(runner.run(row -> Outcome.success(), policy).isEmpty());
    }

    @Test
    void interruptWithoutRetriesCancelsAndKeepsInterruptFlag() {
        save("t1", Status.waiting(clock.instant()));
        RunPolicy policy = RunPolicy.defaults().withRetry(0);

        JobFailedException e;
        try {
            e = assertThrows(JobFailedException.class, () -> runner.run(row -> {
                throw new InterruptedException("stop");
            }, policy));
        } finally {
            // Clears the flag for the following tests
            assertTrue(Thread.interrupted());
        }

        assertInstanceOf(InterruptedException.class, e.getCause());
        assertEquals(State.CANCELED, e.row().state());
        assertEquals(1, e.row().status().attempts());
        assertEquals(e.row().status(), stored("t1"));
    }

    @Test
    void interruptedThreadStillStoresOutcome() {
        save("t1", Status.waiting(clock.instant()));

        try {
            runner.run(row -> {
                Thread.currentThread().interrupt();
                return Outcome.success();
            });
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }

        assertEquals(State.FINISHED, stored("t1").state());
    }

    @Test
    void cancelInterruptPolicySkipsRemainingRetries() {
        save("t1", Status.waiting(clock.instant()));
        RunPolicy policy = RunPolicy.defaults().withInterruptPolicy(InterruptPolicy.CANCEL);

        try {
            JobFailedException e = assertThrows(JobFailedException.class, () -> runner.run(row -> {
                throw new InterruptedIOException("read interrupted");
            }, policy));
            assertEquals(State.CANCELED, e.row().state());
            assertEquals(1, e.row().status().attempts());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void nullOutcomeIsTreatedAsFailure() {
        save("t1", Status.waiting(clock.instant()));

        JobFailedException e = assertThrows(JobFailedException.class, () -> runner.run(row -> null));

        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertEquals(State.WAITING, e.row().state());
        assertEquals(1, e.row().status().attempts());
    }

    @Test
    void errorIsResolvedThenRethrownUnchanged() {
        save("t1", Status.waiting(clock.instant()));
        AssertionError boom = new AssertionError("boom");

        AssertionError thrown = assertThrows(AssertionError.class, () -> runner.run(row -> {
            throw boom;
        }));

        assertSame(boom, thrown);
        Status status = stored("t1");
        assertEquals(State.WAITING, status.state());
        assertEquals(1, status.attempts());
    }

    @Test
    void errorCountsAgainstRetries() {
        save("t1", Status.waiting(clock.instant(), 3));

        assertThrows(StackOverflowError.class, () -> runner.run(row -> {
            throw new StackOverflowError();
        }));

        Status status = stored("t1");
        assertEquals(State.CANCELED, status.state());
        assertEquals(4, status.attempts());
    }

    // Far-future delays

    @Test
    void delayBeyondLastEncodableMomentParksRow() {
        save("t1", Status.waiting(clock.instant()));

        QueueRow row = runner.run(r -> Outcome.retry(Duration.ofDays(3_000_000))).orElseThrow();

        assertEquals(State.WAITING, row.state());
        assertEquals(Status.MAX_MOMENT, row.status().moment());
        assertEquals(row.status(), stored("t1"));
    }

    @Test
    void hugePolicyDelayStillResolvesFaults() {
        save("t1", Status.waiting(clock.instant()));
        RunPolicy policy = RunPolicy.defaults().withDelay(Duration.ofDays(3_000_000));

        JobFailedException e = assertThrows(JobFailedException.class, () -> runner.run(row -> {
            throw new IllegalStateException("boom");
        }, policy));

        assertEquals("boom", e.getCause().getMessage());
        assertEquals(State.WAITING, stored("t1").state());
        assertEquals(Status.MAX_MOMENT, stored("t1").moment());
    }

    @Test
    void hugePolicyDelayStillReclaimsExpiredLeases() {
        save("stuck", Status.working(clock.instant().minus(Duration.ofHours(2))));
        RunPolicy policy = RunPolicy.defaults().withDelay(Duration.ofDays(3_000_000));

        assertTrue(runner.run(row -> Outcome.success(), policy).isEmpty());

        Status status = stored("stuck");
        assertEquals(State.WAITING, status.state());
        assertEquals(1, status.attempts());
        assertEquals(Status.MAX_MOMENT, status.moment());
    }

    @Test
    void timeoutLongerThanCalendarNeverReclaims() {
        save("busy", Status.working(clock.instant().minus(Duration.ofDays(365))));
        save("ready", Status.waiting(clock.instant()));
        RunPolicy policy = RunPolicy.defaults().withTimeout(Duration.ofDays(3_000_000));

        assertEquals("ready", runner.run(row -> Outcome.success(), policy).orElseThrow().id());
        assertEquals(State.WORKING, stored("busy").state());
    }

    // Outcomes

    @Test
    void retryOutcomeRequeuesWithoutPenalty() {
        save("t1", Status.waiting(clock.instant(), 2));

        QueueRow row = runner.run(r -> Outcome.retry()).orElseThrow();

        assertEquals(State.WAITING, row.state());
        assertEquals(2, row.status().attempts());
        assertEquals(clock.instant(), row.status().moment());
    }

    @Test
    void retryOutcomeDelayOverridesPolicy() {
        save("t1", Status.waiting(clock.instant()));
        RunPolicy policy = RunPolicy.defaults().withDelay(Duration.ofHours(1));

        runner.run(r -> Outcome.retry(Duration.ofMinutes(5)), policy);

        assertEquals(clock.instant().plus(Duration.ofMinutes(5)), stored("t1").moment());
        assertTrue(runner.run(r -> Outcome.success(), policy).isEmpty());

        clock.advance(Duration.ofMinutes(5));
        assertEquals("t1", runner.run(r -> Outcome.success(), policy).orElseThrow().id());
    }

    @Test
    void abortOutcomeSpendsAnAttempt() {
        save("t1", Status.waiting(clock.instant()));

        QueueRow row = runner.run(r -> Outcome.abort(Duration.ofSeconds(30))).orElseThrow();

        assertEquals(State.WAITING, row.state());
        assertEquals(1, row.status().attempts());
        assertEquals(clock.instant().plusSeconds(30), row.status().moment());
    }

    @Test
    void abortOutcomeCancelsWhenRetriesRunOut() {
        save("t1", Status.waiting(clock.instant(), 3));

        QueueRow row = runner.run(r -> Outcome.abort()).orElseThrow();

        assertEquals(State.CANCELED, row.state());
        assertEquals(4, row.status().attempts());
    }

    @Test
    void cancelOutcomeCancelsWithoutThrowing() {
        save("t1", Status.waiting(clock.instant()));

        QueueRow row = runner.run(r -> Outcome.cancel()).orElseThrow();

        assertEquals(State.CANCELED, row.state());
        assertEquals(1, row.status().attempts());
        assertEquals(row.status(), stored("t1"));
    }

    @Test
    void attemptsStayWithinOneDigit() {
        save("t1", Status.waiting(clock.instant(), 9));

        QueueRow row = runner.run(r -> Outcome.success()).orElseThrow();

        assertEquals(State.FINISHED, row.state());
        assertEquals(9, row.status().attempts());
    }

    @Test
    void lostLeaseKeepsStoredStatus() {
        save("t1", Status.waiting(clock.instant()));
        Status takenOver = Status.waiting(clock.instant().plusSeconds(60), 1);

        QueueRow row = runner.run(r -> {
            // Someone else reclaims the row while the action runs
            repo.updateStatus(r.id(), takenOver);
            return Outcome.success();
        }).orElseThrow();

        assertEquals(takenOver, row.status());
        assertEquals(takenOver, stored("t1"));
    }

    @Test
    void runnerWorksOnAnyTableWithStatusColumn() throws Exception {
        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement()) {
            st.execute("CREATE TABLE IF NOT EXISTS emails (email_id VARCHAR(32) PRIMARY KEY, recipient VARCHAR(64), state_code BIGINT)");
            st.execute("DELETE FROM emails");
            st.execute("INSERT INTO emails VALUES ('e1', 'ops@example.org', "
                    + Status.waiting(clock.instant()).value() + ")");
            conn.commit();
        }
        QueueTable emails = new JdbcQueueTable(db, "emails", "email_id", "state_code");
        List<String> sent = new ArrayList<>();

        QueueRow row = new QueueRunner(emails, clock)
                .run(QueueAction.of(r -> sent.add(r.getString("recipient"))))
                .orElseThrow();

        assertEquals(List.of("ops@example.org"), sent);
        assertEquals(State.FINISHED, row.state());
        assertEquals(State.FINISHED, emails.findById("e1").orElseThrow().state());
    }

    // Helper methods

    private void save(String id, Status status) {
        repo.save(Task.builder()
                .id(id)
                .payload("payload-" + id)
                .status(status)
                .build());
    }

    private Status stored(String id) {
        return repo.findById(id).orElseThrow().status();
    }
}
