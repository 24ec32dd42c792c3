package rowqueue.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rowqueue.model.Task;
import rowqueue.repository.QueueTable;
import rowqueue.repository.TaskRepository;
import rowqueue.status.State;
import rowqueue.status.Status;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of TaskRepository over the bundled {@code tasks} table.
 */
public class JdbcTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRepository.class);

    static final String TABLE = "tasks";
    static final String ID_COLUMN = "id";
    static final String STATUS_COLUMN = "status";
    static final String QUEUE_COLUMN = "queue";

    private final Database db;

    public JdbcTaskRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Task task) {
        String sql = """
                    INSERT INTO tasks (id, queue, payload, result, status, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, task.id());
            ps.setString(2, task.queue());
            ps.setString(3, task.payload());
            ps.setString(4, task.result());
            ps.setLong(5, task.status().value());
            setTimestamp(ps, 6, task.createdAt() != null ? task.createdAt() : Instant.now());
            setTimestamp(ps, 7, task.updatedAt());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save task: " + task.id(), e);
        }
    }

    @Override
    public void saveAll(List<Task> tasks) {
        if (tasks.isEmpty())
            return;

        String sql = """
                    INSERT INTO tasks (id, queue, payload, status, created_at)
                    VALUES (?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            for (Task task : tasks) {
                ps.setString(1, task.id());
                ps.setString(2, task.queue());
                ps.setString(3, task.payload());
                ps.setLong(4, task.status().value());
                setTimestamp(ps, 5, task.createdAt() != null ? task.createdAt() : Instant.now());
                ps.addBatch();
            }

            ps.executeBatch();
            conn.commit();

            log.debug("Saved {} tasks in batch", tasks.size());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save tasks batch", e);
        }
    }

    @Override
    public Optional<Task> findById(String taskId) {
        String sql = "SELECT * FROM tasks WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                Optional<Task> task = rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
                conn.commit();
                return task;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find task: " + taskId, e);
        }
    }

    @Override
    public List<Task> findByState(String queue, State state, int limit) {
        String sql = """
                    SELECT * FROM tasks
                    WHERE queue = ? AND status BETWEEN ? AND ?
                    ORDER BY status
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, queue);
            ps.setLong(2, state.minimum());
            ps.setLong(3, state.maximum());
            ps.setInt(4, limit);
            List<Task> tasks = executeQuery(ps);
            conn.commit();
            return tasks;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find tasks by state: " + state, e);
        }
    }

    @Override
    public boolean saveResult(String taskId, String result) {
        String sql = "UPDATE tasks SET result = ?, updated_at = ? WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, result);
            ps.setTimestamp(2, Timestamp.from(Instant.now()));
            ps.setString(3, taskId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save result of task: " + taskId, e);
        }
    }

    @Override
    public boolean updateStatus(String taskId, Status status) {
        String sql = "UPDATE tasks SET status = ?, updated_at = ? WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, status.value());
            ps.setTimestamp(2, Timestamp.from(Instant.now()));
            ps.setString(3, taskId);

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Task {} status set to {}", taskId, status);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update task status: " + taskId, e);
        }
    }

    @Override
    public QueueTable queueTable(String queue) {
        return new JdbcQueueTable(db, TABLE, ID_COLUMN, STATUS_COLUMN).where(QUEUE_COLUMN, queue);
    }

    // Helper methods

    private List<Task> executeQuery(PreparedStatement ps) throws SQLException {
        List<Task> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private Task mapRow(ResultSet rs) throws SQLException {
        return Task.builder()
                .id(rs.getString("id"))
                .queue(rs.getString("queue"))
                .payload(rs.getString("payload"))
                .result(rs.getString("result"))
                .status(Status.parse(rs.getLong("status")))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }
}
