package rowqueue.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rowqueue.model.QueueRow;
import rowqueue.model.QueueTally;
import rowqueue.repository.QueueTable;
import rowqueue.repository.QueueTransaction;
import rowqueue.status.State;
import rowqueue.status.Status;
import rowqueue.status.StatusRange;

import java.sql.Clob;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * JDBC implementation of QueueTable over any table with a BIGINT status column.
 * Uses SELECT ... FOR UPDATE for claiming and compare-and-set updates for every
 * status write, so a row can only change hands once per transaction.
 */
public class JdbcQueueTable implements QueueTable {

    private static final Logger log = LoggerFactory.getLogger(JdbcQueueTable.class);

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final Database db;
    private final String table;
    private final String idColumn;
    private final String statusColumn;
    private final String scopeColumn; // null when unscoped
    private final Object scopeValue;

    public JdbcQueueTable(Database db, String table, String idColumn, String statusColumn) {
        this(db, table, idColumn, statusColumn, null, null);
    }

    private JdbcQueueTable(Database db, String table, String idColumn, String statusColumn,
            String scopeColumn, Object scopeValue) {
        this.db = Objects.requireNonNull(db, "db is required");
        this.table = requireIdentifier(table);
        this.idColumn = requireIdentifier(idColumn);
        this.statusColumn = requireIdentifier(statusColumn);
        this.scopeColumn = scopeColumn != null ? requireIdentifier(scopeColumn) : null;
        this.scopeValue = scopeValue;
    }

    /**
     * Narrow this table to rows where {@code column = value}.
     * Replaces any previous scope.
     */
    public JdbcQueueTable where(String column, Object value) {
        Objects.requireNonNull(value, "scope value is required");
        return new JdbcQueueTable(db, table, idColumn, statusColumn, column, value);
    }

    @Override
    public String name() {
        String name = table + "." + statusColumn;
        return scopeColumn != null ? name + "[" + scopeColumn + "=" + scopeValue + "]" : name;
    }

    @Override
    public <T> T inTransaction(TransactionWork<T> work) {
        try (Connection conn = db.getConnection()) {
            try {
                T result = work.execute(new JdbcQueueTransaction(conn));
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollback(conn, e);
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to run queue transaction on " + name(), e);
        }
    }

    @Override
    public Optional<QueueRow> findById(String id) {
        String sql = "SELECT * FROM " + table + " WHERE " + idColumn + " = ?" + scopeClause(" AND ");

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, id);
            bindScope(ps, 2);
            try (ResultSet rs = ps.executeQuery()) {
                Optional<QueueRow> row = rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
                conn.commit();
                return row;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find row " + id + " in " + name(), e);
        }
    }

    @Override
    public List<QueueRow> findInRange(StatusRange range, int limit) {
        String sql = "SELECT * FROM " + table
                + " WHERE " + statusColumn + " BETWEEN ? AND ?" + scopeClause(" AND ")
                + " ORDER BY " + statusColumn + " LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, range.min());
            ps.setLong(2, range.max());
            int next = bindScope(ps, 3);
            ps.setInt(next, limit);

            List<QueueRow> rows = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(mapRow(rs));
                }
            }
            conn.commit();
            return rows;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list rows in " + name(), e);
        }
    }

    @Override
    public QueueTally tally() {
        StringBuilder sql = new StringBuilder("SELECT ");
        State[] states = State.values();
        for (int i = 0; i < states.length; i++) {
            if (i > 0) {
                sql.append(", ");
            }
            sql.append("COUNT(CASE WHEN ").append(statusColumn).append(" BETWEEN ? AND ? THEN 1 END)");
        }
        sql.append(" FROM ").append(table).append(scopeClause(" WHERE "));

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql.toString())) {

            int index = 1;
            for (State state : states) {
                ps.setLong(index++, state.minimum());
                ps.setLong(index++, state.maximum());
            }
            bindScope(ps, index);

            Map<State, Long> counts = new EnumMap<>(State.class);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    for (int i = 0; i < states.length; i++) {
                        counts.put(states[i], rs.getLong(i + 1));
                    }
                }
            }
            conn.commit();
            return new QueueTally(counts);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to tally " + name(), e);
        }
    }

    /**
     * Transaction bound to one pooled connection.
     */
    private final class JdbcQueueTransaction implements QueueTransaction {
        private final Connection conn;

        private JdbcQueueTransaction(Connection conn) {
            this.conn = conn;
        }

        @Override
        public Optional<QueueRow> lockFirst(StatusRange range) {
            String sql = "SELECT * FROM " + table
                    + " WHERE " + statusColumn + " BETWEEN ? AND ?" + scopeClause(" AND ")
                    + " ORDER BY " + statusColumn + " LIMIT 1 FOR UPDATE";

            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setLong(1, range.min());
                ps.setLong(2, range.max());
                bindScope(ps, 3);

                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
                }
            } catch (SQLException e) {
                throw new RuntimeException("Failed to lock row in " + name(), e);
            }
        }

        @Override
        public boolean compareAndSet(QueueRow row, Status next) {
            String sql = "UPDATE " + table + " SET " + statusColumn + " = ?"
                    + " WHERE " + idColumn + " = ? AND " + statusColumn + " = ?";

            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setLong(1, next.value());
                ps.setString(2, row.id());
                ps.setLong(3, row.status().value());

                int updated = ps.executeUpdate();
                if (updated == 0) {
                    log.debug("Status of row {} in {} moved from {}", row.id(), name(), row.status());
                }
                return updated > 0;
            } catch (SQLException e) {
                throw new RuntimeException("Failed to update status of row " + row.id() + " in " + name(), e);
            }
        }
    }

    // Helper methods

    private String scopeClause(String keyword) {
        return scopeColumn != null ? keyword + scopeColumn + " = ?" : "";
    }

    /** Binds the scope parameter if any; returns the next free index. */
    private int bindScope(PreparedStatement ps, int index) throws SQLException {
        if (scopeColumn == null) {
            return index;
        }
        ps.setObject(index, scopeValue);
        return index + 1;
    }

    private QueueRow mapRow(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            String column = meta.getColumnLabel(i).toLowerCase(Locale.ROOT);
            if (column.equalsIgnoreCase(statusColumn)) {
                continue;
            }
            Object value = rs.getObject(i);
            if (value instanceof Clob clob) {
                value = clob.getSubString(1, (int) clob.length());
            }
            attributes.put(column, value);
        }
        return new QueueRow(rs.getString(idColumn), Status.parse(rs.getLong(statusColumn)), attributes);
    }

    private static void rollback(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    private static String requireIdentifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Not a valid SQL identifier: " + name);
        }
        return name;
    }
}
