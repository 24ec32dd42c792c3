package rowqueue.model;

import rowqueue.status.State;
import rowqueue.status.Status;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of a row governed by a queue.
 * The queue only owns {@link #status()}; attributes are the remaining columns
 * as read at claim time and are never written back by the queue.
 */
public final class QueueRow {
    private final String id;
    private final Status status;
    private final Map<String, Object> attributes;

    public QueueRow(String id, Status status, Map<String, Object> attributes) {
        this.id = Objects.requireNonNull(id, "id is required");
        this.status = Objects.requireNonNull(status, "status is required");
        this.attributes = attributes == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public String id() {
        return id;
    }

    public Status status() {
        return status;
    }

    public State state() {
        return status.state();
    }

    public Map<String, Object> attributes() {
        return attributes;
    }

    /** Attribute value by column name, or null. */
    public Object get(String column) {
        return attributes.get(column);
    }

    public String getString(String column) {
        Object value = attributes.get(column);
        return value != null ? value.toString() : null;
    }

    /** Copy of this row carrying a new status. */
    public QueueRow withStatus(Status next) {
        return new QueueRow(id, next, attributes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof QueueRow row))
            return false;
        return Objects.equals(id, row.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "QueueRow{id='" + id + "', status=" + status + "}";
    }
}
