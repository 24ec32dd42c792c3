package rowqueue.model;

import rowqueue.status.State;
import rowqueue.status.Status;

import java.time.Instant;
import java.util.Objects;

/**
 * Application row stored in the bundled {@code tasks} table.
 * Queue state lives entirely in {@link #status()}; everything else belongs to the application.
 */
public final class Task {
    private final String id;
    private final String queue;
    private final String payload; // application data, opaque to the queue
    private final String result;
    private final Status status;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Task(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.queue = Objects.requireNonNull(builder.queue, "queue is required");
        this.payload = Objects.requireNonNull(builder.payload, "payload is required");
        this.result = builder.result;
        this.status = builder.status != null ? builder.status : Status.waiting();
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    public String id() {
        return id;
    }

    public String queue() {
        return queue;
    }

    public String payload() {
        return payload;
    }

    public String result() {
        return result;
    }

    public Status status() {
        return status;
    }

    public State state() {
        return status.state();
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .queue(queue)
                .payload(payload)
                .result(result)
                .status(status)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String queue = "default";
        private String payload;
        private String result;
        private Status status; // null means waiting as of build time
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder queue(String queue) {
            this.queue = queue;
            return this;
        }

        public Builder payload(String payload) {
            this.payload = payload;
            return this;
        }

        public Builder result(String result) {
            this.result = result;
            return this;
        }

        public Builder status(Status status) {
            this.status = status;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', queue='" + queue + "', status=" + status + "}";
    }
}
