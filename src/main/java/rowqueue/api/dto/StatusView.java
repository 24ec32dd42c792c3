package rowqueue.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import rowqueue.status.Status;

/**
 * Decoded status of a single row.
 * {@code priority} is ISO-8601 UTC, or null when the stored digits are not a timestamp.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatusView(
        @JsonProperty("id") String id,
        @JsonProperty("value") long value,
        @JsonProperty("state") String state,
        @JsonProperty("priority") String priority,
        @JsonProperty("attempts") int attempts) {

    public static StatusView from(String id, Status status) {
        String priority;
        try {
            priority = status.moment().toString();
        } catch (IllegalArgumentException e) {
            priority = null; // raw priority set by the application
        }
        return new StatusView(id, status.value(), status.state().name(), priority, status.attempts());
    }
}
