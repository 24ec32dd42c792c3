package rowqueue.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import rowqueue.model.QueueTally;
import rowqueue.status.State;

/**
 * Per-state row counts of one queue, for monitoring.
 */
public record QueueStatsResponse(
        @JsonProperty("queue") String queue,
        @JsonProperty("created") long created,
        @JsonProperty("waiting") long waiting,
        @JsonProperty("working") long working,
        @JsonProperty("finished") long finished,
        @JsonProperty("canceled") long canceled,
        @JsonProperty("total") long total) {

    public static QueueStatsResponse from(String queue, QueueTally tally) {
        return new QueueStatsResponse(
                queue,
                tally.count(State.CREATED),
                tally.count(State.WAITING),
                tally.count(State.WORKING),
                tally.count(State.FINISHED),
                tally.count(State.CANCELED),
                tally.total());
    }
}
