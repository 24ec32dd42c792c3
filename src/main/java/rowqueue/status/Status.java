package rowqueue.status;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Queue status packed into a single 19 digit integer.
 *
 * <pre>
 *   2  2018 03 27  14 43 25 759  0
 *    \    \  \  \    \  \  \  \   \
 *   state  \  \  \  hour \  \  \  attempts
 *         year \  \   minute \  \
 *            month \      second \
 *                  day       millisecond
 * </pre>
 *
 * The state is the leading digit, so every state owns a contiguous numeric range
 * and ordering by the raw value within a state is ordering by (priority, attempts).
 * Priorities are UTC timestamps truncated to the millisecond; an earlier priority
 * is served first.
 */
public final class Status implements Comparable<Status> {

    /** Value of one unit in the state digit (10^18). */
    public static final long STATE_UNIT = 1_000_000_000_000_000_000L;

    /** Largest 17 digit priority. */
    public static final long MAX_PRIORITY = 99_999_999_999_999_999L;

    /** Attempts is a single digit. */
    public static final int MAX_ATTEMPTS = 9;

    /** Highest configurable retry count; leaves one digit of headroom for the final attempt. */
    public static final int MAX_RETRY = MAX_ATTEMPTS - 1;

    /** Earliest moment a priority can hold. */
    public static final Instant MIN_MOMENT = Instant.parse("0001-01-01T00:00:00Z");

    /** Latest moment a priority can hold. */
    public static final Instant MAX_MOMENT = Instant.parse("9999-12-31T23:59:59.999Z");

    private static final long YEAR = 10_000_000_000_000L;
    private static final long MONTH = 100_000_000_000L;
    private static final long DAY = 1_000_000_000L;
    private static final long HOUR = 10_000_000L;
    private static final long MINUTE = 100_000L;
    private static final long SECOND = 1_000L;

    private final long value;
    private final State state;
    private final long priority;
    private final int attempts;

    private Status(long value, State state, long priority, int attempts) {
        this.value = value;
        this.state = state;
        this.priority = priority;
        this.attempts = attempts;
    }

    /**
     * Combine fields into a status.
     *
     * @param priority raw 17 digit priority, {@code YYYYMMDDHHMMSSmmm}
     * @throws IllegalArgumentException if a field does not fit its digits
     */
    public static Status combine(State state, long priority, int attempts) {
        Objects.requireNonNull(state, "state is required");
        if (priority < 0 || priority > MAX_PRIORITY) {
            throw new IllegalArgumentException("Priority must have at most 17 digits: " + priority);
        }
        if (attempts < 0 || attempts > MAX_ATTEMPTS) {
            throw new IllegalArgumentException("Attempts must be a single digit: " + attempts);
        }
        long value = state.code() * STATE_UNIT + priority * 10 + attempts;
        return new Status(value, state, priority, attempts);
    }

    /**
     * Combine fields into a status, rendering the moment as a priority.
     * Sub-millisecond precision is truncated.
     */
    public static Status combine(State state, Instant moment, int attempts) {
        return combine(state, toPriority(moment), attempts);
    }

    /**
     * Decode a stored status value.
     *
     * @throws IllegalArgumentException if the value is not 19 digits or has an unknown state
     */
    public static Status parse(long value) {
        if (value < State.CREATED.minimum() || value > State.CANCELED.maximum()) {
            throw new IllegalArgumentException("Not a queue status: " + value);
        }
        State state = State.fromCode((int) (value / STATE_UNIT));
        long priority = (value % STATE_UNIT) / 10;
        int attempts = (int) (value % 10);
        return new Status(value, state, priority, attempts);
    }

    /**
     * Render a moment as a 17 digit priority, truncating to the millisecond.
     *
     * @throws IllegalArgumentException if the year is outside 1..9999
     */
    public static long toPriority(Instant moment) {
        Objects.requireNonNull(moment, "moment is required");
        LocalDateTime utc;
        try {
            utc = LocalDateTime.ofInstant(moment, ZoneOffset.UTC);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Moment out of range: " + moment, e);
        }
        int year = utc.getYear();
        if (year < 1 || year > 9999) {
            throw new IllegalArgumentException("Moment year must be within 1..9999: " + moment);
        }
        return year * YEAR
                + utc.getMonthValue() * MONTH
                + utc.getDayOfMonth() * DAY
                + utc.getHour() * HOUR
                + utc.getMinute() * MINUTE
                + utc.getSecond() * SECOND
                + utc.getNano() / 1_000_000;
    }

    /**
     * Render a 17 digit priority back into a UTC moment.
     *
     * @throws IllegalArgumentException if the digits are not a calendar timestamp
     */
    public static Instant toMoment(long priority) {
        try {
            LocalDateTime utc = LocalDateTime.of(
                    (int) (priority / YEAR),
                    (int) (priority / MONTH % 100),
                    (int) (priority / DAY % 100),
                    (int) (priority / HOUR % 100),
                    (int) (priority / MINUTE % 100),
                    (int) (priority / SECOND % 100),
                    (int) (priority % 1000) * 1_000_000);
            return utc.toInstant(ZoneOffset.UTC);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Priority is not a timestamp: " + priority, e);
        }
    }

    // Per-state helpers; moment defaults to now (UTC), attempts to 0

    public static Status created() {
        return created(Instant.now());
    }

    public static Status created(Instant moment) {
        return created(moment, 0);
    }

    public static Status created(Instant moment, int attempts) {
        return combine(State.CREATED, moment, attempts);
    }

    public static Status waiting() {
        return waiting(Instant.now());
    }

    public static Status waiting(Instant moment) {
        return waiting(moment, 0);
    }

    public static Status waiting(Instant moment, int attempts) {
        return combine(State.WAITING, moment, attempts);
    }

    public static Status working() {
        return working(Instant.now());
    }

    public static Status working(Instant moment) {
        return working(moment, 0);
    }

    public static Status working(Instant moment, int attempts) {
        return combine(State.WORKING, moment, attempts);
    }

    public static Status finished() {
        return finished(Instant.now());
    }

    public static Status finished(Instant moment) {
        return finished(moment, 0);
    }

    public static Status finished(Instant moment, int attempts) {
        return combine(State.FINISHED, moment, attempts);
    }

    public static Status canceled() {
        return canceled(Instant.now());
    }

    public static Status canceled(Instant moment) {
        return canceled(moment, 0);
    }

    public static Status canceled(Instant moment, int attempts) {
        return combine(State.CANCELED, moment, attempts);
    }

    public long value() {
        return value;
    }

    public State state() {
        return state;
    }

    /** Raw 17 digit priority. */
    public long priority() {
        return priority;
    }

    /** Priority rendered as a UTC moment. */
    public Instant moment() {
        return toMoment(priority);
    }

    public int attempts() {
        return attempts;
    }

    public boolean is(State other) {
        return state == other;
    }

    @Override
    public int compareTo(Status other) {
        return Long.compare(value, other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Status status))
            return false;
        return value == status.value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    /** The 19 digit decimal rendering. */
    @Override
    public String toString() {
        return Long.toString(value);
    }
}
