package rowqueue.runner;

/**
 * How a job interrupted mid-action is resolved.
 */
public enum InterruptPolicy {
    /** Count it as a failed attempt, like any other fault */
    PENALIZE,
    /** Cancel the job immediately, regardless of remaining attempts */
    CANCEL
}
