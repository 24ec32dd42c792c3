package rowqueue.repository;

import rowqueue.model.Task;
import rowqueue.status.State;
import rowqueue.status.Status;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for the bundled task rows.
 * This is the application side of the table: the queue itself only touches
 * the status column through {@link #queueTable(String)}.
 */
public interface TaskRepository {

    /**
     * Save a new task.
     *
     * @param task the task to save
     */
    void save(Task task);

    /**
     * Save multiple tasks in a batch.
     *
     * @param tasks the tasks to save
     */
    void saveAll(List<Task> tasks);

    /**
     * Find a task by ID.
     *
     * @param taskId the task ID
     * @return the task if found
     */
    Optional<Task> findById(String taskId);

    /**
     * Find tasks of a queue in the given state, in queue order.
     *
     * @param queue the queue name
     * @param state the state to filter by
     * @param limit maximum number of results
     * @return list of tasks
     */
    List<Task> findByState(String queue, State state, int limit);

    /**
     * Store the application result of a task. Does not touch the status.
     *
     * @param taskId the task ID
     * @param result result text
     * @return true if updated
     */
    boolean saveResult(String taskId, String result);

    /**
     * Overwrite the status of a task unconditionally.
     * For application-driven moves such as requeueing a finished task.
     *
     * @param taskId the task ID
     * @param status the new status
     * @return true if updated
     */
    boolean updateStatus(String taskId, Status status);

    /**
     * The queue view of the tasks belonging to one queue.
     *
     * @param queue the queue name
     * @return table scoped to that queue over the status column
     */
    QueueTable queueTable(String queue);
}
