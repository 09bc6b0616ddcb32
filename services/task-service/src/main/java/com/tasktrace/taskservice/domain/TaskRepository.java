package com.tasktrace.taskservice.domain;

import com.tasktrace.observability.CorrelationContext;
import com.tasktrace.observability.DeadlineExceededException;
import java.util.List;
import java.util.Optional;

/**
 * Storage port for tasks.
 *
 * <p>Each context-taking operation opens a span nested under the context's active span and refuses
 * to run once the context deadline has passed, throwing {@link DeadlineExceededException}.
 */
public interface TaskRepository {

    Task create(CorrelationContext context, NewTask newTask);

    Optional<Task> findById(CorrelationContext context, String id);

    /** Returns a snapshot of all tasks, in no particular order. */
    List<Task> list(CorrelationContext context);

    /** Applies the patch and returns the updated task, or empty when no task has this id. */
    Optional<Task> update(CorrelationContext context, String id, TaskPatch patch);

    /** Removes the task, returning {@code false} when no task has this id. */
    boolean delete(CorrelationContext context, String id);

    /**
     * Returns the number of stored tasks without blocking; safe to call from metric collection
     * callbacks.
     */
    long count();
}
