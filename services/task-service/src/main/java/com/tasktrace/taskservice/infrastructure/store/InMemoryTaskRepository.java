package com.tasktrace.taskservice.infrastructure.store;

import com.tasktrace.observability.CorrelationContext;
import com.tasktrace.observability.SpanHandle;
import com.tasktrace.observability.SpanHelper;
import com.tasktrace.taskservice.domain.NewTask;
import com.tasktrace.taskservice.domain.Task;
import com.tasktrace.taskservice.domain.TaskPatch;
import com.tasktrace.taskservice.domain.TaskRepository;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

/**
 * {@link TaskRepository} keeping tasks in a map for the lifetime of the process.
 *
 * <p>Reads share a read lock, writes take the write lock. The task count lives in an {@link
 * AtomicLong} updated under the write lock, so {@link #count()} never waits for a writer and is
 * always equal to the number of entries visible to the next reader.
 */
@Repository
public class InMemoryTaskRepository implements TaskRepository {

    static final AttributeKey<String> TASK_ID = AttributeKey.stringKey("task.id");
    static final AttributeKey<String> TASK_TITLE = AttributeKey.stringKey("task.title");
    static final String TASK_FOUND = "task.found";
    static final String TASK_COUNT = "task.count";

    private final Map<String, Task> tasks = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicLong count = new AtomicLong();
    private final SpanHelper spans;
    private final Clock clock;

    @Autowired
    public InMemoryTaskRepository(SpanHelper spans) {
        this(spans, Clock.systemUTC());
    }

    InMemoryTaskRepository(SpanHelper spans, Clock clock) {
        this.spans = spans;
        this.clock = clock;
    }

    @Override
    public Task create(CorrelationContext context, NewTask newTask) {
        return traced(context, "TaskRepository.Create", Attributes.of(TASK_TITLE, newTask.title()), span -> {
            Instant now = clock.instant();
            Task task = new Task(
                    UUID.randomUUID().toString(),
                    newTask.title(),
                    newTask.description() != null ? newTask.description() : "",
                    false,
                    now,
                    now);
            lock.writeLock().lock();
            try {
                tasks.put(task.id(), task);
                count.incrementAndGet();
            } finally {
                lock.writeLock().unlock();
            }
            span.setAttribute(TASK_ID.getKey(), task.id());
            return task;
        });
    }

    @Override
    public Optional<Task> findById(CorrelationContext context, String id) {
        return traced(context, "TaskRepository.GetByID", Attributes.of(TASK_ID, id), span -> {
            Task task;
            lock.readLock().lock();
            try {
                task = tasks.get(id);
            } finally {
                lock.readLock().unlock();
            }
            span.setAttribute(TASK_FOUND, task != null);
            return Optional.ofNullable(task);
        });
    }

    @Override
    public List<Task> list(CorrelationContext context) {
        return traced(context, "TaskRepository.List", Attributes.empty(), span -> {
            List<Task> snapshot;
            lock.readLock().lock();
            try {
                snapshot = new ArrayList<>(tasks.values());
            } finally {
                lock.readLock().unlock();
            }
            span.setAttribute(TASK_COUNT, snapshot.size());
            return snapshot;
        });
    }

    @Override
    public Optional<Task> update(CorrelationContext context, String id, TaskPatch patch) {
        return traced(context, "TaskRepository.Update", Attributes.of(TASK_ID, id), span -> {
            Task updated = null;
            lock.writeLock().lock();
            try {
                Task existing = tasks.get(id);
                if (existing != null) {
                    updated = existing.apply(patch, nextUpdateTime(existing));
                    tasks.put(id, updated);
                }
            } finally {
                lock.writeLock().unlock();
            }
            span.setAttribute(TASK_FOUND, updated != null);
            return Optional.ofNullable(updated);
        });
    }

    @Override
    public boolean delete(CorrelationContext context, String id) {
        return traced(context, "TaskRepository.Delete", Attributes.of(TASK_ID, id), span -> {
            boolean removed;
            lock.writeLock().lock();
            try {
                removed = tasks.remove(id) != null;
                if (removed) {
                    count.decrementAndGet();
                }
            } finally {
                lock.writeLock().unlock();
            }
            span.setAttribute(TASK_FOUND, removed);
            return removed;
        });
    }

    @Override
    public long count() {
        return count.get();
    }

    /** Wall-clock time, bumped past the previous update when the clock has not moved on. */
    private Instant nextUpdateTime(Task existing) {
        Instant now = clock.instant();
        return now.isAfter(existing.updatedAt()) ? now : existing.updatedAt().plusNanos(1);
    }

    private <T> T traced(CorrelationContext context, String operation, Attributes attributes,
            Function<SpanHandle, T> work) {
        return spans.withSpan(context, operation, attributes, span -> {
            span.context().checkDeadline(operation);
            return work.apply(span);
        });
    }
}
