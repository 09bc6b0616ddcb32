package com.tasktrace.taskservice.api;

import com.tasktrace.observability.CorrelatedLogger;
import com.tasktrace.observability.CorrelationContext;
import com.tasktrace.observability.SpanHelper;
import com.tasktrace.observability.TelemetryProviders;
import com.tasktrace.taskservice.domain.NewTask;
import com.tasktrace.taskservice.domain.Task;
import com.tasktrace.taskservice.domain.TaskNotFoundException;
import com.tasktrace.taskservice.domain.TaskPatch;
import com.tasktrace.taskservice.domain.TaskRepository;
import com.tasktrace.taskservice.infrastructure.web.RequestTelemetryFilter;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Task CRUD endpoints under {@code /api/v1/tasks}.
 *
 * <p>Each operation runs inside a {@code TaskHandler.*} span opened on the server span's context
 * (supplied by {@link RequestTelemetryFilter}) and forwards that span's context to the repository.
 * A missing task is a normal result: the handler span ends OK and {@link TaskNotFoundException} is
 * thrown afterwards for the 404 response.
 */
@RestController
@RequestMapping("/api/v1/tasks")
public class TaskController {

    private static final AttributeKey<String> TASK_ID = AttributeKey.stringKey("task.id");

    private final TaskRepository repository;
    private final SpanHelper spans;
    private final CorrelatedLogger log;

    public TaskController(TaskRepository repository, TelemetryProviders telemetry) {
        this.repository = repository;
        this.spans = telemetry.spanHelper();
        this.log = telemetry.logger(TaskController.class);
    }

    @GetMapping
    public List<Task> list(
            @RequestAttribute(RequestTelemetryFilter.CONTEXT_ATTRIBUTE) CorrelationContext context) {
        return spans.withSpan(context, "TaskHandler.List", Attributes.empty(), span -> {
            log.info(span.context(), "listing all tasks");
            List<Task> tasks = repository.list(span.context());
            span.setAttribute("task.count", tasks.size());
            log.info(span.context(), "tasks listed", Map.of("count", tasks.size()));
            return tasks;
        });
    }

    @PostMapping
    public ResponseEntity<Task> create(
            @RequestAttribute(RequestTelemetryFilter.CONTEXT_ATTRIBUTE) CorrelationContext context,
            @Valid @RequestBody NewTask newTask) {
        Task task = spans.withSpan(context, "TaskHandler.Create", Attributes.empty(), span -> {
            log.info(span.context(), "creating task", Map.of("title", newTask.title()));
            Task created = repository.create(span.context(), newTask);
            span.setAttribute(TASK_ID.getKey(), created.id());
            log.info(span.context(), "task created", Map.of("id", created.id()));
            return created;
        });
        return ResponseEntity.created(URI.create("/api/v1/tasks/" + task.id())).body(task);
    }

    @GetMapping("/{id}")
    public Task get(
            @RequestAttribute(RequestTelemetryFilter.CONTEXT_ATTRIBUTE) CorrelationContext context,
            @PathVariable String id) {
        Optional<Task> task = spans.withSpan(context, "TaskHandler.GetByID", Attributes.of(TASK_ID, id), span -> {
            log.info(span.context(), "getting task", Map.of("id", id));
            Optional<Task> found = repository.findById(span.context(), id);
            logResult(span.context(), found.isPresent(), "task retrieved", id);
            return found;
        });
        return task.orElseThrow(() -> new TaskNotFoundException(id));
    }

    @PutMapping("/{id}")
    public Task update(
            @RequestAttribute(RequestTelemetryFilter.CONTEXT_ATTRIBUTE) CorrelationContext context,
            @PathVariable String id,
            @RequestBody TaskPatch patch) {
        Optional<Task> task = spans.withSpan(context, "TaskHandler.Update", Attributes.of(TASK_ID, id), span -> {
            log.info(span.context(), "updating task", Map.of("id", id));
            Optional<Task> updated = repository.update(span.context(), id, patch);
            logResult(span.context(), updated.isPresent(), "task updated", id);
            return updated;
        });
        return task.orElseThrow(() -> new TaskNotFoundException(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(
            @RequestAttribute(RequestTelemetryFilter.CONTEXT_ATTRIBUTE) CorrelationContext context,
            @PathVariable String id) {
        boolean deleted = spans.withSpan(context, "TaskHandler.Delete", Attributes.of(TASK_ID, id), span -> {
            log.info(span.context(), "deleting task", Map.of("id", id));
            boolean removed = repository.delete(span.context(), id);
            logResult(span.context(), removed, "task deleted", id);
            return removed;
        });
        if (!deleted) {
            throw new TaskNotFoundException(id);
        }
        return ResponseEntity.noContent().build();
    }

    private void logResult(CorrelationContext context, boolean found, String message, String id) {
        if (found) {
            log.info(context, message, Map.of("id", id));
        } else {
            log.warn(context, "task not found", Map.of("id", id));
        }
    }
}
