package com.tasktrace.taskservice.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * A stored task. Instances are immutable; an update produces a new record.
 *
 * @param id unique identifier (random UUID)
 * @param title short summary, never blank
 * @param description free text, empty when not given
 * @param done completion flag
 * @param createdAt creation time
 * @param updatedAt time of the last modification, equal to {@code createdAt} until the first update
 */
public record Task(
        String id,
        String title,
        String description,
        boolean done,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt) {

    /**
     * Returns a copy with the patch applied. Blank or absent title and description keep the current
     * value; an absent {@code done} keeps the current flag.
     */
    public Task apply(TaskPatch patch, Instant updatedAt) {
        return new Task(
                id,
                hasText(patch.title()) ? patch.title() : title,
                hasText(patch.description()) ? patch.description() : description,
                patch.done() != null ? patch.done() : done,
                createdAt,
                updatedAt);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
