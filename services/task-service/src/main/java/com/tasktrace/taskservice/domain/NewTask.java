package com.tasktrace.taskservice.domain;

import jakarta.validation.constraints.NotBlank;

/**
 * Request body for creating a task.
 *
 * @param title required, must not be blank
 * @param description optional
 */
public record NewTask(@NotBlank(message = "title is required") String title, String description) {}
