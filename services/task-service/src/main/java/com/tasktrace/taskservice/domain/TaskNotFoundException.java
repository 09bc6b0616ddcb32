package com.tasktrace.taskservice.domain;

/** Thrown by the HTTP layer when the addressed task does not exist. */
public class TaskNotFoundException extends RuntimeException {

    private final String taskId;

    public TaskNotFoundException(String taskId) {
        super("task " + taskId + " not found");
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }
}
