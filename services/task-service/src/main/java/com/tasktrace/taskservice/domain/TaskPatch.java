package com.tasktrace.taskservice.domain;

/**
 * Request body for updating a task. Every field is optional.
 *
 * @param title new title, ignored when blank
 * @param description new description, ignored when blank
 * @param done new completion flag, ignored when absent
 */
public record TaskPatch(String title, String description, Boolean done) {}
