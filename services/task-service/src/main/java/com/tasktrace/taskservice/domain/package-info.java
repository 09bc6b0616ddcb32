/**
 * Task domain: the task record, the request shapes that create and patch it, and the repository
 * port.
 *
 * <p>Every repository operation except {@link com.tasktrace.taskservice.domain.TaskRepository#count()}
 * takes the caller's {@link com.tasktrace.observability.CorrelationContext}, so store spans nest
 * under the handler span that invoked them. This package has no dependency on Spring MVC.
 */
package com.tasktrace.taskservice.domain;
