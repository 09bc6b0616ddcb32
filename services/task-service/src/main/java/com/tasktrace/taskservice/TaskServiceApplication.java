package com.tasktrace.taskservice;

import com.tasktrace.taskservice.config.TaskServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Task service: a REST API over an in-memory task store, traced, measured and logged through the
 * tasktrace observability providers.
 *
 * <p>Configured by default:
 *
 * <ul>
 *   <li>Graceful shutdown ({@code server.shutdown=graceful}, 30s window), followed by a telemetry
 *       flush
 *   <li>Request ID, deadline and server span for every API request
 *   <li>Structured error handling (RFC 7807 ProblemDetail)
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties(TaskServiceProperties.class)
public class TaskServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(TaskServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(TaskServiceApplication.class, args);
        log.info("Task service started successfully");
    }
}
