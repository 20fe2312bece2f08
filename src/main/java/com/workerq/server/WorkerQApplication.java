package com.workerq.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Standalone server. Started without {@code workerq.role} it supervises the worker processes,
 * each of which is this same application started with {@code workerq.role=worker}.
 */
@SpringBootApplication
public class WorkerQApplication {

    public static void main(String[] args) {
        SpringApplication.run(WorkerQApplication.class, args);
    }
}
