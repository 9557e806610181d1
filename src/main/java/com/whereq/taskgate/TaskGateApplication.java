package com.whereq.taskgate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for WhereQ TaskGate.
 * This service decides whether compute-heavy background tasks (backtests,
 * model training, predictions) may start now or must wait until the host
 * has spare CPU and memory, and streams task lifecycle events to observers.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
public class TaskGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskGateApplication.class, args);
    }
}
