package com.whereq.taskgate.service;

import com.whereq.taskgate.config.TaskGateProperties;
import com.whereq.taskgate.queue.TaskQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background worker that periodically promotes the head of the task queue.
 * At most one task is promoted per tick.
 */
@Slf4j
@Service
public class QueueWorker {

    private final TaskQueue taskQueue;
    private final Duration checkInterval;
    private final boolean autoStart;

    private final AtomicBoolean running = new AtomicBoolean(false);

    private ScheduledExecutorService executor;

    @Autowired
    public QueueWorker(TaskQueue taskQueue, TaskGateProperties properties) {
        this.taskQueue = taskQueue;
        this.checkInterval = properties.getWorker().getCheckInterval();
        this.autoStart = properties.getWorker().isEnabled();
    }

    @PostConstruct
    public void startIfEnabled() {
        if (autoStart) {
            start();
        } else {
            log.info("Queue worker disabled, tasks are promoted only on explicit calls");
        }
    }

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            log.debug("Queue worker already running");
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "queue-worker");
            thread.setDaemon(true);
            return thread;
        });
        executor.scheduleWithFixedDelay(this::tick, 0, checkInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Queue worker started, checking every {}ms", checkInterval.toMillis());
    }

    @PreDestroy
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(checkInterval.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Queue worker did not stop within {}ms", checkInterval.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        executor = null;
        log.info("Queue worker stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * One promotion attempt. Errors are logged and never stop the loop.
     */
    void tick() {
        try {
            int queuedCount = taskQueue.getQueuedCount();
            if (queuedCount > 0) {
                log.debug("Queue check: {} queued, {} running", queuedCount, taskQueue.getRunningCount());
            }

            Optional<String> started = taskQueue.tryExecuteNext();
            if (started.isPresent()) {
                log.info("Started task {} from queue", started.get());
            } else if (queuedCount > 0) {
                log.debug("Tasks queued but resources insufficient");
            }
        } catch (Exception e) {
            log.error("Queue worker tick failed", e);
        }
    }
}
