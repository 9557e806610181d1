package com.whereq.taskgate.controller;

import com.whereq.taskgate.dto.QueueStatus;
import com.whereq.taskgate.dto.SystemResourcesResponse;
import com.whereq.taskgate.exception.ResourceSamplingException;
import com.whereq.taskgate.model.TaskEvent;
import com.whereq.taskgate.model.TaskEventType;
import com.whereq.taskgate.queue.EventSubscription;
import com.whereq.taskgate.queue.TaskEventBus;
import com.whereq.taskgate.queue.TaskQueue;
import com.whereq.taskgate.resource.ResourceMonitor;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Map;

/**
 * System resource monitoring and task queue status,
 * including a Server-Sent Events stream of task events.
 */
@Slf4j
@RestController
@RequestMapping("/api/system")
@Tag(name = "System", description = "Resource availability and task queue status")
public class SystemController {

    @Autowired
    private ResourceMonitor resourceMonitor;

    @Autowired
    private TaskQueue taskQueue;

    @Autowired
    private TaskEventBus eventBus;

    @Value("${taskgate.events.heartbeat-interval:5s}")
    private Duration heartbeatInterval;

    @GetMapping("/resources")
    @Operation(summary = "Resources and queue", description = "Current CPU/RAM availability together with queue status")
    public Mono<SystemResourcesResponse> getSystemResources() {
        return Mono.fromCallable(() -> SystemResourcesResponse.builder()
                .resources(resourceMonitor.getResourceSummary())
                .queue(taskQueue.getQueueStatus())
                .build())
            .subscribeOn(Schedulers.boundedElastic())
            .doOnNext(response -> log.debug("/api/system/resources polled - running: {}, queued: {}",
                response.getQueue().getRunningCount(), response.getQueue().getQueuedCount()));
    }

    @GetMapping("/resources-only")
    @Operation(summary = "Resources", description = "Current CPU/RAM availability without queue status")
    public Mono<SystemResourcesResponse> getSystemResourcesOnly() {
        return Mono.fromCallable(() -> SystemResourcesResponse.builder()
                .resources(resourceMonitor.getResourceSummary())
                .build())
            .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/queue")
    @Operation(summary = "Queue status", description = "Running and queued tasks, optionally for one owner")
    public Mono<QueueStatus> getQueueStatus(@RequestParam(value = "owner", required = false) String owner) {
        return Mono.fromCallable(() -> taskQueue.getQueueStatus(owner));
    }

    /**
     * Stream task events. The first event is initial_state with the queue
     * status, then live events interleaved with periodic heartbeats.
     */
    @GetMapping(value = "/task-events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "Task event stream", description = "Server-Sent Events for task status changes and resources")
    public ResponseEntity<Flux<TaskEvent>> streamTaskEvents() {
        Flux<TaskEvent> stream = Flux.defer(() -> {
            EventSubscription subscription = taskQueue.subscribeToEvents();

            Mono<TaskEvent> initialState = Mono.fromCallable(
                    () -> eventBus.createEvent(TaskEventType.INITIAL_STATE, taskQueue.getQueueStatus()))
                .subscribeOn(Schedulers.boundedElastic());

            Flux<TaskEvent> heartbeats = Flux.interval(heartbeatInterval, heartbeatInterval)
                .concatMap(tick -> Mono.fromCallable(() -> eventBus.createEvent(TaskEventType.HEARTBEAT, null))
                    .subscribeOn(Schedulers.boundedElastic()));

            return initialState
                .concatWith(Flux.merge(subscription.events(), heartbeats))
                .doFinally(signal -> {
                    taskQueue.unsubscribeFromEvents(subscription);
                    log.info("Client disconnected from task events stream ({})", signal);
                });
        });

        return ResponseEntity.ok()
            .header(HttpHeaders.CACHE_CONTROL, "no-cache")
            .header("X-Accel-Buffering", "no")
            .body(stream);
    }

    @ExceptionHandler(ResourceSamplingException.class)
    public ResponseEntity<Map<String, String>> handleSamplingFailure(ResourceSamplingException e) {
        log.error("Resource sampling failed: {}", e.getMessage());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(Map.of("error", "Resource sampling failed: " + e.getMessage()));
    }
}
