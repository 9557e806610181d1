package com.whereq.taskgate.queue;

import com.whereq.taskgate.config.TaskGateProperties;
import com.whereq.taskgate.dto.ResourceSummary;
import com.whereq.taskgate.exception.ResourceSamplingException;
import com.whereq.taskgate.model.TaskEvent;
import com.whereq.taskgate.model.TaskEventType;
import com.whereq.taskgate.resource.ResourceMonitor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fans task events out to subscribers.
 *
 * Events are delivered by a single publisher thread in the order they were
 * published. Each delivery attaches a fresh resource snapshot. A subscriber
 * whose channel is full loses that event; nobody else is affected.
 */
@Slf4j
@Component
public class TaskEventBus {

    private final ResourceMonitor resourceMonitor;
    private final int subscriberBufferSize;

    private final List<EventSubscription> subscribers = new CopyOnWriteArrayList<>();

    private final ExecutorService publisher = Executors.newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, "task-events");
        thread.setDaemon(true);
        return thread;
    });

    private final Counter droppedCounter;

    @Autowired
    public TaskEventBus(ResourceMonitor resourceMonitor, TaskGateProperties properties, MeterRegistry meterRegistry) {
        this.resourceMonitor = resourceMonitor;
        this.subscriberBufferSize = properties.getEvents().getSubscriberBufferSize();

        droppedCounter = Counter.builder("taskgate.events.dropped")
            .description("Events dropped because a subscriber channel was full")
            .register(meterRegistry);

        Gauge.builder("taskgate.events.subscribers", subscribers::size)
            .description("Number of connected event subscribers")
            .register(meterRegistry);
    }

    /**
     * Queue an event for delivery. Never blocks.
     *
     * @param type event type
     * @param data type-specific payload
     */
    public void publish(TaskEventType type, Object data) {
        Instant timestamp = Instant.now();
        try {
            publisher.execute(() -> deliver(type, timestamp, data));
        } catch (RejectedExecutionException e) {
            log.warn("Event publisher is shut down, dropping {} event", type.getWireName());
        }
    }

    public EventSubscription subscribe() {
        EventSubscription subscription = new EventSubscription(subscriberBufferSize);
        subscribers.add(subscription);
        log.info("New event subscriber {} added (total: {})", subscription.getId(), subscribers.size());
        return subscription;
    }

    public void unsubscribe(EventSubscription subscription) {
        if (subscribers.remove(subscription)) {
            subscription.close();
            log.info("Event subscriber {} removed (remaining: {})", subscription.getId(), subscribers.size());
        }
    }

    public int getSubscriberCount() {
        return subscribers.size();
    }

    /**
     * Build a standalone event with a fresh resource snapshot, for
     * stream-local events like heartbeats that are not broadcast
     */
    public TaskEvent createEvent(TaskEventType type, Object data) {
        return TaskEvent.builder()
            .type(type)
            .timestamp(Instant.now())
            .data(data)
            .resources(currentResources())
            .build();
    }

    @PreDestroy
    public void shutdown() {
        publisher.shutdown();
        subscribers.forEach(EventSubscription::close);
        subscribers.clear();
    }

    private void deliver(TaskEventType type, Instant timestamp, Object data) {
        TaskEvent event = TaskEvent.builder()
            .type(type)
            .timestamp(timestamp)
            .data(data)
            .resources(currentResources())
            .build();

        for (EventSubscription subscriber : subscribers) {
            try {
                if (!subscriber.offer(event)) {
                    droppedCounter.increment();
                    log.warn("Event queue full for subscriber {}, skipping {} event",
                        subscriber.getId(), type.getWireName());
                }
            } catch (RuntimeException e) {
                droppedCounter.increment();
                log.warn("Error emitting {} event to subscriber {}: {}",
                    type.getWireName(), subscriber.getId(), e.getMessage());
            }
        }
    }

    private ResourceSummary currentResources() {
        try {
            return resourceMonitor.getResourceSummary();
        } catch (ResourceSamplingException e) {
            log.warn("Publishing event without resource snapshot: {}", e.getMessage());
            return null;
        }
    }
}
