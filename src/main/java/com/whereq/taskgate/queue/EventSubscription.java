package com.whereq.taskgate.queue;

import com.whereq.taskgate.model.TaskEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;

/**
 * Bounded per-subscriber event channel.
 * Offering to a full channel fails immediately instead of blocking the publisher.
 */
public class EventSubscription {

    private final String id = UUID.randomUUID().toString();

    private final Sinks.Many<TaskEvent> sink;

    public EventSubscription(int capacity) {
        this.sink = Sinks.many().unicast().onBackpressureBuffer(new ArrayBlockingQueue<>(capacity));
    }

    public String getId() {
        return id;
    }

    /**
     * Events delivered to this subscriber. Can be subscribed to only once.
     */
    public Flux<TaskEvent> events() {
        return sink.asFlux();
    }

    /**
     * @return false if the event was dropped (channel full or subscriber gone)
     */
    synchronized boolean offer(TaskEvent event) {
        return sink.tryEmitNext(event).isSuccess();
    }

    synchronized void close() {
        sink.tryEmitComplete();
    }
}
