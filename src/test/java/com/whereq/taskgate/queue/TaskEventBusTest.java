package com.whereq.taskgate.queue;

import com.whereq.taskgate.config.TaskGateProperties;
import com.whereq.taskgate.exception.ResourceSamplingException;
import com.whereq.taskgate.model.ResourceProfile;
import com.whereq.taskgate.model.TaskEvent;
import com.whereq.taskgate.model.TaskEventType;
import com.whereq.taskgate.resource.ResourceMonitor;
import com.whereq.taskgate.support.FakeResourceProbe;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TaskEventBusTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    private ResourceMonitor monitor;
    private TaskEventBus bus;

    @AfterEach
    void tearDown() {
        bus.shutdown();
        monitor.shutdown();
    }

    private TaskEventBus bus(FakeResourceProbe probe, int bufferSize) {
        TaskGateProperties properties = new TaskGateProperties();
        properties.getEvents().setSubscriberBufferSize(bufferSize);
        monitor = new ResourceMonitor(probe, properties, meterRegistry);
        bus = new TaskEventBus(monitor, properties, meterRegistry);
        return bus;
    }

    @Test
    void saturatedSubscriberDoesNotStarveOthers() {
        TaskEventBus bus = bus(FakeResourceProbe.idle(), 1);
        EventSubscription stalled = bus.subscribe();
        EventSubscription live = bus.subscribe();

        StepVerifier.create(live.events())
            .then(() -> {
                bus.publish(TaskEventType.TASK_QUEUED, Map.of("task_id", "a"));
                bus.publish(TaskEventType.TASK_QUEUED, Map.of("task_id", "b"));
                bus.publish(TaskEventType.TASK_QUEUED, Map.of("task_id", "c"));
            })
            .assertNext(e -> assertThat(e.getData()).isEqualTo(Map.of("task_id", "a")))
            .assertNext(e -> assertThat(e.getData()).isEqualTo(Map.of("task_id", "b")))
            .assertNext(e -> assertThat(e.getData()).isEqualTo(Map.of("task_id", "c")))
            .thenCancel()
            .verify(TIMEOUT);

        // The stalled subscriber kept only what fit in its channel
        StepVerifier.create(stalled.events())
            .assertNext(e -> assertThat(e.getData()).isEqualTo(Map.of("task_id", "a")))
            .expectNoEvent(Duration.ofMillis(200))
            .thenCancel()
            .verify(TIMEOUT);

        assertThat(meterRegistry.get("taskgate.events.dropped").counter().count()).isEqualTo(2.0);
    }

    @Test
    void eventsCarryTypeTimestampAndResources() {
        TaskEventBus bus = bus(new FakeResourceProbe(8, 16).available(5.0, 10.0), 8);
        EventSubscription subscription = bus.subscribe();

        bus.publish(TaskEventType.TASK_COMPLETED, Map.of("task_id", "x", "success", true));

        StepVerifier.create(subscription.events())
            .assertNext(event -> {
                assertThat(event.getType()).isEqualTo(TaskEventType.TASK_COMPLETED);
                assertThat(event.getTimestamp()).isNotNull();
                assertThat(event.getResources()).isNotNull();
                assertThat(event.getResources().getCpu().getAvailableCores()).isEqualTo(5.0);
                assertThat(event.getResources().getProfile()).isEqualTo(ResourceProfile.PRODUCTION);
            })
            .thenCancel()
            .verify(TIMEOUT);
    }

    @Test
    void eventsAreStillDeliveredWhenSamplingFails() {
        FakeResourceProbe probe = new FakeResourceProbe(8, 16).failWith(new ResourceSamplingException("no access"));
        TaskEventBus bus = bus(probe, 8);
        EventSubscription subscription = bus.subscribe();

        bus.publish(TaskEventType.TASK_RUNNING, Map.of("task_id", "x"));

        StepVerifier.create(subscription.events())
            .assertNext(event -> {
                assertThat(event.getType()).isEqualTo(TaskEventType.TASK_RUNNING);
                assertThat(event.getResources()).isNull();
            })
            .thenCancel()
            .verify(TIMEOUT);
    }

    @Test
    void deliveryPreservesPublishOrder() {
        TaskEventBus bus = bus(FakeResourceProbe.idle(), 64);
        EventSubscription subscription = bus.subscribe();

        for (int i = 0; i < 20; i++) {
            bus.publish(TaskEventType.TASK_DESCRIPTION_UPDATE, Map.of("seq", i));
        }

        StepVerifier.create(subscription.events().map(e -> (Integer) ((Map<?, ?>) e.getData()).get("seq")).take(20))
            .expectNext(0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15, 16, 17, 18, 19)
            .expectComplete()
            .verify(TIMEOUT);
    }

    @Test
    void unsubscribeCompletesTheChannel() {
        TaskEventBus bus = bus(FakeResourceProbe.idle(), 8);
        EventSubscription subscription = bus.subscribe();
        assertThat(bus.getSubscriberCount()).isEqualTo(1);

        StepVerifier.create(subscription.events())
            .then(() -> bus.unsubscribe(subscription))
            .expectComplete()
            .verify(TIMEOUT);

        assertThat(bus.getSubscriberCount()).isZero();
    }

    @Test
    void createEventBuildsStandaloneEvent() {
        TaskEventBus bus = bus(FakeResourceProbe.idle(), 8);

        TaskEvent heartbeat = bus.createEvent(TaskEventType.HEARTBEAT, null);

        assertThat(heartbeat.getType()).isEqualTo(TaskEventType.HEARTBEAT);
        assertThat(heartbeat.getData()).isNull();
        assertThat(heartbeat.getResources().getCpu().getTotalCores()).isEqualTo(64);
    }
}
