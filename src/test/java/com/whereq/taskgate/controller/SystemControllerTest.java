package com.whereq.taskgate.controller;

import com.whereq.taskgate.dto.QueueStatus;
import com.whereq.taskgate.dto.QueuedTaskInfo;
import com.whereq.taskgate.dto.ResourceSummary;
import com.whereq.taskgate.dto.RunningTaskInfo;
import com.whereq.taskgate.exception.ResourceSamplingException;
import com.whereq.taskgate.model.ResourceProfile;
import com.whereq.taskgate.model.TaskEvent;
import com.whereq.taskgate.model.TaskEventType;
import com.whereq.taskgate.model.TaskType;
import com.whereq.taskgate.queue.EventSubscription;
import com.whereq.taskgate.queue.TaskEventBus;
import com.whereq.taskgate.queue.TaskQueue;
import com.whereq.taskgate.resource.ResourceMonitor;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.FluxExchangeResult;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;

@WebFluxTest(SystemController.class)
class SystemControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private ResourceMonitor resourceMonitor;

    @MockBean
    private TaskQueue taskQueue;

    @MockBean
    private TaskEventBus eventBus;

    private static ResourceSummary summary() {
        return ResourceSummary.builder()
            .cpu(ResourceSummary.CpuSummary.builder()
                .totalCores(8).availableCores(5.0).usagePercent(37.5).minThresholdCores(1.6).build())
            .ram(ResourceSummary.RamSummary.builder()
                .totalGb(16.0).availableGb(10.0).usagePercent(37.5).minThresholdGb(3.2).build())
            .bufferPercent(20.0)
            .profile(ResourceProfile.PRODUCTION)
            .build();
    }

    private static QueueStatus status() {
        QueuedTaskInfo queued = QueuedTaskInfo.builder()
            .taskId("bt-2").taskType(TaskType.BACKTEST).priority(0).queuedAt(Instant.parse("2024-05-01T10:00:00Z"))
            .estimatedCpuCores(1.0).estimatedRamGb(0.5).queuePosition(1).description("").ownerId("alice")
            .build();
        RunningTaskInfo running = RunningTaskInfo.builder()
            .taskId("train-1").taskType(TaskType.MODEL_TRAINING)
            .estimatedCpuCores(2.0).estimatedRamGb(1.5).description("Epoch 3/10")
            .build();
        return QueueStatus.builder()
            .queuedCount(1).runningCount(1)
            .queuedTasks(List.of(queued)).runningTasks(List.of(running))
            .build();
    }

    @Test
    void resourcesIncludeQueueInSnakeCase() {
        when(resourceMonitor.getResourceSummary()).thenReturn(summary());
        when(taskQueue.getQueueStatus()).thenReturn(status());

        webTestClient.get().uri("/api/system/resources")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.resources.cpu.total_cores").isEqualTo(8)
            .jsonPath("$.resources.ram.min_threshold_gb").isEqualTo(3.2)
            .jsonPath("$.resources.buffer_percent").isEqualTo(20.0)
            .jsonPath("$.queue.queued_count").isEqualTo(1)
            .jsonPath("$.queue.queued_tasks[0].task_type").isEqualTo("backtest")
            .jsonPath("$.queue.queued_tasks[0].queue_position").isEqualTo(1)
            .jsonPath("$.queue.running_tasks[0].task_type").isEqualTo("model_training")
            .jsonPath("$.queue.running_tasks[0].description").isEqualTo("Epoch 3/10");
    }

    @Test
    void resourcesOnlyOmitsQueue() {
        when(resourceMonitor.getResourceSummary()).thenReturn(summary());

        webTestClient.get().uri("/api/system/resources-only")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.resources.cpu.available_cores").isEqualTo(5.0)
            .jsonPath("$.queue").doesNotExist();
    }

    @Test
    void queueStatusIsFilteredByOwner() {
        when(taskQueue.getQueueStatus(eq("alice"))).thenReturn(status());
        when(taskQueue.getQueueStatus(isNull())).thenReturn(QueueStatus.builder()
            .queuedTasks(List.of()).runningTasks(List.of()).build());

        webTestClient.get().uri("/api/system/queue?owner=alice")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.queued_tasks[0].owner_id").isEqualTo("alice");

        webTestClient.get().uri("/api/system/queue")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.queued_count").isEqualTo(0);
    }

    @Test
    void samplingFailureMapsToServiceUnavailable() {
        when(resourceMonitor.getResourceSummary()).thenThrow(new ResourceSamplingException("sample timed out after 2000ms"));

        webTestClient.get().uri("/api/system/resources-only")
            .exchange()
            .expectStatus().isEqualTo(503)
            .expectBody()
            .jsonPath("$.error").isEqualTo("Resource sampling failed: sample timed out after 2000ms");
    }

    @Test
    void eventStreamStartsWithInitialState() {
        when(taskQueue.subscribeToEvents()).thenReturn(new EventSubscription(8));
        when(taskQueue.getQueueStatus()).thenReturn(status());
        when(eventBus.createEvent(any(), any())).thenAnswer(invocation -> TaskEvent.builder()
            .type(invocation.getArgument(0))
            .timestamp(Instant.now())
            .data(invocation.getArgument(1))
            .resources(summary())
            .build());

        FluxExchangeResult<String> result = webTestClient.get().uri("/api/system/task-events")
            .accept(MediaType.TEXT_EVENT_STREAM)
            .exchange()
            .expectStatus().isOk()
            .expectHeader().valueEquals(HttpHeaders.CACHE_CONTROL, "no-cache")
            .expectHeader().valueEquals("X-Accel-Buffering", "no")
            .returnResult(String.class);

        StepVerifier.create(result.getResponseBody())
            .assertNext(first -> assertThat(first)
                .contains("\"type\":\"" + TaskEventType.INITIAL_STATE.getWireName() + "\"")
                .contains("\"queued_tasks\""))
            .thenCancel()
            .verify(Duration.ofSeconds(5));
    }
}
