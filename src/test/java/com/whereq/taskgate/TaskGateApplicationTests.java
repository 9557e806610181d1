package com.whereq.taskgate;

import com.whereq.taskgate.queue.TaskQueue;
import com.whereq.taskgate.resource.ResourceMonitor;
import com.whereq.taskgate.service.QueueWorker;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "taskgate.worker.enabled=false")
class TaskGateApplicationTests {

    @Autowired
    private ResourceMonitor resourceMonitor;

    @Autowired
    private TaskQueue taskQueue;

    @Autowired
    private QueueWorker queueWorker;

    @Test
    void contextLoads() {
        assertThat(queueWorker.isRunning()).isFalse();
        assertThat(resourceMonitor.getTotalCpuCores()).isPositive();
        assertThat(taskQueue.getQueueStatus().getQueuedCount()).isZero();
    }
}
