package com.whereq.taskgate.config;

import com.whereq.taskgate.resource.JmxSystemResourceProbe;
import com.whereq.taskgate.resource.SystemResourceProbe;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Threads and OS access used by the task scheduler
 */
@Configuration
public class SchedulerConfig {

    @Bean
    public SystemResourceProbe systemResourceProbe() {
        return new JmxSystemResourceProbe();
    }

    /**
     * Scheduler running admitted units of work, one worker per task
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler taskWorkScheduler() {
        return Schedulers.newBoundedElastic(
            Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE,
            Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE,
            "task-work");
    }
}
