package com.whereq.taskgate.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for WhereQ TaskGate.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "taskgate")
@Validated
@Data
public class TaskGateProperties {

    /**
     * Relaxed admission (5% buffer, 50% consumption) instead of production
     * (20% buffer, 80% consumption). Bound to TRADING_BOT_DEV_MODE.
     */
    private boolean devMode = false;

    @Valid
    private WorkerConfig worker = new WorkerConfig();

    @Valid
    private EventsConfig events = new EventsConfig();

    @Valid
    private ResourcesConfig resources = new ResourcesConfig();

    @Data
    public static class WorkerConfig {
        /**
         * Start the queue worker with the application.
         */
        private boolean enabled = true;

        /**
         * Delay between promotion attempts.
         */
        @NotNull
        private Duration checkInterval = Duration.ofSeconds(5);
    }

    @Data
    public static class EventsConfig {
        /**
         * Events buffered per subscriber before new ones are dropped.
         */
        @Min(1)
        private int subscriberBufferSize = 256;

        /**
         * Heartbeat period of the task event stream.
         */
        @NotNull
        private Duration heartbeatInterval = Duration.ofSeconds(5);
    }

    @Data
    public static class ResourcesConfig {
        /**
         * Upper bound on a single CPU/RAM sample.
         */
        @NotNull
        private Duration samplingTimeout = Duration.ofSeconds(2);
    }
}
