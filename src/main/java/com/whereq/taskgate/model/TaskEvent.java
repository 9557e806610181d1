package com.whereq.taskgate.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.taskgate.dto.ResourceSummary;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Immutable broadcast message describing a task lifecycle change
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaskEvent {

    TaskEventType type;

    Instant timestamp;

    /**
     * Type-specific payload, absent for heartbeats
     */
    Object data;

    /**
     * Resource snapshot taken when the event was delivered,
     * absent if sampling failed
     */
    ResourceSummary resources;
}
