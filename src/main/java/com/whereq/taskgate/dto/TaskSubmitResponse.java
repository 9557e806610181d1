package com.whereq.taskgate.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * Result of submitting a task through admission control
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaskSubmitResponse {
    /**
     * Task identifier
     */
    String taskId;

    /**
     * Whether the task started immediately or was queued
     */
    SubmissionStatus status;

    /**
     * 1-indexed queue position (queued tasks only)
     */
    Integer queuePosition;

    /**
     * User-facing message including the admission reason
     */
    String message;

    public enum SubmissionStatus {
        RUNNING("running"),
        QUEUED("queued");

        private final String wireName;

        SubmissionStatus(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String getWireName() {
            return wireName;
        }
    }
}
