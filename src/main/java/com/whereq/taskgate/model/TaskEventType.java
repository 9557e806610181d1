package com.whereq.taskgate.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Types of events broadcast to task event subscribers
 */
public enum TaskEventType {
    TASK_QUEUED("task_queued"),
    TASK_RUNNING("task_running"),
    TASK_COMPLETED("task_completed"),
    TASK_DESCRIPTION_UPDATE("task_description_update"),
    HEARTBEAT("heartbeat"),

    /**
     * First event of every stream, carries the full queue status
     */
    INITIAL_STATE("initial_state");

    private final String wireName;

    TaskEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
