package com.whereq.taskgate.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of background tasks, each with its own resource footprint
 */
public enum TaskType {
    /**
     * Strategy backtest run
     */
    BACKTEST("backtest"),

    /**
     * Price-prediction model training run
     */
    MODEL_TRAINING("model_training"),

    /**
     * Inference with an already trained model
     */
    PREDICTION("prediction");

    private final String wireName;

    TaskType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Expected CPU/RAM footprint of this task type
     */
    public ResourceRequirement getRequirement() {
        return ResourceRequirement.forType(this);
    }
}
