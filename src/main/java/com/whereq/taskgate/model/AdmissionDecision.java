package com.whereq.taskgate.model;

import lombok.Value;

/**
 * Outcome of a predictive admission check
 */
@Value
public class AdmissionDecision {
    /**
     * Whether the task may start now
     */
    boolean admitted;

    /**
     * Human-readable explanation with the numeric surplus or shortfall
     */
    String reason;

    public static AdmissionDecision admit(String reason) {
        return new AdmissionDecision(true, reason);
    }

    public static AdmissionDecision reject(String reason) {
        return new AdmissionDecision(false, reason);
    }
}
