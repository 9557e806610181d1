package com.whereq.taskgate.model;

/**
 * Admission strictness profiles
 *
 * bufferPercent: fraction of total resources always kept free.
 * consumptionFactor: fraction of a task's nominal footprint assumed to be consumed.
 */
public enum ResourceProfile {
    /**
     * Default for deployed instances
     */
    PRODUCTION(0.20, 0.80),

    /**
     * Lenient profile for development machines
     */
    RELAXED(0.05, 0.50);

    private final double bufferPercent;
    private final double consumptionFactor;

    ResourceProfile(double bufferPercent, double consumptionFactor) {
        this.bufferPercent = bufferPercent;
        this.consumptionFactor = consumptionFactor;
    }

    public double getBufferPercent() {
        return bufferPercent;
    }

    public double getConsumptionFactor() {
        return consumptionFactor;
    }

    public static ResourceProfile forDevMode(boolean devMode) {
        return devMode ? RELAXED : PRODUCTION;
    }
}
