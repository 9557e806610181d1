package com.whereq.taskgate.resource;

import com.whereq.taskgate.config.TaskGateProperties;
import com.whereq.taskgate.dto.ResourceSummary;
import com.whereq.taskgate.exception.ResourceSamplingException;
import com.whereq.taskgate.model.AdmissionDecision;
import com.whereq.taskgate.model.ResourceProfile;
import com.whereq.taskgate.model.ResourceRequirement;
import com.whereq.taskgate.model.ResourceSnapshot;
import com.whereq.taskgate.model.TaskType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.ToDoubleFunction;

/**
 * Monitor host CPU and RAM and decide whether a task type can start
 * without pushing availability below the safety buffer.
 *
 * The check is predictive: it relies on OS-reported availability, which
 * already reflects load from previously started tasks.
 */
@Slf4j
@Component
public class ResourceMonitor {

    private static final double BYTES_PER_GB = 1024.0 * 1024.0 * 1024.0;

    private final SystemResourceProbe probe;
    private final ResourceProfile profile;
    private final Duration samplingTimeout;

    // Samples run here so a slow OS call never holds up the caller's locks
    private final ExecutorService sampler = Executors.newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, "resource-sampler");
        thread.setDaemon(true);
        return thread;
    });

    private final int totalCpuCores;
    private final double totalRamGb;
    private final double minCpuCores;
    private final double minRamGb;

    private final Counter admittedCounter;
    private final Counter rejectedCounter;

    @Autowired
    public ResourceMonitor(SystemResourceProbe probe, TaskGateProperties properties, MeterRegistry meterRegistry) {
        this.probe = probe;
        this.profile = ResourceProfile.forDevMode(properties.isDevMode());
        this.samplingTimeout = properties.getResources().getSamplingTimeout();

        this.totalCpuCores = probe.getLogicalProcessorCount();
        this.totalRamGb = probe.getTotalMemoryBytes() / BYTES_PER_GB;
        this.minCpuCores = totalCpuCores * profile.getBufferPercent();
        this.minRamGb = totalRamGb * profile.getBufferPercent();

        admittedCounter = Counter.builder("taskgate.admission.admitted")
            .description("Admission checks that allowed a task to start")
            .register(meterRegistry);

        rejectedCounter = Counter.builder("taskgate.admission.rejected")
            .description("Admission checks that kept a task waiting")
            .register(meterRegistry);

        Gauge.builder("taskgate.resources.cpu.total", () -> totalCpuCores)
            .description("Logical CPU cores")
            .register(meterRegistry);

        Gauge.builder("taskgate.resources.memory.total", () -> totalRamGb)
            .description("Physical memory in GB")
            .register(meterRegistry);

        Gauge.builder("taskgate.resources.cpu.available", () -> sampleOrNaN(ResourceSnapshot::getAvailableCpuCores))
            .description("CPU cores currently not busy")
            .register(meterRegistry);

        Gauge.builder("taskgate.resources.memory.available", () -> sampleOrNaN(ResourceSnapshot::getAvailableRamGb))
            .description("Memory in GB currently available")
            .register(meterRegistry);

        if (profile == ResourceProfile.RELAXED) {
            log.warn("ResourceMonitor running in DEVELOPMENT mode: buffer {}% (vs 20% production), consumption factor {}% (vs 80% production)",
                Math.round(profile.getBufferPercent() * 100), Math.round(profile.getConsumptionFactor() * 100));
        }
        log.info("ResourceMonitor initialized: total={} cores, {} GB RAM | min thresholds={} cores, {} GB RAM | consumption factor={}%",
            totalCpuCores, format(totalRamGb), format(minCpuCores), format(minRamGb),
            Math.round(profile.getConsumptionFactor() * 100));
    }

    /**
     * Take a fresh sample of current availability
     *
     * @return current resources
     * @throws ResourceSamplingException if the OS cannot be sampled in time
     */
    public ResourceSnapshot getCurrentResources() {
        Future<ResourceSnapshot> sample;
        try {
            sample = sampler.submit(this::sampleNow);
        } catch (RejectedExecutionException e) {
            throw new ResourceSamplingException("resource sampler is shut down", e);
        }

        try {
            return sample.get(samplingTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            sample.cancel(true);
            throw new ResourceSamplingException("sample timed out after " + samplingTimeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ResourceSamplingException samplingException) {
                throw samplingException;
            }
            throw new ResourceSamplingException(String.valueOf(cause.getMessage()), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResourceSamplingException("interrupted while sampling resources", e);
        }
    }

    /**
     * Check if a task of the given type can start now.
     * Fails closed: if resources cannot be sampled the task is not admitted.
     *
     * @param taskType task type
     * @return admission decision with a human-readable reason
     */
    public AdmissionDecision canRunTask(TaskType taskType) {
        return canRunTask(taskType, profile.getConsumptionFactor());
    }

    /**
     * Check if a task of the given type can start now, assuming it consumes
     * the given fraction of its nominal requirement instead of the profile's
     *
     * @param taskType task type
     * @param consumptionFactor fraction of the requirement expected to be consumed, must be positive
     * @return admission decision with a human-readable reason
     */
    public AdmissionDecision canRunTask(TaskType taskType, double consumptionFactor) {
        checkConsumptionFactor(consumptionFactor);
        ResourceSnapshot resources;
        try {
            resources = getCurrentResources();
        } catch (ResourceSamplingException e) {
            rejectedCounter.increment();
            String reason = "Resource sampling failed: " + e.getMessage();
            log.warn("Admission check for {} blocked: {}", taskType.getWireName(), reason);
            return AdmissionDecision.reject(reason);
        }

        AdmissionDecision decision = evaluate(taskType, resources, consumptionFactor);
        (decision.isAdmitted() ? admittedCounter : rejectedCounter).increment();
        return decision;
    }

    /**
     * Predict availability after starting a task of the given type
     * and compare it against the minimum thresholds
     *
     * @param taskType task type
     * @param resources current availability
     * @return admission decision with a human-readable reason
     */
    public AdmissionDecision evaluate(TaskType taskType, ResourceSnapshot resources) {
        return evaluate(taskType, resources, profile.getConsumptionFactor());
    }

    public AdmissionDecision evaluate(TaskType taskType, ResourceSnapshot resources, double consumptionFactor) {
        checkConsumptionFactor(consumptionFactor);
        ResourceRequirement requirement = taskType.getRequirement();
        ResourceRequirement predictedConsumption = requirement.scale(consumptionFactor);

        double predictedCpuAvailable = resources.getAvailableCpuCores() - predictedConsumption.getCpuCores();
        double predictedRamAvailable = resources.getAvailableRamGb() - predictedConsumption.getRamGb();

        boolean cpuOk = predictedCpuAvailable >= minCpuCores;
        boolean ramOk = predictedRamAvailable >= minRamGb;

        log.debug("Resource check for {}: available={} cores, {} GB | requires={} cores, {} GB | predicted consumption={} cores, {} GB | after start={} cores, {} GB | min={} cores, {} GB | cpuOk={}, ramOk={}",
            taskType.getWireName(),
            format(resources.getAvailableCpuCores()), format(resources.getAvailableRamGb()),
            format(requirement.getCpuCores()), format(requirement.getRamGb()),
            format(predictedConsumption.getCpuCores()), format(predictedConsumption.getRamGb()),
            format(predictedCpuAvailable), format(predictedRamAvailable),
            format(minCpuCores), format(minRamGb), cpuOk, ramOk);

        if (!cpuOk) {
            String reason = String.format(Locale.ROOT,
                "Insufficient CPU: need %.2f, available %.2f, would leave %.2f (min: %.2f)",
                predictedConsumption.getCpuCores(), resources.getAvailableCpuCores(),
                predictedCpuAvailable, minCpuCores);
            log.info("Task type {} blocked: {}", taskType.getWireName(), reason);
            return AdmissionDecision.reject(reason);
        }

        if (!ramOk) {
            String reason = String.format(Locale.ROOT,
                "Insufficient RAM: need %.2fGB, available %.2fGB, would leave %.2fGB (min: %.2fGB)",
                predictedConsumption.getRamGb(), resources.getAvailableRamGb(),
                predictedRamAvailable, minRamGb);
            log.info("Task type {} blocked: {}", taskType.getWireName(), reason);
            return AdmissionDecision.reject(reason);
        }

        String reason = String.format(Locale.ROOT,
            "Can run: %.2f cores and %.2fGB RAM will remain",
            predictedCpuAvailable, predictedRamAvailable);
        log.debug("Task type {} approved: {}", taskType.getWireName(), reason);
        return AdmissionDecision.admit(reason);
    }

    /**
     * Get totals, availability and thresholds for API responses and events
     *
     * @throws ResourceSamplingException if the OS cannot be sampled in time
     */
    public ResourceSummary getResourceSummary() {
        ResourceSnapshot resources = getCurrentResources();
        return ResourceSummary.builder()
            .cpu(ResourceSummary.CpuSummary.builder()
                .totalCores(resources.getTotalCpuCores())
                .availableCores(round(resources.getAvailableCpuCores(), 2))
                .usagePercent(round(resources.getCpuPercent(), 1))
                .minThresholdCores(round(minCpuCores, 2))
                .build())
            .ram(ResourceSummary.RamSummary.builder()
                .totalGb(round(resources.getTotalRamGb(), 2))
                .availableGb(round(resources.getAvailableRamGb(), 2))
                .usagePercent(round(resources.getRamPercent(), 1))
                .minThresholdGb(round(minRamGb, 2))
                .build())
            .bufferPercent(round(profile.getBufferPercent() * 100, 1))
            .profile(profile)
            .build();
    }

    public ResourceProfile getProfile() {
        return profile;
    }

    public int getTotalCpuCores() {
        return totalCpuCores;
    }

    public double getTotalRamGb() {
        return totalRamGb;
    }

    public double getMinCpuCores() {
        return minCpuCores;
    }

    public double getMinRamGb() {
        return minRamGb;
    }

    @PreDestroy
    public void shutdown() {
        sampler.shutdownNow();
    }

    private ResourceSnapshot sampleNow() {
        double cpuLoad = Math.max(0.0, Math.min(1.0, probe.getCpuLoad()));
        double availableCpuCores = totalCpuCores * (1.0 - cpuLoad);

        double availableRamGb = probe.getAvailableMemoryBytes() / BYTES_PER_GB;
        double ramPercent = totalRamGb > 0 ? (totalRamGb - availableRamGb) / totalRamGb * 100.0 : 0.0;

        return ResourceSnapshot.builder()
            .totalCpuCores(totalCpuCores)
            .availableCpuCores(availableCpuCores)
            .totalRamGb(totalRamGb)
            .availableRamGb(availableRamGb)
            .cpuPercent(cpuLoad * 100.0)
            .ramPercent(ramPercent)
            .build();
    }

    private double sampleOrNaN(ToDoubleFunction<ResourceSnapshot> metric) {
        try {
            return metric.applyAsDouble(getCurrentResources());
        } catch (ResourceSamplingException e) {
            log.debug("Resource gauge unavailable: {}", e.getMessage());
            return Double.NaN;
        }
    }

    private static void checkConsumptionFactor(double consumptionFactor) {
        if (!(consumptionFactor > 0) || Double.isInfinite(consumptionFactor)) {
            throw new IllegalArgumentException("Consumption factor must be positive: " + consumptionFactor);
        }
    }

    private static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
