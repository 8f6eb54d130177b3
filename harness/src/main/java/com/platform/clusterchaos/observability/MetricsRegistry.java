package com.platform.clusterchaos.observability;

import com.platform.clusterchaos.core.PollOutcome;
import com.platform.clusterchaos.model.WorkloadOperation;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Central registry for harness metrics: readiness probes, workload runs and container actions.
 */
@Slf4j
@Component
public class MetricsRegistry {

    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters;
    private final Map<String, Timer> timers;

    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.counters = new ConcurrentHashMap<>();
        this.timers = new ConcurrentHashMap<>();
    }

    /**
     * Record one readiness probe and how it was classified.
     */
    public void recordPollAttempt(String target, PollOutcome.Kind outcome) {
        incrementCounter("harness.poll.attempt", "target", target, "outcome", outcome.name().toLowerCase());
    }

    public void recordRetryExhausted(String target) {
        incrementCounter("harness.poll.exhausted", "target", target);
    }

    /**
     * Record a finished driver invocation.
     */
    public void recordWorkload(WorkloadOperation operation, Duration duration, boolean passed) {
        String key = "workload." + operation.behaviour();
        Timer timer = timers.computeIfAbsent(key, k ->
            Timer.builder("harness.workload.duration")
                .tag("operation", operation.behaviour())
                .register(meterRegistry));
        timer.record(duration);
        incrementCounter("harness.workload.result",
            "operation", operation.behaviour(), "passed", String.valueOf(passed));
    }

    public void recordContainerAction(String action) {
        incrementCounter("harness.container.action", "action", action);
    }

    /**
     * Increment a counter with tags.
     */
    public void incrementCounter(String name, String... tags) {
        String key = name + String.join(".", tags);
        counters.computeIfAbsent(key, k ->
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry))
            .increment();
    }

    /**
     * Flattened view of every counter and timer, for the end-of-run summary.
     */
    public Map<String, String> snapshot() {
        Map<String, String> values = new TreeMap<>();
        for (Meter meter : meterRegistry.getMeters()) {
            String id = describe(meter);
            if (meter instanceof Counter counter) {
                values.put(id, String.valueOf((long) counter.count()));
            } else if (meter instanceof Timer timer) {
                values.put(id, String.format("count=%d total=%.0fms",
                    timer.count(), timer.totalTime(TimeUnit.MILLISECONDS)));
            }
        }
        return values;
    }

    private String describe(Meter meter) {
        StringBuilder id = new StringBuilder(meter.getId().getName());
        meter.getId().getTags().forEach(tag -> id.append('[').append(tag.getKey()).append('=')
            .append(tag.getValue()).append(']'));
        return id.toString();
    }
}
