package com.demo.messaging.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Counters for the messaging core, registered on the Micrometer registry
 * and echoed to the debug log.
 */
@Service
@Slf4j
public class MetricsService {

    private final MeterRegistry meterRegistry;

    public MetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    // ===== Counter Metrics =====

    public void incrementCounter(String name) {
        incrementCounter(name, Tags.empty());
    }

    public void incrementCounter(String name, Tags tags) {
        Counter counter = meterRegistry.counter(name, tags);
        counter.increment();
        log.debug("[METRIC] Counter: {}{} = {}", name, tags, counter.count());
    }

    /**
     * Sum over every tag combination of a counter (for debugging and tests)
     */
    public double getCounterValue(String name) {
        return meterRegistry.find(name).counters().stream()
            .mapToDouble(Counter::count)
            .sum();
    }

    // ===== Business Metrics =====

    public void recordMessageSent(boolean reply) {
        incrementCounter("messaging.messages.sent", Tags.of("reply", String.valueOf(reply)));
    }

    public void recordMessageEdited(int version) {
        incrementCounter("messaging.messages.edited");
        log.debug("✏️ Message edit recorded: version={}", version);
    }

    public void recordMessageDeleted() {
        incrementCounter("messaging.messages.deleted");
    }

    public void recordMessagesRead(int count) {
        meterRegistry.counter("messaging.messages.read").increment(count);
    }

    public void recordNotificationCreated(String type) {
        incrementCounter("messaging.notifications.created", Tags.of("type", type));
    }

    public void recordUserDeleted() {
        incrementCounter("messaging.users.deleted");
    }

    public void recordCleanupFailure(String step) {
        incrementCounter("messaging.cleanup.failures", Tags.of("step", step));
        log.warn("⚠️ Cleanup failure recorded: step={}", step);
    }

    public void recordEditConflict() {
        incrementCounter("messaging.edits.conflicts");
    }

    public void recordError(String errorType, String component) {
        incrementCounter("messaging.errors", Tags.of("type", errorType, "component", component));
        log.error("⚠️ Error: type={}, component={}", errorType, component);
    }
}
