package com.contracts.registry.util;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

import org.springframework.stereotype.Component;

import com.contracts.registry.exception.ViolationType;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Helper for the registry's custom metrics.
 *
 * Metrics exposed via Prometheus at /actuator/prometheus:
 * - contracts.write (counter): writes by operation and outcome
 * - contracts.integrity.violation (counter): rejected writes by violation type
 * - contracts.query.slow (counter) and contracts.query.duration (timer)
 *
 * @see com.contracts.registry.config.ObservabilityConfig
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MetricsHelper {

    private static final String PREFIX = "contracts";

    private final MeterRegistry meterRegistry;

    /**
     * Records a contract write.
     *
     * @param operation create/update/close/delete
     * @param success whether the write was applied
     */
    public void recordContractWrite(String operation, boolean success) {
        Counter.builder(PREFIX + ".write")
            .tag("operation", operation)
            .tag("status", success ? "success" : "failure")
            .description("Contract write operations")
            .register(meterRegistry)
            .increment();
    }

    /**
     * Records a write rejected by a database constraint.
     *
     * @param type violation type
     * @param constraintName violated constraint, may be null
     */
    public void recordIntegrityViolation(ViolationType type, String constraintName) {
        Counter.builder(PREFIX + ".integrity.violation")
            .tag("type", type.name().toLowerCase(Locale.ROOT))
            .tag("constraint", constraintName != null ? constraintName : "none")
            .description("Writes rejected by database constraints")
            .register(meterRegistry)
            .increment();
    }

    /**
     * Records a query duration, flagging it when it exceeded the slow threshold.
     *
     * @param queryType SELECT/INSERT/UPDATE/DELETE/OTHER
     * @param durationMs duration in milliseconds
     * @param slow whether the threshold was exceeded
     */
    public void recordQuery(String queryType, long durationMs, boolean slow) {
        Timer.builder(PREFIX + ".query.duration")
            .tag("type", queryType)
            .description("Query execution time")
            .register(meterRegistry)
            .record(durationMs, TimeUnit.MILLISECONDS);

        if (slow) {
            Counter.builder(PREFIX + ".query.slow")
                .tag("type", queryType)
                .description("Queries exceeding the slow query threshold")
                .register(meterRegistry)
                .increment();
            log.debug("Slow query recorded: type={}, duration={}ms", queryType, durationMs);
        }
    }
}
