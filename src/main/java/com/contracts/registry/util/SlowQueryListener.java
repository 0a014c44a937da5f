package com.contracts.registry.util;

import java.util.Locale;

import org.jooq.ExecuteContext;
import org.jooq.ExecuteListener;

import lombok.extern.slf4j.Slf4j;

/**
 * jOOQ listener that times every statement and logs the ones exceeding
 * the configured threshold.
 *
 * Registered in {@link com.contracts.registry.config.JooqConfig}; the threshold
 * comes from {@code contracts.registry.slow-query-threshold-ms}.
 */
@Slf4j
public class SlowQueryListener implements ExecuteListener {

    private static final String START_KEY = SlowQueryListener.class.getName() + ".start";

    private final MetricsHelper metricsHelper;
    private final long thresholdMs;

    public SlowQueryListener(MetricsHelper metricsHelper, long thresholdMs) {
        this.metricsHelper = metricsHelper;
        this.thresholdMs = thresholdMs;
    }

    @Override
    public void executeStart(ExecuteContext ctx) {
        ctx.data(START_KEY, System.nanoTime());
    }

    @Override
    public void executeEnd(ExecuteContext ctx) {
        Object start = ctx.data(START_KEY);
        if (!(start instanceof Long startNanos)) {
            return;
        }

        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        boolean slow = durationMs > thresholdMs;
        String queryType = queryType(ctx.sql());

        metricsHelper.recordQuery(queryType, durationMs, slow);

        if (slow) {
            log.warn("Slow {} query: {}ms (threshold {}ms): {}", queryType, durationMs, thresholdMs, ctx.sql());
        }
    }

    static String queryType(String sql) {
        if (sql == null) {
            return "OTHER";
        }
        String head = sql.trim().toUpperCase(Locale.ROOT);
        for (String type : new String[] {"SELECT", "INSERT", "UPDATE", "DELETE"}) {
            if (head.startsWith(type)) {
                return type;
            }
        }
        return "OTHER";
    }
}
