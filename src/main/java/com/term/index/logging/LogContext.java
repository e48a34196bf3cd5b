package com.term.index.logging;

import org.slf4j.MDC;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Scoped MDC entries for index builds, queries and vocabulary loads.
 * Closing a context puts back whatever value each key had when the context
 * set it, so contexts nest: an inner load inside an outer build leaves the
 * build's {@code operation} in place once the load is done.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forQuery(correlationId, 2)) {
 *     log.debug("query.completed matches={}", matches);
 * }
 * </pre>
 *
 * <p>Must be closed on the thread that opened it.</p>
 */
public class LogContext implements AutoCloseable {

    private final Deque<Saved> saved = new ArrayDeque<>();
    private final Set<String> owned = new HashSet<>();

    private LogContext() {
    }

    public static LogContext forIndexBuild(String indexId) {
        return new LogContext()
                .with("indexId", indexId)
                .with("operation", "build");
    }

    public static LogContext forQuery(String correlationId, int maxDistance) {
        return new LogContext()
                .with("correlationId", correlationId)
                .with("maxDistance", String.valueOf(maxDistance))
                .with("operation", "query");
    }

    public static LogContext forLoad(String format) {
        return new LogContext()
                .with("format", format)
                .with("operation", "load");
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Sets one more MDC entry for the lifetime of this context.
     */
    public LogContext with(String key, String value) {
        if (owned.add(key)) {
            saved.push(new Saved(key, MDC.get(key)));
        }
        MDC.put(key, value);
        return this;
    }

    @Override
    public void close() {
        while (!saved.isEmpty()) {
            Saved entry = saved.pop();
            if (entry.value() == null) {
                MDC.remove(entry.key());
            } else {
                MDC.put(entry.key(), entry.value());
            }
        }
        owned.clear();
    }

    private record Saved(String key, String value) {}
}
