package com.emma.client.logging;

import org.slf4j.MDC;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and automatically removes them on close.
 * A key that was already set by an enclosing context gets its previous value back.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forMember("1234", 55L, "update")) {
 *     log.info("member.updated memberId={}", memberId);
 * } // MDC entries are automatically cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final Deque<String[]> previous = new ArrayDeque<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a single API request.
     */
    public static LogContext forRequest(String accountId, String method, String path) {
        LogContext ctx = new LogContext();
        ctx.put("accountId", accountId);
        ctx.put("method", method);
        ctx.put("path", path);
        return ctx;
    }

    /**
     * Creates a log context for a member operation. The member id may be null
     * for members not created yet.
     */
    public static LogContext forMember(String accountId, Long memberId, String operation) {
        LogContext ctx = new LogContext();
        ctx.put("accountId", accountId);
        if (memberId != null) {
            ctx.put("memberId", memberId.toString());
        }
        ctx.put("operation", operation);
        return ctx;
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        previous.push(new String[]{key, MDC.get(key)});
        MDC.put(key, value);
    }

    @Override
    public void close() {
        while (!previous.isEmpty()) {
            String[] entry = previous.pop();
            if (entry[1] == null) {
                MDC.remove(entry[0]);
            } else {
                MDC.put(entry[0], entry[1]);
            }
        }
    }
}
