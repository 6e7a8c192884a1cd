package org.cronpulse.config.utils;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys shared by every log line: {@code component} and {@code trace.id} always,
 * {@code job.id} and {@code owner.id} while a job is being dispatched.
 * <p>
 * Each thread starts its own context and clears it in a finally block. Dispatch workers reuse the
 * cycle's trace id so all lines of one poll cycle correlate.
 */
public final class LogContext {

    public static final String COMPONENT = "component";
    public static final String TRACE_ID = "trace.id";
    public static final String JOB_ID = "job.id";
    public static final String OWNER_ID = "owner.id";

    private LogContext() {}

    public static void start(String component) {
        start(component, null);
    }

    public static void start(String component, String traceId) {
        MDC.put(COMPONENT, component);
        MDC.put(TRACE_ID, traceId != null ? traceId : newTraceId());
    }

    public static void job(UUID jobId, String ownerId) {
        MDC.put(JOB_ID, String.valueOf(jobId));
        MDC.put(OWNER_ID, ownerId);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    public static void clear() {
        MDC.clear();
    }

    private static String newTraceId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }
}
