package com.colorcorrection.config;

import org.slf4j.MDC;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * MDC keys of this service: {@code traceId}/{@code spanId} per API request,
 * {@code batchId} on the batch launcher and its workers.
 */
public final class TraceContextManager {

    public static final String TRACE_ID = "traceId";
    public static final String SPAN_ID = "spanId";
    public static final String BATCH_ID = "batchId";
    public static final String TRACE_HEADER = "X-Trace-Id";

    private static final Pattern CLIENT_TRACE_ID = Pattern.compile("[A-Za-z0-9-]{8,64}");

    private TraceContextManager() {}

    /**
     * Starts the trace of one API request. A client {@code X-Trace-Id} is kept
     * when it is 8 to 64 letters, digits or dashes; anything else is replaced
     * so header content never reaches the log verbatim.
     */
    public static String ensureForHttp(HttpServletRequest request, HttpServletResponse response) {
        String traceId = request.getHeader(TRACE_HEADER);
        if (traceId == null || !CLIENT_TRACE_ID.matcher(traceId).matches()) {
            traceId = generateTraceId();
        }

        MDC.put(TRACE_ID, traceId);
        MDC.put(SPAN_ID, generateSpanId());

        if (response != null) {
            response.setHeader(TRACE_HEADER, traceId);
        }

        return traceId;
    }

    /**
     * Tags the current thread with a batch id. Executors created by
     * {@link ExecutorConfig} copy it to every worker.
     */
    public static void enterBatch(String batchId) {
        MDC.put(BATCH_ID, batchId);
    }

    public static void exitBatch() {
        MDC.remove(BATCH_ID);
    }

    public static String generateTraceId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    public static String generateSpanId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }

    public static void clear() {
        MDC.remove(TRACE_ID);
        MDC.remove(SPAN_ID);
        MDC.remove(BATCH_ID);
    }
}
