package com.di.splitnova.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Writes one structured line per lifecycle event of a sampling job or request
 * ({@code *_STARTED}, {@code *_COMPLETED}, {@code *_FAILED}).
 *
 * <p>Every event carries the application instance id, the transaction id (normally the MDC
 * {@code jobId}), the thread and an ISO-8601 timestamp, so runs can be traced across log files.
 */
@Slf4j
@Component
public class TransactionEventLogger {

    private static final int STACK_TRACE_LINES = 5;

    private final ObjectMapper mapper = new ObjectMapper();
    private final String applicationId;

    public TransactionEventLogger(@Value("${spring.application.name:splitnova}") String applicationName) {
        this.applicationId = applicationName + "-" + UUID.randomUUID().toString().substring(0, 8);
        log.info("[TX] TransactionEventLogger initialized with applicationId: {}", applicationId);
    }

    public String getApplicationId() {
        return applicationId;
    }

    public void logEvent(String eventType, Map<String, Object> context, String transactionId, String transactionContext) {
        logEvent(eventType, context, transactionId, transactionContext, null);
    }

    /**
     * @param eventType          e.g. {@code SAMPLING_JOB_COMPLETED}
     * @param context            event details; not modified
     * @param transactionId      job or request id; {@code "unknown"} when {@code null}
     * @param transactionContext short label of the operation (e.g. {@code file_sampling})
     * @param exception          failure cause for {@code *_FAILED} events, else {@code null}
     */
    public void logEvent(String eventType, Map<String, Object> context, String transactionId,
                         String transactionContext, Throwable exception) {
        Thread thread = Thread.currentThread();
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("eventType", eventType);
        event.put("timestamp", Instant.now().toString());
        event.put("applicationId", applicationId);
        event.put("transactionId", transactionId != null ? transactionId : "unknown");
        event.put("threadId", thread.getId());
        event.put("threadName", thread.getName());
        if (transactionContext != null && !transactionContext.isEmpty()) {
            event.put("transactionContext", transactionContext);
        }
        if (context != null && !context.isEmpty()) {
            event.put("context", context);
        }
        if (exception != null) {
            event.put("stackTraceSummary", stackTraceSummary(exception));
        }

        if (exception != null) {
            log.warn("[TX] EVENT: {}", toJson(event));
        } else {
            log.info("[TX] EVENT: {}", toJson(event));
        }
    }

    private String toJson(Map<String, Object> event) {
        try {
            return mapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.debug("[TX] Event not serializable as JSON, falling back to toString: {}", e.getMessage());
            return event.toString();
        }
    }

    static String stackTraceSummary(Throwable exception) {
        StringWriter sw = new StringWriter();
        exception.printStackTrace(new PrintWriter(sw));
        String[] lines = sw.toString().split("\n");
        StringBuilder summary = new StringBuilder();
        for (int i = 0; i < Math.min(STACK_TRACE_LINES, lines.length); i++) {
            if (i > 0) summary.append(" | ");
            summary.append(lines[i].trim());
        }
        if (lines.length > STACK_TRACE_LINES) {
            summary.append(" | ... (").append(lines.length - STACK_TRACE_LINES).append(" more lines)");
        }
        return summary.toString();
    }
}
