package com.flagship.bounty_ledger.observability;

import java.util.UUID;

/**
 * Thread-local holder for the request correlation id and the MDC keys used in log lines.
 *
 * The correlation id comes from the {@code X-Correlation-ID} header (or is generated) and is
 * attached to every log statement of the request. Orchestrators add the task, submission and
 * payment ids they are working on.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String TASK_ID_MDC_KEY = "taskId";
    public static final String SUBMISSION_ID_MDC_KEY = "submissionId";
    public static final String PAYMENT_ID_MDC_KEY = "paymentId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        correlationId.set(id != null && !id.isBlank() ? id : generateCorrelationId());
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short form for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
