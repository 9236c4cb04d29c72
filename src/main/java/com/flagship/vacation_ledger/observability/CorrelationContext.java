package com.flagship.vacation_ledger.observability;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Per-thread correlation id plus the MDC keys used across the workflow.
 *
 * The id comes from the {@code X-Correlation-ID} header or is generated by
 * {@link CorrelationIdFilter}; it is echoed in the response, printed on every
 * log line and returned in error bodies.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String PRINCIPAL_ID_MDC_KEY = "principalId";
    public static final String REQUEST_ID_MDC_KEY = "vacationRequestId";
    public static final String ACCOUNT_ID_MDC_KEY = "accountId";

    private static final int MAX_LENGTH = 64;
    private static final Pattern ALLOWED = Pattern.compile("[A-Za-z0-9._-]+");

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * @return the current id, or null outside an HTTP request
     */
    public static String getCorrelationId() {
        return correlationId.get();
    }

    public static void setCorrelationId(String id) {
        correlationId.set(id);
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Keeps a caller-supplied id only if it is short and log-safe; otherwise
     * a fresh one is generated.
     */
    public static String acceptOrGenerate(String candidate) {
        if (candidate != null) {
            String trimmed = candidate.trim();
            if (!trimmed.isEmpty() && trimmed.length() <= MAX_LENGTH && ALLOWED.matcher(trimmed).matches()) {
                return trimmed;
            }
        }
        return generateCorrelationId();
    }

    // 8 hex chars: short enough to grep, unique enough per day of logs
    static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
