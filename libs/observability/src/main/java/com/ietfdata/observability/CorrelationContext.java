package com.ietfdata.observability;

import java.util.UUID;

/**
 * Immutable correlation context for one client operation.
 * <p>
 * A caller-facing operation (a resolve, a list walk, a history lookup) establishes a
 * {@code CorrelationContext} so that every page fetch it triggers logs and traces under the same
 * identifier. The values are injected into SLF4J MDC by {@link CorrelationContextHolder}.
 *
 * @param correlationId unique ID shared by every fetch of the operation
 * @param operation     logical operation name, e.g. {@code resolve} or {@code list} (nullable)
 * @param target        what the operation works on, e.g. a resource kind or URI (nullable)
 */
public record CorrelationContext(
        String correlationId,
        String operation,
        String target
) {

    /**
     * MDC key for correlation ID.
     */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /**
     * MDC key for the operation name.
     */
    public static final String MDC_OPERATION = "operation";

    /**
     * MDC key for the operation target.
     */
    public static final String MDC_TARGET = "target";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Creates a context with a fresh random correlation ID.
     */
    public static CorrelationContext forOperation(String operation, String target) {
        return new CorrelationContext(UUID.randomUUID().toString(), operation, target);
    }

    /**
     * Returns a copy that keeps this correlation ID but names a nested operation.
     */
    public CorrelationContext withOperation(String operation, String target) {
        return new CorrelationContext(correlationId, operation, target);
    }
}
