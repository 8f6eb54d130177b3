package com.platform.clusterchaos.observability;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import lombok.Builder;
import lombok.Data;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.Map;

/**
 * Structured log event schema for chaos actions.
 *
 * Mandatory fields:
 * - timestamp (RFC3339)
 * - level
 * - service
 * - event_type
 *
 * Contextual fields from MDC:
 * - run_id
 * - phase
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StructuredLogEvent {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);

    // Mandatory fields
    private String timestamp;
    private String level;
    private String service;
    private LogEventType eventType;

    // Run context (from MDC)
    private String runId;
    private String phase;

    // Event-specific data
    private String message;
    private Integer nodeIndex;
    private Integer port;
    private String containerId;
    private String operation;
    private Boolean success;
    private Long durationMs;
    private String errorCode;
    private String errorMessage;

    // Additional context
    private Map<String, Object> context;

    /**
     * Convert to JSON string for logging.
     */
    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            return String.format("{\"event_type\":\"%s\",\"message\":\"%s\",\"error\":\"serialization_failed\"}",
                eventType, message);
        }
    }

    /**
     * Create builder with mandatory fields from context.
     */
    public static StructuredLogEventBuilder fromContext(String service, LogEventType eventType, String level) {
        return StructuredLogEvent.builder()
            .timestamp(Instant.now().toString())
            .level(level)
            .service(service)
            .eventType(eventType)
            .runId(MDC.get(MdcKeys.RUN_ID))
            .phase(MDC.get(MdcKeys.PHASE));
    }
}
