package com.platform.clusterchaos.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Structured logger for chaos actions and run lifecycle.
 *
 * Every container action and phase change goes through here so a run can be
 * reconstructed from the JSON lines alone.
 */
@Component
public class StructuredLogger {

    @Value("${spring.application.name:cluster-chaos-harness}")
    private String serviceName;

    /**
     * Get chaos event logger.
     */
    public ChaosLogger chaos() {
        return new ChaosLogger(serviceName);
    }

    /**
     * Get run lifecycle logger.
     */
    public RunLogger run() {
        return new RunLogger(serviceName);
    }

    // ==================== CHAOS LOGGER ====================

    public static class ChaosLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.chaos");
        private final String service;

        ChaosLogger(String service) {
            this.service = service;
        }

        public void nodeStopped(int nodeIndex, int port, String containerId) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, LogEventType.NODE_STOPPED, "INFO")
                .nodeIndex(nodeIndex)
                .port(port)
                .containerId(containerId)
                .success(true)
                .build();
            log.info(event.toJson());
        }

        public void nodeStarted(int nodeIndex, int port, String containerId) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, LogEventType.NODE_STARTED, "INFO")
                .nodeIndex(nodeIndex)
                .port(port)
                .containerId(containerId)
                .success(true)
                .build();
            log.info(event.toJson());
        }

        public void nodeHealthy(int nodeIndex, int restPort, int attempts) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, LogEventType.NODE_HEALTHY, "INFO")
                .nodeIndex(nodeIndex)
                .port(restPort)
                .context(Map.of("attempts", attempts))
                .build();
            log.info(event.toJson());
        }

        public void workloadCompleted(String operation, int port, long first, long count, boolean passed, long durationMs) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, LogEventType.WORKLOAD_COMPLETED, "INFO")
                .operation(operation)
                .port(port)
                .success(passed)
                .durationMs(durationMs)
                .context(Map.of("first", first, "count", count))
                .build();
            log.info(event.toJson());
        }
    }

    // ==================== RUN LOGGER ====================

    public static class RunLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.run");
        private final String service;

        RunLogger(String service) {
            this.service = service;
        }

        public void started(String scenario, Map<String, Object> settings) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, LogEventType.RUN_STARTED, "INFO")
                .operation(scenario)
                .context(settings)
                .build();
            log.info(event.toJson());
        }

        public void phaseChanged(String from, String to, String reason) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, LogEventType.PHASE_TRANSITION, "INFO")
                .message(reason)
                .context(Map.of("from", from, "to", to))
                .build();
            log.info(event.toJson());
        }

        public void completed(String scenario, long written, long durationMs) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, LogEventType.RUN_COMPLETED, "INFO")
                .operation(scenario)
                .success(true)
                .durationMs(durationMs)
                .context(Map.of("written", written))
                .build();
            log.info(event.toJson());
        }

        public void failed(String scenario, String errorCode, String errorMessage, long durationMs) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, LogEventType.RUN_FAILED, "ERROR")
                .operation(scenario)
                .success(false)
                .durationMs(durationMs)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .build();
            log.error(event.toJson());
        }
    }
}
