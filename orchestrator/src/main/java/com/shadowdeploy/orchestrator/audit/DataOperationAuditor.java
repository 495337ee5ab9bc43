package com.shadowdeploy.orchestrator.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Writes data-operation events (engine commands, swaps, deployments,
 * rollbacks) to the {@code shadowdeploy.audit} logger.
 *
 * Retention and rotation of that log are owned by the logging backend.
 */
@Component
public class DataOperationAuditor {

    private static final Logger audit = LoggerFactory.getLogger("shadowdeploy.audit");

    public void record(String operation, Map<String, ?> fields) {
        String details = fields.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(" "));
        audit.info("operation={} {}", operation, details);
    }
}
