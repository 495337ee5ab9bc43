package com.shadowdeploy.orchestrator.engine.bridge;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Request envelope passed to a bridge executable as its last argument.
 * Must match the {"command", "args", "options", "project_path"} object the
 * bridge scripts parse.
 */
public record BridgeRequest(
        String              command,
        List<String>        args,
        Map<String, Object> options,
        @JsonProperty("project_path") String projectPath
) {
    public BridgeRequest {
        args    = args == null ? List.of() : List.copyOf(args);
        options = options == null ? Map.of() : options;
    }
}
