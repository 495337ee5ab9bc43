package com.shadowdeploy.orchestrator.engine;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Reply envelope of one engine call.
 * Must match the JSON object the bridge executables print on stdout:
 * {"success": bool, "stdout": str, "stderr": str, "returncode": int, "error": str?}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EngineResult(
        boolean success,
        String  stdout,
        String  stderr,
        int     returncode,
        String  error
) {
    public static EngineResult failure(String error) {
        return new EngineResult(false, "", "", -1, error);
    }

    /**
     * Best human-readable reason for a failed call: the explicit error,
     * else stderr, else stdout.
     */
    public String failureReason() {
        if (error != null && !error.isBlank())   return error.strip();
        if (stderr != null && !stderr.isBlank()) return stderr.strip();
        if (stdout != null && !stdout.isBlank()) return stdout.strip();
        return "no output from engine (returncode " + returncode + ")";
    }

    public String stdoutOrEmpty() {
        return stdout == null ? "" : stdout;
    }
}
