package com.shadowdeploy.orchestrator.api.dto;

/**
 * Request body for POST /deployments.
 *
 * Required: environment
 * Optional: engine, used only when neither the X-Transform-Engine header
 *   nor the {@code engine} query parameter names one.
 */
public record DeployRequest(String environment, String engine) {}
