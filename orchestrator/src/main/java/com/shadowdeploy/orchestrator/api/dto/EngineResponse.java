package com.shadowdeploy.orchestrator.api.dto;

/** Entry of GET /engines. */
public record EngineResponse(String name, String description) {}
