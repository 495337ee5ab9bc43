package com.shadowdeploy.orchestrator.service;

/**
 * Another deployment to the same environment has not finished yet.
 */
public class DeploymentInProgressException extends RuntimeException {

    private final String environment;

    public DeploymentInProgressException(String environment) {
        super("A deployment to environment '" + environment + "' is already in progress");
        this.environment = environment;
    }

    public String getEnvironment() {
        return environment;
    }
}
