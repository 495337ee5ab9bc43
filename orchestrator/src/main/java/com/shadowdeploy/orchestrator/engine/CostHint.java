package com.shadowdeploy.orchestrator.engine;

/**
 * Savings figures an engine reports in its plan output.
 *
 * @param virtualHoursSaved  compute hours avoided by virtual execution
 * @param savingsPercentage  engine-estimated cost savings, in percent
 */
public record CostHint(long virtualHoursSaved, long savingsPercentage) {}
