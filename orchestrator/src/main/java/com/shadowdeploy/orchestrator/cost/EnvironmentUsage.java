package com.shadowdeploy.orchestrator.cost;

/** Lifetime totals of one environment. */
public record EnvironmentUsage(int count, double computeHours, double cost, double savedCost) {

    public static EnvironmentUsage empty() {
        return new EnvironmentUsage(0, 0, 0, 0);
    }

    public EnvironmentUsage plus(ExecutionRecord e) {
        return new EnvironmentUsage(count + 1, computeHours + e.totalComputeHours(),
                cost + e.cost(), savedCost + e.savedCost());
    }
}
