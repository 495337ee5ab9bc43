package com.shadowdeploy.orchestrator.cost;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Everything the cost endpoints know, in one document. */
public record CostReport(
        Summary                       summary,
        Map<String, SavingsReport>    periods,
        Map<String, EnvironmentUsage> environmentBreakdown,
        List<String>                  recommendations,
        Instant                       generatedAt
) {
    /** Headline numbers, taken from the monthly period. */
    public record Summary(double totalSavings, double savingsPercentage, String currency) {}
}
