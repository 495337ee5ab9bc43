package com.shadowdeploy.orchestrator.api;

import com.shadowdeploy.orchestrator.cost.CostReport;
import com.shadowdeploy.orchestrator.cost.CostTracker;
import com.shadowdeploy.orchestrator.cost.EnvironmentUsage;
import com.shadowdeploy.orchestrator.cost.ReportingPeriod;
import com.shadowdeploy.orchestrator.cost.RoiReport;
import com.shadowdeploy.orchestrator.cost.SavingsReport;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Read-only cost reporting over the ledger.
 *
 * GET /costs/savings?period=day|week|month|quarter
 * GET /costs/roi?implementationCost=10000
 * GET /costs/environments
 * GET /costs/report
 */
@RestController
@RequestMapping("/costs")
public class CostController {

    private final CostTracker costTracker;

    public CostController(CostTracker costTracker) {
        this.costTracker = costTracker;
    }

    /** Unknown periods are reported as {@code month}. */
    @GetMapping("/savings")
    public SavingsReport savings(@RequestParam(defaultValue = "month") String period) {
        return costTracker.calculateSavings(ReportingPeriod.fromName(period));
    }

    @GetMapping("/roi")
    public RoiReport roi(@RequestParam(defaultValue = "10000") double implementationCost) {
        return costTracker.calculateROI(implementationCost);
    }

    @GetMapping("/environments")
    public Map<String, EnvironmentUsage> environments() {
        return costTracker.getEnvironmentBreakdown();
    }

    @GetMapping("/report")
    public CostReport report() {
        return costTracker.generateReport();
    }
}
