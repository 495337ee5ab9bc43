package com.shadowdeploy.orchestrator.cost;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Classifies runs as virtual or physical, writes them to the {@link CostLedger}
 * and derives savings, ROI and recommendations from it.
 *
 * Virtual environments ({@code dev} and {@code feature*}) are free previews:
 * their hours count as saved cost. Everything else is billed at
 * {@code costPerHour}.
 */
@Service
public class CostTracker {

    private static final Logger log = LoggerFactory.getLogger(CostTracker.class);

    static final double LOW_SAVINGS_PERCENT         = 30.0;
    static final double HIGH_SAVINGS_PERCENT        = 50.0;
    static final double MIN_VIRTUAL_RATIO           = 0.5;
    static final double HIGH_MONTHLY_COST           = 1000.0;
    static final double HIGH_PHYSICAL_HOURS         = 100.0;
    static final double DEFAULT_IMPLEMENTATION_COST = 10_000.0;

    static final String UNKNOWN_ENVIRONMENT = "unknown";

    private final CostLedger ledger;
    private final Clock      clock;
    private final double     costPerHour;
    private final String     currency;

    public CostTracker(CostLedger ledger,
                       Clock clock,
                       @Value("${shadowdeploy.cost.cost-per-hour:2.0}") double costPerHour,
                       @Value("${shadowdeploy.cost.currency:USD}") String currency) {
        this.ledger      = ledger;
        this.clock       = clock;
        this.costPerHour = costPerHour;
        this.currency    = currency;
    }

    // ------------------------------------------------------------------
    // Recording
    // ------------------------------------------------------------------

    /**
     * @throws IllegalArgumentException if {@code environment} is blank; nothing is recorded
     */
    public ExecutionRecord trackExecution(String environment, ExecutionData data) {
        if (environment == null || environment.isBlank()) {
            throw new IllegalArgumentException("environment must not be blank");
        }
        boolean virtual = isVirtualEnvironment(environment);
        double hours = Math.max(0, data.computeHours());

        ExecutionRecord record = new ExecutionRecord(
                clock.instant(),
                environment,
                virtual,
                virtual ? 0 : hours,
                virtual ? hours : 0,
                data.dataSizeGB(),
                data.modelsProcessed(),
                virtual ? 0 : hours * costPerHour,
                virtual ? hours * costPerHour : 0,
                data.model());

        ledger.append(record);
        log.debug("Tracked {} execution in {}: {} h", virtual ? "virtual" : "physical", environment, hours);
        return record;
    }

    /** Per-model tracking; {@code computeSeconds} is converted to hours. */
    public ExecutionRecord trackModelCost(String model, String environment, double computeSeconds) {
        return trackExecution(environment, new ExecutionData(computeSeconds / 3600.0, 0, 1, model));
    }

    public boolean isVirtualEnvironment(String environment) {
        return environment != null && (environment.equals("dev") || environment.startsWith("feature"));
    }

    // ------------------------------------------------------------------
    // Reporting
    // ------------------------------------------------------------------

    public SavingsReport calculateSavings(ReportingPeriod period) {
        Instant now = clock.instant();
        List<ExecutionRecord> executions = ledger.executionsSince(now.minus(period.window()));

        double physical = 0, virtual = 0, cost = 0, saved = 0;
        for (ExecutionRecord e : executions) {
            physical += e.physicalComputeHours();
            virtual  += e.virtualComputeHours();
            cost     += e.cost();
            saved    += e.savedCost();
        }

        double denominator = cost + saved;
        double percentage = denominator > 0 ? round1(saved / denominator * 100) : 0;

        return new SavingsReport(period, physical, virtual, cost, saved,
                (physical + virtual) * costPerHour, percentage, currency, now);
    }

    public List<String> generateRecommendations(SavingsReport metrics) {
        List<String> recommendations = new ArrayList<>();

        if (metrics.savingsPercentage() < LOW_SAVINGS_PERCENT) {
            recommendations.add("Consider moving more development to virtual environments to increase savings");
        } else if (metrics.savingsPercentage() >= HIGH_SAVINGS_PERCENT) {
            recommendations.add("Excellent cost optimization! Consider documenting your strategy for other teams");
        }

        double totalHours = metrics.virtualComputeHours() + metrics.physicalComputeHours();
        if (totalHours > 0 && metrics.virtualComputeHours() / totalHours < MIN_VIRTUAL_RATIO) {
            recommendations.add("Increase use of virtual environments for development and testing");
        }

        if (metrics.actualCost() > HIGH_MONTHLY_COST) {
            recommendations.add("High compute costs detected. Review model efficiency and consider optimization");
        }

        if (metrics.physicalComputeHours() > HIGH_PHYSICAL_HOURS) {
            recommendations.add("Use feature branch environments with auto-cleanup to reduce costs");
        }

        return recommendations;
    }

    /**
     * ROI of the setup against quarterly savings extrapolated to a year.
     *
     * @throws IllegalArgumentException if {@code implementationCost <= 0}
     */
    public RoiReport calculateROI(double implementationCost) {
        if (!(implementationCost > 0)) {
            throw new IllegalArgumentException("implementationCost must be positive, got " + implementationCost);
        }
        double quarterly = calculateSavings(ReportingPeriod.QUARTER).savedCost();
        double yearly = quarterly * 4;

        double roi = (yearly - implementationCost) / implementationCost * 100;
        double payback = yearly > 0 ? implementationCost / (yearly / 12) : Double.POSITIVE_INFINITY;

        return new RoiReport(
                implementationCost,
                quarterly,
                yearly,
                format1(roi),
                Double.isInfinite(payback) ? "Infinity" : format1(payback),
                payback <= 12,
                currency);
    }

    public RoiReport calculateROI() {
        return calculateROI(DEFAULT_IMPLEMENTATION_COST);
    }

    /** Lifetime totals per environment, sorted by name. Records without one count as {@value #UNKNOWN_ENVIRONMENT}. */
    public Map<String, EnvironmentUsage> getEnvironmentBreakdown() {
        Map<String, EnvironmentUsage> breakdown = new TreeMap<>();
        for (ExecutionRecord e : ledger.load().executions()) {
            String environment = e.environment() == null ? UNKNOWN_ENVIRONMENT : e.environment();
            breakdown.merge(environment, EnvironmentUsage.empty().plus(e),
                    (current, ignored) -> current.plus(e));
        }
        return breakdown;
    }

    public CostReport generateReport() {
        Map<String, SavingsReport> periods = new LinkedHashMap<>();
        periods.put("daily",     calculateSavings(ReportingPeriod.DAY));
        periods.put("weekly",    calculateSavings(ReportingPeriod.WEEK));
        periods.put("monthly",   calculateSavings(ReportingPeriod.MONTH));
        periods.put("quarterly", calculateSavings(ReportingPeriod.QUARTER));

        SavingsReport monthly = periods.get("monthly");
        return new CostReport(
                new CostReport.Summary(monthly.savedCost(), monthly.savingsPercentage(), currency),
                periods,
                getEnvironmentBreakdown(),
                generateRecommendations(monthly),
                clock.instant());
    }

    public void clear() {
        ledger.clear();
    }

    // ------------------------------------------------------------------

    private static double round1(double value) {
        return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }

    private static String format1(double value) {
        return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_UP).toPlainString();
    }
}
