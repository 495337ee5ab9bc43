package com.shadowdeploy.orchestrator.cost;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for CostTracker over a real JSON ledger in a temp directory.
 */
class CostTrackerTest {

    static final Instant NOW = Instant.parse("2026-10-19T12:00:00Z");

    @TempDir Path dir;

    MutableClock       clock;
    JsonFileCostLedger ledger;
    CostTracker        tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        ObjectMapper json = new ObjectMapper().registerModule(new JavaTimeModule());
        ledger = new JsonFileCostLedger(dir.resolve("cost_metrics.json"), json, clock);
        tracker = new CostTracker(ledger, clock, 2.0, "USD");
    }

    // ------------------------------------------------------------------
    // Classification
    // ------------------------------------------------------------------

    @ParameterizedTest
    @ValueSource(strings = {"dev", "feature", "feature-login", "feature/checkout"})
    void isVirtualEnvironment_devAndFeatureBranches_areVirtual(String environment) {
        assertThat(tracker.isVirtualEnvironment(environment)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"staging", "prod", "development", "my-feature", "qa"})
    void isVirtualEnvironment_everythingElse_isPhysical(String environment) {
        assertThat(tracker.isVirtualEnvironment(environment)).isFalse();
    }

    @Test
    void trackExecution_physical_chargesCostOnly() {
        ExecutionRecord record = tracker.trackExecution("prod", new ExecutionData(3, 12.5, 4));

        assertThat(record.isVirtual()).isFalse();
        assertThat(record.physicalComputeHours()).isEqualTo(3.0);
        assertThat(record.virtualComputeHours()).isZero();
        assertThat(record.cost()).isEqualTo(6.0);
        assertThat(record.savedCost()).isZero();
        assertThat(record.timestamp()).isEqualTo(NOW);
    }

    @Test
    void trackExecution_costPlusSavedAlwaysEqualsHoursTimesRate() {
        for (String env : List.of("dev", "staging", "feature-x", "prod")) {
            ExecutionRecord r = tracker.trackExecution(env, new ExecutionData(1.75, 0, 1));

            assertThat(r.cost() + r.savedCost()).isCloseTo(1.75 * 2.0, within(1e-9));
            assertThat(r.cost() == 0 ^ r.savedCost() == 0).isTrue();
        }
    }

    @Test
    void trackModelCost_convertsSecondsToHours() {
        ExecutionRecord record = tracker.trackModelCost("stg_orders", "dev", 5400);

        assertThat(record.virtualComputeHours()).isEqualTo(1.5);
        assertThat(record.modelsProcessed()).isEqualTo(1);
        assertThat(record.model()).isEqualTo("stg_orders");
    }

    // ------------------------------------------------------------------
    // Savings
    // ------------------------------------------------------------------

    @Test
    void calculateSavings_mixedLedger_computesPercentageToOneDecimal() {
        tracker.trackExecution("dev",       new ExecutionData(10, 0, 1));
        tracker.trackExecution("staging",   new ExecutionData(5, 0, 1));
        tracker.trackExecution("feature-a", new ExecutionData(15, 0, 1));

        SavingsReport month = tracker.calculateSavings(ReportingPeriod.MONTH);

        assertThat(month.savingsPercentage()).isEqualTo(83.3);
        assertThat(month.virtualComputeHours()).isEqualTo(25.0);
        assertThat(month.physicalComputeHours()).isEqualTo(5.0);
        assertThat(month.actualCost()).isEqualTo(10.0);
        assertThat(month.savedCost()).isEqualTo(50.0);
        assertThat(month.potentialCost()).isEqualTo(60.0);
        assertThat(month.currency()).isEqualTo("USD");
    }

    @Test
    void calculateSavings_emptyLedger_reportsZeroPercent() {
        SavingsReport month = tracker.calculateSavings(ReportingPeriod.MONTH);

        assertThat(month.savingsPercentage()).isZero();
        assertThat(month.actualCost()).isZero();
    }

    @Test
    void calculateSavings_isIdempotentForFixedLedgerAndClock() {
        tracker.trackExecution("dev",  new ExecutionData(2, 0, 1));
        tracker.trackExecution("prod", new ExecutionData(1, 0, 1));

        assertThat(tracker.calculateSavings(ReportingPeriod.WEEK))
                .isEqualTo(tracker.calculateSavings(ReportingPeriod.WEEK));
    }

    @Test
    void calculateSavings_filtersByPeriodWindow() {
        clock.set(NOW.minus(Duration.ofDays(10)));
        tracker.trackExecution("prod", new ExecutionData(4, 0, 1));
        clock.set(NOW.minus(Duration.ofHours(2)));
        tracker.trackExecution("prod", new ExecutionData(1, 0, 1));
        clock.set(NOW);

        assertThat(tracker.calculateSavings(ReportingPeriod.DAY).physicalComputeHours()).isEqualTo(1.0);
        assertThat(tracker.calculateSavings(ReportingPeriod.WEEK).physicalComputeHours()).isEqualTo(1.0);
        assertThat(tracker.calculateSavings(ReportingPeriod.MONTH).physicalComputeHours()).isEqualTo(5.0);
    }

    @Test
    void reportingPeriod_unknownName_fallsBackToMonth() {
        assertThat(ReportingPeriod.fromName("fortnight")).isEqualTo(ReportingPeriod.MONTH);
        assertThat(ReportingPeriod.fromName("Quarter")).isEqualTo(ReportingPeriod.QUARTER);
        assertThat(ReportingPeriod.fromName(null)).isEqualTo(ReportingPeriod.MONTH);
    }

    // ------------------------------------------------------------------
    // ROI
    // ------------------------------------------------------------------

    @Test
    void calculateROI_quarterlySavingsOf3000_breaksEvenInTenMonths() {
        tracker.trackExecution("dev", new ExecutionData(1500, 0, 1));   // $3000 saved

        RoiReport roi = tracker.calculateROI(10_000);

        assertThat(roi.quarterlySavings()).isEqualTo(3000.0);
        assertThat(roi.yearlySavings()).isEqualTo(12_000.0);
        assertThat(roi.roi()).isEqualTo("20.0");
        assertThat(roi.paybackPeriodMonths()).isEqualTo("10.0");
        assertThat(roi.breakEven()).isTrue();
    }

    @Test
    void calculateROI_expensiveImplementation_doesNotBreakEven() {
        tracker.trackExecution("dev", new ExecutionData(1500, 0, 1));

        RoiReport roi = tracker.calculateROI(50_000);

        assertThat(roi.breakEven()).isFalse();
        assertThat(Double.parseDouble(roi.paybackPeriodMonths())).isGreaterThan(12);
        assertThat(roi.roi()).isEqualTo("-76.0");
    }

    @Test
    void calculateROI_noSavings_neverBreaksEven() {
        RoiReport roi = tracker.calculateROI();

        assertThat(roi.implementationCost()).isEqualTo(10_000.0);
        assertThat(roi.paybackPeriodMonths()).isEqualTo("Infinity");
        assertThat(roi.breakEven()).isFalse();
    }

    @Test
    void calculateROI_nonPositiveCost_isRejected() {
        assertThatThrownBy(() -> tracker.calculateROI(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Recommendations and report
    // ------------------------------------------------------------------

    @Test
    void generateRecommendations_physicalHeavyMonth_flagsCostAndVirtualUsage() {
        tracker.trackExecution("prod", new ExecutionData(600, 0, 1));   // $1200

        List<String> recs = tracker.generateRecommendations(tracker.calculateSavings(ReportingPeriod.MONTH));

        assertThat(recs).containsExactly(
                "Consider moving more development to virtual environments to increase savings",
                "Increase use of virtual environments for development and testing",
                "High compute costs detected. Review model efficiency and consider optimization",
                "Use feature branch environments with auto-cleanup to reduce costs");
    }

    @Test
    void generateRecommendations_highSavings_congratulates() {
        tracker.trackExecution("dev",  new ExecutionData(9, 0, 1));
        tracker.trackExecution("prod", new ExecutionData(1, 0, 1));

        List<String> recs = tracker.generateRecommendations(tracker.calculateSavings(ReportingPeriod.MONTH));

        assertThat(recs).containsExactly(
                "Excellent cost optimization! Consider documenting your strategy for other teams");
    }

    @Test
    void getEnvironmentBreakdown_groupsByEnvironment() {
        tracker.trackExecution("dev",  new ExecutionData(2, 0, 1));
        tracker.trackExecution("dev",  new ExecutionData(3, 0, 1));
        tracker.trackExecution("prod", new ExecutionData(1, 0, 1));

        Map<String, EnvironmentUsage> breakdown = tracker.getEnvironmentBreakdown();

        assertThat(breakdown).containsOnlyKeys("dev", "prod");
        assertThat(breakdown.get("dev")).isEqualTo(new EnvironmentUsage(2, 5.0, 0.0, 10.0));
        assertThat(breakdown.get("prod")).isEqualTo(new EnvironmentUsage(1, 1.0, 2.0, 0.0));
    }

    @ParameterizedTest
    @NullSource
    @ValueSource(strings = {"", "   "})
    void trackModelCost_missingEnvironment_rejectedAndNotRecorded(String environment) {
        assertThatThrownBy(() -> tracker.trackModelCost("orders", environment, 3600))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("environment");

        assertThat(ledger.load().executions()).isEmpty();
        assertThat(tracker.getEnvironmentBreakdown()).isEmpty();
    }

    @Test
    void getEnvironmentBreakdown_recordWithoutEnvironment_groupedAsUnknown() {
        ledger.append(new ExecutionRecord(NOW, null, false, 1, 0, 0, 1, 2, 0, null));
        tracker.trackExecution("prod", new ExecutionData(1, 0, 1));

        Map<String, EnvironmentUsage> breakdown = tracker.getEnvironmentBreakdown();

        assertThat(breakdown).containsOnlyKeys("prod", "unknown");
        assertThat(breakdown.get("unknown").count()).isEqualTo(1);
        assertThat(tracker.generateReport().environmentBreakdown()).containsKey("unknown");
    }

    @Test
    void generateReport_summarisesMonthlyPeriod() {
        tracker.trackExecution("dev",     new ExecutionData(10, 0, 1));
        tracker.trackExecution("staging", new ExecutionData(5, 0, 1));

        CostReport report = tracker.generateReport();

        assertThat(report.periods()).containsOnlyKeys("daily", "weekly", "monthly", "quarterly");
        assertThat(report.summary().totalSavings()).isEqualTo(20.0);
        assertThat(report.summary().savingsPercentage()).isEqualTo(66.7);
        assertThat(report.environmentBreakdown()).containsOnlyKeys("dev", "staging");
        assertThat(report.generatedAt()).isEqualTo(NOW);
    }

    @Test
    void clear_emptiesLedger() {
        tracker.trackExecution("prod", new ExecutionData(1, 0, 1));

        tracker.clear();

        assertThat(tracker.getEnvironmentBreakdown()).isEmpty();
    }
}
