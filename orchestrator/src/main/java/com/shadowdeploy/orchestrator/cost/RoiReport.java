package com.shadowdeploy.orchestrator.cost;

/**
 * Return on investment of the virtual-environment setup.
 * {@code roi} and {@code paybackPeriodMonths} are one-decimal strings.
 */
public record RoiReport(
        double  implementationCost,
        double  quarterlySavings,
        double  yearlySavings,
        String  roi,
        String  paybackPeriodMonths,
        boolean breakEven,
        String  currency
) {}
