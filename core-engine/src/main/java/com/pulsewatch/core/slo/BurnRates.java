package com.pulsewatch.core.slo;

/**
 * Burn rates of one tick: the observed bad fraction of each window divided
 * by the error budget fraction. A window without events burns at {@code 0}.
 *
 * @since 1.0.0
 */
public record BurnRates(double corroboration, double oneHour, double sixHours, double oneDay) {

    static double of(long good, long bad, double budgetFraction) {
        long total = good + bad;
        if (total == 0 || budgetFraction <= 0) {
            return 0.0;
        }
        return ((double) bad / total) / budgetFraction;
    }
}
