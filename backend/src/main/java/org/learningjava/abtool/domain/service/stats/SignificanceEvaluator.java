package org.learningjava.abtool.domain.service.stats;

import org.learningjava.abtool.domain.model.experiment.StatisticalResult;
import org.learningjava.abtool.domain.model.experiment.VariantOutcome;
import org.springframework.stereotype.Component;

/**
 * Two-proportion z-test between two variants. Pure: reads only its arguments.
 * <p>
 * {@code a} is reported as the baseline ({@code controlRate}) and {@code b} as the challenger
 * ({@code variantRate}); swapping them leaves {@code |z|} and the p-value unchanged.
 */
@Component
public class SignificanceEvaluator {

    public static final double DEFAULT_ALPHA = 0.05;

    /**
     * @return null while either variant has fewer than {@code minSampleSize} impressions
     */
    public StatisticalResult evaluate(VariantOutcome a, VariantOutcome b, int minSampleSize) {
        return evaluate(a, b, minSampleSize, DEFAULT_ALPHA);
    }

    /**
     * @param alpha p-value below which a winner is named
     * @return null while either variant has fewer than {@code minSampleSize} impressions
     */
    public StatisticalResult evaluate(VariantOutcome a, VariantOutcome b, int minSampleSize, double alpha) {
        // sample-size gate comes before any arithmetic
        if (a.impressions() < minSampleSize || b.impressions() < minSampleSize) {
            return null;
        }

        double rateA = a.conversionRate();
        double rateB = b.conversionRate();
        Double improvement = rateA == 0.0 ? null : (rateB - rateA) / rateA * 100.0;

        if (a.impressions() == 0 || b.impressions() == 0) {
            return noDifference(a, b, rateA, rateB, improvement);
        }

        double pooled = (double) (a.conversions() + b.conversions()) / (a.impressions() + b.impressions());
        double se = Math.sqrt(pooled * (1.0 - pooled) * (1.0 / a.impressions() + 1.0 / b.impressions()));
        if (se == 0.0 || !Double.isFinite(se)) {
            return noDifference(a, b, rateA, rateB, improvement);
        }

        double z = Math.abs(rateA - rateB) / se;
        double pValue = NormalDistribution.twoTailedPValue(z);

        String winner = StatisticalResult.NO_SIGNIFICANT_DIFFERENCE;
        if (pValue < alpha && rateA != rateB) {
            winner = rateB > rateA ? b.variantId() : a.variantId();
        }

        return new StatisticalResult(
                a.variantId(),
                b.variantId(),
                rateA,
                rateB,
                improvement,
                z,
                pValue,
                winner,
                confidence(pValue)
        );
    }

    static int confidence(double pValue) {
        return (int) Math.round((1.0 - pValue) * 100.0);
    }

    private static StatisticalResult noDifference(VariantOutcome a, VariantOutcome b,
                                                  double rateA, double rateB, Double improvement) {
        return new StatisticalResult(
                a.variantId(),
                b.variantId(),
                rateA,
                rateB,
                improvement,
                0.0,
                1.0,
                StatisticalResult.NO_SIGNIFICANT_DIFFERENCE,
                confidence(1.0)
        );
    }
}
