package org.learningjava.abtool.domain.service.stats;

/**
 * Standard normal helpers. {@code erf} uses the Abramowitz-Stegun 7.1.26 rational
 * approximation, max absolute error about 1.5e-7.
 */
public final class NormalDistribution {

    private static final double A1 = 0.254829592;
    private static final double A2 = -0.284496736;
    private static final double A3 = 1.421413741;
    private static final double A4 = -1.453152027;
    private static final double A5 = 1.061405429;
    private static final double P = 0.3275911;

    private static final double SQRT_2 = Math.sqrt(2.0);

    private NormalDistribution() { }

    public static double erf(double x) {
        double sign = x >= 0 ? 1.0 : -1.0;
        double ax = Math.abs(x);

        double t = 1.0 / (1.0 + P * ax);
        double y = 1.0 - (((((A5 * t + A4) * t) + A3) * t + A2) * t + A1) * t * Math.exp(-ax * ax);

        return sign * y;
    }

    /** Phi(x) = 0.5 * (1 + erf(x / sqrt(2))). */
    public static double cdf(double x) {
        return 0.5 * (1.0 + erf(x / SQRT_2));
    }

    /** 2 * (1 - Phi(|z|)), clamped to [0, 1]. */
    public static double twoTailedPValue(double z) {
        double p = 2.0 * (1.0 - cdf(Math.abs(z)));
        return Math.min(1.0, Math.max(0.0, p));
    }
}
