package org.learningjava.abtool.domain.model.experiment;

import java.util.List;

/** Values applied when an {@link ExperimentConfig} leaves a field unset. */
public record ExperimentDefaults(
        int minSampleSize,
        double significanceThreshold,
        int durationDays,
        double statisticalPower,
        double expectedEffectSize,
        List<String> metrics
) {
    public static final List<String> DEFAULT_METRICS = List.of("engagement_rate", "conversion_rate", "time_on_page");

    public ExperimentDefaults {
        metrics = metrics == null ? DEFAULT_METRICS : List.copyOf(metrics);
    }

    public static ExperimentDefaults standard() {
        return new ExperimentDefaults(100, 0.95, 30, 0.8, 0.1, DEFAULT_METRICS);
    }
}
