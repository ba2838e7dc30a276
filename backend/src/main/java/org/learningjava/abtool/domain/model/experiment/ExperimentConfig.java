package org.learningjava.abtool.domain.model.experiment;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Creation request of an experiment. Either {@code variants} is given explicitly, or the
 * content fields ({@code originalContent}, {@code variantContent}, ...) are used to build
 * {@code control}, {@code variant} and {@code variant_N}. Null numeric fields fall back to
 * the configured defaults.
 */
public record ExperimentConfig(
        String name,
        String description,
        String contentType,
        Map<String, Variant> variants,
        Map<String, Integer> trafficSplit,
        List<String> metrics,
        Integer minSampleSize,
        Double significanceThreshold,
        Double expectedEffectSize,
        Instant plannedEndDate,
        String originalContent,
        String variantName,
        String variantContent,
        List<String> optimizations,
        List<Variant> additionalVariants
) {

    /** Explicit variants, default thresholds. */
    public static ExperimentConfig of(String name,
                                      Map<String, Variant> variants,
                                      Map<String, Integer> trafficSplit,
                                      List<String> metrics) {
        return new ExperimentConfig(name, null, null, variants, trafficSplit, metrics,
                null, null, null, null,
                null, null, null, null, null);
    }

    /** Control vs. one optimized variant built from raw content. */
    public static ExperimentConfig contentTest(String name, String originalContent, String variantContent) {
        return new ExperimentConfig(name, null, null, null, null, null,
                null, null, null, null,
                originalContent, null, variantContent, null, null);
    }

    public ExperimentConfig withMinSampleSize(Integer value) {
        return new ExperimentConfig(name, description, contentType, variants, trafficSplit, metrics,
                value, significanceThreshold, expectedEffectSize, plannedEndDate,
                originalContent, variantName, variantContent, optimizations, additionalVariants);
    }

    public ExperimentConfig withSignificanceThreshold(Double value) {
        return new ExperimentConfig(name, description, contentType, variants, trafficSplit, metrics,
                minSampleSize, value, expectedEffectSize, plannedEndDate,
                originalContent, variantName, variantContent, optimizations, additionalVariants);
    }

    public boolean hasExplicitVariants() {
        return variants != null && !variants.isEmpty();
    }
}
