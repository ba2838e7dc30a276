package org.learningjava.abtool.infrastructure.adapter.in.web.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.learningjava.abtool.domain.model.experiment.ExperimentConfig;
import org.learningjava.abtool.domain.model.experiment.Variant;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record CreateExperimentRequest(
        @NotBlank String name,
        String description,
        String contentType,
        Map<String, Variant> variants,
        Map<String, Integer> trafficSplit,
        List<String> metrics,
        @Min(1) Integer minSampleSize,
        @DecimalMin(value = "0.0", inclusive = false) @DecimalMax(value = "1.0", inclusive = false)
        Double significanceThreshold,
        @DecimalMin("0.0") Double expectedEffectSize,
        Instant endDate,
        String originalContent,
        String variantName,
        String variantContent,
        List<String> optimizations,
        List<Variant> additionalVariants
) {
    public ExperimentConfig toConfig() {
        return new ExperimentConfig(
                name,
                description,
                contentType,
                variants,
                trafficSplit,
                metrics,
                minSampleSize,
                significanceThreshold,
                expectedEffectSize,
                endDate,
                originalContent,
                variantName,
                variantContent,
                optimizations,
                additionalVariants
        );
    }
}
