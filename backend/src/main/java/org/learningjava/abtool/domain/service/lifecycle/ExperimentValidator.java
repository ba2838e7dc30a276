package org.learningjava.abtool.domain.service.lifecycle;

import org.learningjava.abtool.domain.exception.InvalidExperimentException;
import org.learningjava.abtool.domain.model.experiment.Experiment;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/** Structural checks of a fully resolved experiment. Nothing is coerced. */
@Component
public class ExperimentValidator {

    public void validate(Experiment e) {
        if (e.getName() == null || e.getName().isBlank()) {
            throw new InvalidExperimentException("Experiment name is required");
        }
        validateVariants(e);
        validateTrafficSplit(e);
        validateMetrics(e);

        if (e.getMinSampleSize() < 1) {
            throw new InvalidExperimentException("minSampleSize must be at least 1, got " + e.getMinSampleSize());
        }
        double threshold = e.getSignificanceThreshold();
        if (!(threshold > 0.0 && threshold < 1.0)) {
            throw new InvalidExperimentException("significanceThreshold must be in (0, 1), got " + threshold);
        }
        if (!Double.isFinite(e.getExpectedEffectSize()) || e.getExpectedEffectSize() < 0.0) {
            throw new InvalidExperimentException("expectedEffectSize must be a non-negative number");
        }
    }

    private void validateVariants(Experiment e) {
        if (e.getVariants().size() < 2) {
            throw new InvalidExperimentException("At least two variants are required, got " + e.getVariants().size());
        }
        for (String id : e.getVariants().keySet()) {
            if (id == null || id.isBlank()) {
                throw new InvalidExperimentException("Variant id must not be blank");
            }
        }
    }

    private void validateTrafficSplit(Experiment e) {
        Map<String, Integer> split = e.getTrafficSplit();
        if (split.isEmpty()) {
            throw new InvalidExperimentException("Traffic split is empty");
        }
        if (!split.keySet().equals(e.getVariants().keySet())) {
            throw new InvalidExperimentException("Traffic split " + split.keySet()
                    + " does not match variants " + e.getVariants().keySet());
        }
        int sum = 0;
        for (Map.Entry<String, Integer> entry : split.entrySet()) {
            Integer pct = entry.getValue();
            if (pct == null || pct < 0 || pct > 100) {
                throw new InvalidExperimentException("Invalid traffic percentage for " + entry.getKey() + ": " + pct);
            }
            sum += pct;
        }
        if (sum != 100) {
            throw new InvalidExperimentException("Traffic split must sum to 100, got " + sum);
        }
    }

    private void validateMetrics(Experiment e) {
        Set<String> seen = new HashSet<>();
        for (String metric : e.getMetrics()) {
            if (metric == null || metric.isBlank()) {
                throw new InvalidExperimentException("Metric names must not be blank");
            }
            if (!seen.add(metric)) {
                throw new InvalidExperimentException("Duplicate metric: " + metric);
            }
        }
    }
}
