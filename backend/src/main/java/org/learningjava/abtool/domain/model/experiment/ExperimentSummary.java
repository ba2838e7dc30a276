package org.learningjava.abtool.domain.model.experiment;

public record ExperimentSummary(
        int totalExperiments,
        int activeExperiments,
        int completedExperiments,
        int reports
) { }
