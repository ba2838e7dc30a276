package org.learningjava.abtool.domain.model.experiment;

public record Recommendation(
        String priority,
        String action,
        String reasoning,
        String impact
) { }
