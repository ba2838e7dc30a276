package org.learningjava.abtool.domain.model.experiment;

import java.time.Instant;
import java.util.List;

/** Advisory report written once when an experiment completes. */
public record ExperimentReport(
        String experimentId,
        String experimentName,
        String duration,
        long durationDays,
        int totalParticipants,
        StatisticalResult results,
        List<Recommendation> recommendations,
        List<String> insights,
        List<String> nextSteps,
        Instant generatedAt
) {
    public ExperimentReport {
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        insights = insights == null ? List.of() : List.copyOf(insights);
        nextSteps = nextSteps == null ? List.of() : List.copyOf(nextSteps);
    }
}
