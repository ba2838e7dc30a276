package org.learningjava.abtool.domain.service.aggregation;

import org.learningjava.abtool.domain.exception.UnassignedParticipantException;
import org.learningjava.abtool.domain.model.experiment.Assignment;
import org.learningjava.abtool.domain.model.experiment.Experiment;
import org.learningjava.abtool.domain.model.experiment.Interaction;
import org.learningjava.abtool.domain.model.experiment.VariantResults;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Sole writer of {@link Experiment#getResults()}. No deduplication: recording the same
 * interaction twice counts it twice.
 */
@Component
public class OutcomeAggregator {

    public void record(Experiment experiment, String participantId, Interaction interaction) {
        Assignment assignment = experiment.getParticipants().get(participantId);
        if (assignment == null) {
            throw new UnassignedParticipantException(experiment.getId(), participantId);
        }

        VariantResults results = experiment.resultsFor(assignment.variant());
        results.recordImpression();
        if (interaction.isConversion()) {
            results.recordConversion();
        }

        // metrics the experiment does not track are ignored
        Map<String, Double> values = interaction.metrics();
        for (String metric : experiment.getMetrics()) {
            Double v = values.get(metric);
            if (v == null || !Double.isFinite(v)) continue;
            results.metric(metric).add(v);
        }
    }
}
