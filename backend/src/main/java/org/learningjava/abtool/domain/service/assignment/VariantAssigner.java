package org.learningjava.abtool.domain.service.assignment;

import org.learningjava.abtool.domain.exception.InvalidExperimentException;
import org.learningjava.abtool.domain.model.experiment.Assignment;
import org.learningjava.abtool.domain.model.experiment.Experiment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;
import java.util.random.RandomGenerator;

/**
 * Sticky, weighted assignment of participants to variants.
 * <p>
 * A new participant gets a uniform draw in [0, 100); the traffic split is walked in its
 * insertion order with a running total and the first variant whose cumulative boundary
 * exceeds the draw wins. The assignment is written into the experiment before returning.
 */
@Component
public class VariantAssigner {

    private static final Logger log = LoggerFactory.getLogger(VariantAssigner.class);

    private final RandomGenerator random;
    private final Clock clock;

    public VariantAssigner(RandomGenerator random, Clock clock) {
        this.random = random;
        this.clock = clock;
    }

    public String assign(Experiment experiment, String participantId) {
        Assignment existing = experiment.getParticipants().get(participantId);
        if (existing != null) {
            return existing.variant();
        }

        double draw = random.nextDouble() * 100.0;
        String variantId = pick(experiment.getTrafficSplit(), draw);

        experiment.getParticipants().put(participantId,
                new Assignment(variantId, clock.instant(), newSessionId()));

        log.debug("[{}] participant {} -> {} (draw={})", experiment.getId(), participantId, variantId, draw);
        return variantId;
    }

    /**
     * @param draw value in [0, 100)
     */
    static String pick(Map<String, Integer> trafficSplit, double draw) {
        if (trafficSplit == null || trafficSplit.isEmpty()) {
            throw new InvalidExperimentException("Traffic split is empty");
        }
        int cumulative = 0;
        String lastWithTraffic = null;
        for (Map.Entry<String, Integer> e : trafficSplit.entrySet()) {
            int share = e.getValue() == null ? 0 : e.getValue();
            if (share <= 0) continue;
            cumulative += share;
            lastWithTraffic = e.getKey();
            if (draw < cumulative) {
                return e.getKey();
            }
        }
        if (lastWithTraffic == null) {
            throw new InvalidExperimentException("Traffic split has no variant with traffic");
        }
        return lastWithTraffic;
    }

    private static String newSessionId() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
