package org.learningjava.abtool.application.usecase;

import org.learningjava.abtool.application.port.ExperimentStorePort;
import org.learningjava.abtool.config.ExperimentProperties;
import org.learningjava.abtool.domain.exception.ExperimentClosedException;
import org.learningjava.abtool.domain.exception.ExperimentNotFoundException;
import org.learningjava.abtool.domain.exception.ExperimentStoreException;
import org.learningjava.abtool.domain.exception.InvalidExperimentException;
import org.learningjava.abtool.domain.model.experiment.Assignment;
import org.learningjava.abtool.domain.model.experiment.ClosedExperimentPolicy;
import org.learningjava.abtool.domain.model.experiment.Experiment;
import org.learningjava.abtool.domain.model.experiment.ExperimentConfig;
import org.learningjava.abtool.domain.model.experiment.ExperimentReport;
import org.learningjava.abtool.domain.model.experiment.ExperimentSnapshot;
import org.learningjava.abtool.domain.model.experiment.ExperimentSummary;
import org.learningjava.abtool.domain.model.experiment.Interaction;
import org.learningjava.abtool.domain.model.experiment.ParticipantAssignment;
import org.learningjava.abtool.domain.model.experiment.StatisticalResult;
import org.learningjava.abtool.domain.model.experiment.VariantOutcome;
import org.learningjava.abtool.domain.service.aggregation.OutcomeAggregator;
import org.learningjava.abtool.domain.service.assignment.VariantAssigner;
import org.learningjava.abtool.domain.service.lifecycle.ExperimentFactory;
import org.learningjava.abtool.domain.service.lifecycle.ExperimentValidator;
import org.learningjava.abtool.domain.service.report.ExperimentReportGenerator;
import org.learningjava.abtool.domain.service.stats.SignificanceEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owner of all experiment state.
 * <p>
 * Every write to one experiment (assignment, recording, evaluation, completion) runs under
 * that experiment's lock, so "read aggregate, decide, complete" is atomic. Experiments do not
 * share locks. Readers get the last published {@link ExperimentSnapshot} without locking.
 * Persistence happens after the in-memory update; a store failure is logged and never
 * undoes the in-memory state.
 */
@Service
public class ExperimentLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(ExperimentLifecycleManager.class);

    private final ExperimentStorePort store;
    private final ExperimentFactory factory;
    private final ExperimentValidator validator;
    private final VariantAssigner assigner;
    private final OutcomeAggregator aggregator;
    private final SignificanceEvaluator evaluator;
    private final ExperimentReportGenerator reportGenerator;
    private final ExperimentProperties props;
    private final Clock clock;

    private final Map<String, Slot> experiments = new ConcurrentHashMap<>();
    private final List<ExperimentReport> reports = new CopyOnWriteArrayList<>();

    private static final class Slot {
        final ReentrantLock lock = new ReentrantLock();
        final Experiment experiment;
        volatile ExperimentSnapshot snapshot;

        Slot(Experiment experiment) {
            this.experiment = experiment;
            this.snapshot = ExperimentSnapshot.of(experiment);
        }

        void publish() {
            snapshot = ExperimentSnapshot.of(experiment);
        }
    }

    public ExperimentLifecycleManager(ExperimentStorePort store,
                                      ExperimentFactory factory,
                                      ExperimentValidator validator,
                                      VariantAssigner assigner,
                                      OutcomeAggregator aggregator,
                                      SignificanceEvaluator evaluator,
                                      ExperimentReportGenerator reportGenerator,
                                      ExperimentProperties props,
                                      Clock clock) {
        this.store = store;
        this.factory = factory;
        this.validator = validator;
        this.assigner = assigner;
        this.aggregator = aggregator;
        this.evaluator = evaluator;
        this.reportGenerator = reportGenerator;
        this.props = props;
        this.clock = clock;
    }

    // ---------- commands ----------

    public ExperimentSnapshot create(ExperimentConfig config) {
        Experiment e = factory.create(config, props.toDefaults(), clock.instant());
        Slot slot = new Slot(e);
        if (experiments.putIfAbsent(e.getId(), slot) != null) {
            throw new IllegalStateException("Experiment id collision: " + e.getId());
        }

        slot.lock.lock();
        try {
            persist(e);
        } finally {
            slot.lock.unlock();
        }

        log.info("[{}] Experiment created: name='{}', variants={}, split={}",
                e.getId(), e.getName(), e.getVariants().keySet(), e.getTrafficSplit());
        return slot.snapshot;
    }

    public ParticipantAssignment assign(String experimentId, String participantId) {
        requireParticipant(participantId);
        Slot slot = slot(experimentId);

        slot.lock.lock();
        try {
            Experiment e = slot.experiment;
            Assignment existing = e.getParticipants().get(participantId);
            if (existing != null) {
                return toAssignment(e, participantId, existing, false);
            }
            if (e.isCompleted()) {
                throw new ExperimentClosedException(experimentId);
            }

            assigner.assign(e, participantId);
            slot.publish();
            persist(e);
            return toAssignment(e, participantId, e.getParticipants().get(participantId), true);
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Records one interaction, then runs the stopping rule.
     *
     * @return results after the interaction (and after completion, when it fired)
     */
    public ExperimentSnapshot recordInteraction(String experimentId, String participantId, Interaction interaction) {
        requireParticipant(participantId);
        Interaction in = interaction == null ? Interaction.impression() : interaction;
        Slot slot = slot(experimentId);

        slot.lock.lock();
        try {
            Experiment e = slot.experiment;
            if (e.isCompleted()) {
                if (props.getClosedPolicy() == ClosedExperimentPolicy.IGNORE) {
                    log.debug("[{}] Ignoring interaction of {} on completed experiment", experimentId, participantId);
                    return slot.snapshot;
                }
                throw new ExperimentClosedException(experimentId);
            }

            aggregator.record(e, participantId, in);
            log.debug("[{}] Recorded {} for {}", experimentId, in.type(), participantId);

            ExperimentReport report = null;
            Optional<StatisticalResult> decision = evaluate(e);
            if (decision.isPresent()) {
                StatisticalResult r = decision.get();
                e.complete(r, clock.instant());
                report = reportGenerator.generate(e);
                reports.add(report);
                log.info("[{}] Experiment completed: winner={}, p={}, z={}, confidence={}%",
                        experimentId, r.winner(), r.pValue(), r.zScore(), r.confidence());
            }

            slot.publish();
            persist(e);
            if (report != null) {
                persistReport(report);
            }
            return slot.snapshot;
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Reloads experiments and reports from the store. Documents that fail validation are
     * skipped; experiments already in memory are kept.
     */
    public int restore() {
        List<Experiment> loaded;
        try {
            loaded = store.loadAll();
        } catch (ExperimentStoreException ex) {
            log.error("Cannot scan experiment store: {}", ex.getMessage(), ex);
            return 0;
        }

        int restored = 0;
        for (Experiment e : loaded) {
            if (register(e).isPresent()) restored++;
        }

        try {
            List<ExperimentReport> history = store.loadReports();
            for (ExperimentReport r : history) {
                boolean known = reports.stream().anyMatch(x -> x.experimentId().equals(r.experimentId()));
                if (!known) reports.add(r);
            }
        } catch (ExperimentStoreException ex) {
            log.error("Cannot load report history: {}", ex.getMessage(), ex);
        }

        log.info("Restored {} experiments ({} active), {} reports",
                restored, listActive().size(), reports.size());
        return restored;
    }

    // ---------- queries ----------

    /** Read-only projection; never the live aggregate. */
    public ExperimentSnapshot getResults(String experimentId) {
        ExperimentSnapshot s = slot(experimentId).snapshot;
        Instant end = s.endDate() != null ? s.endDate() : clock.instant();
        return s.withDuration(ExperimentReportGenerator.formatDays(
                ExperimentReportGenerator.durationDays(s.startDate(), end)));
    }

    public List<ExperimentSnapshot> listActive() {
        return experiments.values().stream()
                .map(slot -> slot.snapshot)
                .filter(s -> !s.isCompleted())
                .sorted(Comparator.comparing(ExperimentSnapshot::startDate,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    public List<ExperimentReport> reportHistory() {
        return List.copyOf(reports);
    }

    public ExperimentSummary summary() {
        int total = experiments.size();
        int completed = (int) experiments.values().stream().filter(s -> s.snapshot.isCompleted()).count();
        return new ExperimentSummary(total, total - completed, completed, reports.size());
    }

    // ---------- helpers ----------

    /**
     * Stopping rule: every unordered pair of variants that passed the sample-size gate is tested;
     * the most significant pair below {@code 1 - significanceThreshold} decides.
     */
    private Optional<StatisticalResult> evaluate(Experiment e) {
        int min = e.getMinSampleSize();
        double alpha = alphaFor(e.getSignificanceThreshold());

        List<String> ids = new ArrayList<>(e.getVariants().keySet());
        String baseline = e.baselineVariantId();
        ids.remove(baseline);
        ids.add(0, baseline);

        StatisticalResult best = null;
        for (int i = 0; i < ids.size(); i++) {
            VariantOutcome a = VariantOutcome.of(ids.get(i), e.resultsFor(ids.get(i)));
            if (a.impressions() < min) continue;
            for (int j = i + 1; j < ids.size(); j++) {
                VariantOutcome b = VariantOutcome.of(ids.get(j), e.resultsFor(ids.get(j)));
                StatisticalResult r = evaluator.evaluate(a, b, min, alpha);
                if (r == null || r.pValue() >= alpha) continue;
                if (best == null || r.pValue() < best.pValue()) {
                    best = r;
                }
            }
        }
        return Optional.ofNullable(best);
    }

    /** {@code 1 - threshold} without binary rounding noise, so 0.95 gives exactly 0.05. */
    static double alphaFor(double significanceThreshold) {
        return BigDecimal.ONE.subtract(BigDecimal.valueOf(significanceThreshold)).doubleValue();
    }

    private Slot slot(String experimentId) {
        if (experimentId == null || experimentId.isBlank()) {
            throw new ExperimentNotFoundException(String.valueOf(experimentId));
        }
        Slot slot = experiments.get(experimentId);
        if (slot != null) return slot;

        // written by another process after startup
        Optional<Experiment> stored;
        try {
            stored = store.load(experimentId);
        } catch (ExperimentStoreException ex) {
            log.error("[{}] Cannot load experiment: {}", experimentId, ex.getMessage(), ex);
            stored = Optional.empty();
        }
        return stored.flatMap(this::register)
                .or(() -> Optional.ofNullable(experiments.get(experimentId)))
                .orElseThrow(() -> new ExperimentNotFoundException(experimentId));
    }

    private Optional<Slot> register(Experiment e) {
        if (e.getId() == null || e.getStatus() == null) {
            log.warn("Skipping stored experiment without id or status: {}", e.getId());
            return Optional.empty();
        }
        try {
            validator.validate(e);
        } catch (InvalidExperimentException ex) {
            log.warn("[{}] Skipping invalid stored experiment: {}", e.getId(), ex.getMessage());
            return Optional.empty();
        }
        e.getVariants().keySet().forEach(e::resultsFor);

        Slot fresh = new Slot(e);
        Slot prev = experiments.putIfAbsent(e.getId(), fresh);
        return prev == null ? Optional.of(fresh) : Optional.empty();
    }

    private void persist(Experiment e) {
        try {
            store.save(e);
        } catch (ExperimentStoreException ex) {
            log.error("[{}] Persisting experiment failed, keeping in-memory state: {}",
                    e.getId(), ex.getMessage(), ex);
        }
    }

    private void persistReport(ExperimentReport report) {
        try {
            store.saveReport(report);
            log.info("[{}] Report saved", report.experimentId());
        } catch (ExperimentStoreException ex) {
            log.error("[{}] Persisting report failed: {}", report.experimentId(), ex.getMessage(), ex);
        }
    }

    private static ParticipantAssignment toAssignment(Experiment e, String participantId,
                                                      Assignment a, boolean fresh) {
        return new ParticipantAssignment(e.getId(), participantId, a.variant(),
                e.getVariants().get(a.variant()), a.assignedAt(), fresh);
    }

    private static void requireParticipant(String participantId) {
        if (participantId == null || participantId.isBlank()) {
            throw new IllegalArgumentException("participantId is required");
        }
    }
}
