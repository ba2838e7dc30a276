package org.learningjava.abtool.application.usecase;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.abtool.application.port.ExperimentStorePort;
import org.learningjava.abtool.config.ExperimentProperties;
import org.learningjava.abtool.domain.exception.ExperimentClosedException;
import org.learningjava.abtool.domain.exception.ExperimentNotFoundException;
import org.learningjava.abtool.domain.exception.ExperimentStoreException;
import org.learningjava.abtool.domain.exception.InvalidExperimentException;
import org.learningjava.abtool.domain.exception.UnassignedParticipantException;
import org.learningjava.abtool.domain.model.experiment.Assignment;
import org.learningjava.abtool.domain.model.experiment.ClosedExperimentPolicy;
import org.learningjava.abtool.domain.model.experiment.Experiment;
import org.learningjava.abtool.domain.model.experiment.ExperimentConfig;
import org.learningjava.abtool.domain.model.experiment.ExperimentReport;
import org.learningjava.abtool.domain.model.experiment.ExperimentSnapshot;
import org.learningjava.abtool.domain.model.experiment.ExperimentStatus;
import org.learningjava.abtool.domain.model.experiment.ExperimentSummary;
import org.learningjava.abtool.domain.model.experiment.Interaction;
import org.learningjava.abtool.domain.model.experiment.ParticipantAssignment;
import org.learningjava.abtool.domain.model.experiment.StatisticalResult;
import org.learningjava.abtool.domain.model.experiment.TestExperiments;
import org.learningjava.abtool.domain.model.experiment.Variant;
import org.learningjava.abtool.domain.service.aggregation.OutcomeAggregator;
import org.learningjava.abtool.domain.service.assignment.VariantAssigner;
import org.learningjava.abtool.domain.service.lifecycle.ExperimentFactory;
import org.learningjava.abtool.domain.service.lifecycle.ExperimentValidator;
import org.learningjava.abtool.domain.service.report.ExperimentReportGenerator;
import org.learningjava.abtool.domain.service.stats.SignificanceEvaluator;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.random.RandomGenerator;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ExperimentLifecycleManagerTest {

    private static final Instant NOW = Instant.parse("2025-10-03T12:00:00Z");

    private ExperimentStorePort store;
    private ExperimentProperties props;
    private ScriptedRandom random;
    private ExperimentLifecycleManager manager;

    @BeforeEach
    void setUp() {
        store = mock(ExperimentStorePort.class);
        props = new ExperimentProperties();
        random = new ScriptedRandom();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        ExperimentValidator validator = new ExperimentValidator();
        manager = new ExperimentLifecycleManager(
                store,
                new ExperimentFactory(validator),
                validator,
                new VariantAssigner(random, clock),
                new OutcomeAggregator(),
                new SignificanceEvaluator(),
                new ExperimentReportGenerator(clock),
                props,
                clock);
    }

    @Test
    void create_persistsAndReturnsActiveSnapshot() {
        ExperimentSnapshot s = manager.create(ExperimentConfig.contentTest("Headline", "old", "new"));

        assertEquals(ExperimentStatus.ACTIVE, s.status());
        assertEquals(NOW, s.startDate());
        assertEquals(0, s.participantCount());
        assertEquals(100, s.samplesNeeded());
        verify(store).save(any(Experiment.class));
        assertEquals(1, manager.listActive().size());
    }

    @Test
    void create_invalidConfigNeverReachesTheStore() {
        ExperimentConfig single = ExperimentConfig.of("Solo",
                Map.of("control", Variant.of("control", "Control", "x")),
                Map.of("control", 100), List.of("ctr"));

        assertThrows(InvalidExperimentException.class, () -> manager.create(single));
        verifyNoInteractions(store);
        assertTrue(manager.listActive().isEmpty());
    }

    @Test
    void assign_isSticky() {
        String id = manager.create(ExperimentConfig.contentTest("Headline", "old", "new")).id();
        random.script(0.9, 0.1);

        ParticipantAssignment first = manager.assign(id, "p1");
        ParticipantAssignment again = manager.assign(id, "p1");

        assertTrue(first.newlyAssigned());
        assertFalse(again.newlyAssigned());
        assertEquals("variant", first.variantId());
        assertEquals(first.variantId(), again.variantId());
        assertEquals(first.assignedAt(), again.assignedAt());
        assertEquals("new", first.variant().content());
        assertEquals(1, manager.getResults(id).participantCount());
    }

    @Test
    void recordInteraction_requiresAssignment() {
        String id = manager.create(ExperimentConfig.contentTest("Headline", "old", "new")).id();

        UnassignedParticipantException ex = assertThrows(UnassignedParticipantException.class,
                () -> manager.recordInteraction(id, "ghost", Interaction.impression()));
        assertEquals("ghost", ex.getParticipantId());
        assertEquals(id, ex.getExperimentId());
        assertEquals(0, manager.getResults(id).results().get("control").impressions());
    }

    @Test
    void blankParticipantIsRejected() {
        String id = manager.create(ExperimentConfig.contentTest("Headline", "old", "new")).id();

        assertThrows(IllegalArgumentException.class, () -> manager.assign(id, " "));
        assertThrows(IllegalArgumentException.class, () -> manager.recordInteraction(id, null, null));
    }

    @Test
    void duplicateInteractionsAreCountedTwice() {
        String id = manager.create(ExperimentConfig.contentTest("Headline", "old", "new")).id();
        random.script(0.1);
        manager.assign(id, "p1");

        manager.recordInteraction(id, "p1", Interaction.conversion());
        ExperimentSnapshot s = manager.recordInteraction(id, "p1", Interaction.conversion());

        assertEquals(2, s.results().get("control").impressions());
        assertEquals(2, s.results().get("control").conversions());
    }

    @Test
    void workedExample_completesOnTheDecidingInteraction() {
        String id = runWorkedExample();

        ExperimentSnapshot s = manager.getResults(id);
        assertEquals(ExperimentStatus.COMPLETED, s.status());
        assertEquals(NOW, s.endDate());
        StatisticalResult r = s.statisticalSignificance();
        assertEquals("variant", r.winner());
        assertEquals(95, r.confidence());
        assertEquals(2.0, r.zScore(), 1e-9);
        assertEquals(0.2, s.results().get("control").conversionRate(), 1e-12);
        assertEquals(0.3, s.results().get("variant").conversionRate(), 1e-12);
        assertEquals(0, s.samplesNeeded());

        ArgumentCaptor<ExperimentReport> saved = ArgumentCaptor.forClass(ExperimentReport.class);
        verify(store, times(1)).saveReport(saved.capture());
        assertEquals(id, saved.getValue().experimentId());
        assertEquals(1, manager.reportHistory().size());
        assertTrue(manager.listActive().isEmpty());
    }

    @Test
    void notCompletedOneInteractionEarlier() {
        String id = manager.create(ExperimentConfig.contentTest("Headline", "old", "new")
                .withMinSampleSize(150)).id();
        random.script(0.1, 0.9);
        manager.assign(id, "pc");
        manager.assign(id, "pv");
        record(id, "pc", 150, 30);
        record(id, "pv", 149, 45);

        ExperimentSnapshot s = manager.getResults(id);
        assertEquals(ExperimentStatus.ACTIVE, s.status());
        assertNull(s.statisticalSignificance());
        assertEquals(1, s.samplesNeeded());
        verify(store, never()).saveReport(any());
    }

    @Test
    void afterCompletion_rejectPolicyThrowsAndLeavesCountsAlone() {
        String id = runWorkedExample();

        assertThrows(ExperimentClosedException.class,
                () -> manager.recordInteraction(id, "pc", Interaction.conversion()));
        assertEquals(150, manager.getResults(id).results().get("control").impressions());
    }

    @Test
    void afterCompletion_ignorePolicyIsANoOp() {
        props.setClosedPolicy(ClosedExperimentPolicy.IGNORE);
        String id = runWorkedExample();

        ExperimentSnapshot s = manager.recordInteraction(id, "pc", Interaction.conversion());

        assertEquals(150, s.results().get("control").impressions());
        assertEquals(30, s.results().get("control").conversions());
        verify(store, times(1)).saveReport(any());
    }

    @Test
    void afterCompletion_newParticipantsAreRejectedKnownOnesKeepTheirVariant() {
        String id = runWorkedExample();

        assertThrows(ExperimentClosedException.class, () -> manager.assign(id, "late"));
        ParticipantAssignment known = manager.assign(id, "pv");
        assertEquals("variant", known.variantId());
        assertFalse(known.newlyAssigned());
    }

    @Test
    void storeFailureKeepsInMemoryState() {
        String id = manager.create(ExperimentConfig.contentTest("Headline", "old", "new")).id();
        doThrow(new ExperimentStoreException("disk full", null)).when(store).save(any());
        random.script(0.1);

        manager.assign(id, "p1");
        ExperimentSnapshot s = manager.recordInteraction(id, "p1", Interaction.impression());

        assertEquals(1, s.participantCount());
        assertEquals(1, s.results().get("control").impressions());
    }

    @Test
    void snapshotIsReadOnlyAndDetached() {
        String id = manager.create(ExperimentConfig.contentTest("Headline", "old", "new")).id();
        random.script(0.1);
        manager.assign(id, "p1");
        ExperimentSnapshot before = manager.getResults(id);

        manager.recordInteraction(id, "p1", Interaction.impression());

        assertEquals(0, before.results().get("control").impressions());
        assertThrows(UnsupportedOperationException.class, () -> before.results().clear());
        assertThrows(UnsupportedOperationException.class, () -> before.trafficSplit().put("x", 1));
    }

    @Test
    void unknownExperiment_fallsBackToStoreThenFails() {
        when(store.load("exp-1")).thenReturn(Optional.of(TestExperiments.twoVariant(100)));

        assertEquals("Headline test", manager.getResults("exp-1").name());
        assertEquals("3 days", manager.getResults("exp-1").duration());
        assertThrows(ExperimentNotFoundException.class, () -> manager.getResults("nope"));
        assertThrows(ExperimentNotFoundException.class, () -> manager.assign("nope", "p1"));
    }

    @Test
    void restore_skipsInvalidDocumentsAndLoadsReports() {
        Experiment valid = TestExperiments.twoVariant(100);
        Map<String, Integer> badSplit = new LinkedHashMap<>();
        badSplit.put("control", 50);
        badSplit.put("variant", 40);
        Experiment invalid = TestExperiments.withSplit(badSplit, 100);
        invalid.setId("exp-bad");
        ExperimentReport old = new ExperimentReport("exp-old", "Old", "3 days", 3, 10,
                null, List.of(), List.of(), List.of(), NOW);
        when(store.loadAll()).thenReturn(List.of(valid, invalid));
        when(store.loadReports()).thenReturn(List.of(old));

        int restored = manager.restore();

        assertEquals(1, restored);
        assertEquals(List.of("exp-1"), manager.listActive().stream().map(ExperimentSnapshot::id).toList());
        assertEquals(1, manager.reportHistory().size());
        assertThrows(ExperimentNotFoundException.class, () -> manager.getResults("exp-bad"));
    }

    @Test
    void threeVariants_mostSignificantPairDecides() {
        Map<String, Integer> split = new LinkedHashMap<>();
        split.put("control", 34);
        split.put("a", 33);
        split.put("b", 33);
        Experiment e = TestExperiments.withSplit(split, 100);
        TestExperiments.setCounts(e, "control", 200, 40);
        TestExperiments.setCounts(e, "a", 200, 60);
        TestExperiments.setCounts(e, "b", 199, 80);
        e.getParticipants().put("pb", new Assignment("b", TestExperiments.START, "s"));
        when(store.loadAll()).thenReturn(List.of(e));
        manager.restore();

        ExperimentSnapshot s = manager.recordInteraction("exp-1", "pb", Interaction.impression());

        StatisticalResult r = s.statisticalSignificance();
        assertEquals(ExperimentStatus.COMPLETED, s.status());
        assertEquals("control", r.baseline());
        assertEquals("b", r.challenger());
        assertEquals("b", r.winner());
    }

    @Test
    void significanceLevel_isExactComplementOfThreshold() {
        assertEquals(0.05, ExperimentLifecycleManager.alphaFor(0.95));
        assertEquals(0.01, ExperimentLifecycleManager.alphaFor(0.99));
    }

    @Test
    void concurrentRecordingLosesNothing() throws Exception {
        String id = manager.create(ExperimentConfig.contentTest("Load", "old", "new")
                .withMinSampleSize(1_000_000)).id();
        int threads = 8;
        int perThread = 500;
        for (int t = 0; t < threads; t++) {
            manager.assign(id, "p" + t);
        }

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                String pid = "p" + t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        manager.recordInteraction(id, pid, i % 5 == 0 ? Interaction.conversion() : Interaction.impression());
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) f.get();
        } finally {
            pool.shutdownNow();
        }

        ExperimentSnapshot s = manager.getResults(id);
        long impressions = s.results().values().stream().mapToLong(ExperimentSnapshot.VariantResultsView::impressions).sum();
        long conversions = s.results().values().stream().mapToLong(ExperimentSnapshot.VariantResultsView::conversions).sum();
        assertEquals((long) threads * perThread, impressions);
        assertEquals((long) threads * perThread / 5, conversions);
    }

    @Test
    void summary_countsByStatus() {
        runWorkedExample();
        manager.create(ExperimentConfig.contentTest("Second", "old", "new"));

        ExperimentSummary summary = manager.summary();

        assertEquals(2, summary.totalExperiments());
        assertEquals(1, summary.activeExperiments());
        assertEquals(1, summary.completedExperiments());
        assertEquals(1, summary.reports());
    }

    // ---------- helpers ----------

    /** control 30/150 vs variant 45/150 at min sample 150; completes on the last interaction. */
    private String runWorkedExample() {
        String id = manager.create(ExperimentConfig.contentTest("Headline", "old", "new")
                .withMinSampleSize(150)).id();
        random.script(0.1, 0.9);
        assertEquals("control", manager.assign(id, "pc").variantId());
        assertEquals("variant", manager.assign(id, "pv").variantId());
        record(id, "pc", 150, 30);
        record(id, "pv", 150, 45);
        return id;
    }

    private void record(String id, String pid, int interactions, int conversions) {
        for (int i = 0; i < interactions; i++) {
            manager.recordInteraction(id, pid, i < conversions ? Interaction.conversion() : Interaction.impression());
        }
    }

    /** Returns scripted draws, then 0.1 (the first variant of a 50/50 split). */
    private static final class ScriptedRandom implements RandomGenerator {
        private final Deque<Double> draws = new ArrayDeque<>();

        void script(double... values) {
            for (double v : values) draws.add(v);
        }

        @Override
        public synchronized double nextDouble() {
            Double next = draws.poll();
            return next == null ? 0.1 : next;
        }

        @Override
        public long nextLong() {
            return 0L;
        }
    }
}
