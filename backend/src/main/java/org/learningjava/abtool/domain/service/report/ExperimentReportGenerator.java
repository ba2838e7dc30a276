package org.learningjava.abtool.domain.service.report;

import org.learningjava.abtool.domain.model.experiment.Experiment;
import org.learningjava.abtool.domain.model.experiment.ExperimentReport;
import org.learningjava.abtool.domain.model.experiment.Recommendation;
import org.learningjava.abtool.domain.model.experiment.StatisticalResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the advisory report of a completed experiment. The text is threshold based and
 * carries no statistical meaning beyond the attached {@link StatisticalResult}.
 */
@Component
public class ExperimentReportGenerator {

    static final int DEPLOY_CONFIDENCE = 95;
    static final double NOTABLE_IMPROVEMENT_PCT = 10.0;
    static final long LARGE_SAMPLE_IMPRESSIONS = 1000;
    static final String PROFESSIONAL_SUMMARY = "professional_summary";

    private static final long MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private final Clock clock;

    public ExperimentReportGenerator(Clock clock) {
        this.clock = clock;
    }

    public ExperimentReport generate(Experiment e) {
        StatisticalResult stats = e.getStatisticalResult();
        if (stats == null) {
            throw new IllegalStateException("Experiment " + e.getId() + " has no statistical result");
        }
        Instant end = e.getEndDate() != null ? e.getEndDate() : clock.instant();
        long days = durationDays(e.getStartDate(), end);

        return new ExperimentReport(
                e.getId(),
                e.getName(),
                formatDays(days),
                days,
                e.getParticipants().size(),
                stats,
                recommendations(e, stats),
                insights(e, stats),
                nextSteps(e, stats),
                clock.instant()
        );
    }

    /** Whole days between the two instants, rounded up. */
    public static long durationDays(Instant start, Instant end) {
        if (start == null || end == null || !end.isAfter(start)) return 0;
        long ms = Duration.between(start, end).toMillis();
        return (ms + MILLIS_PER_DAY - 1) / MILLIS_PER_DAY;
    }

    public static String formatDays(long days) {
        return days + " days";
    }

    List<Recommendation> recommendations(Experiment e, StatisticalResult s) {
        List<Recommendation> out = new ArrayList<>();
        String baseline = e.baselineVariantId();

        if (!s.hasWinner()) {
            out.add(new Recommendation("low", "Run additional test",
                    "No statistically significant difference detected", "low"));
        } else if (s.winner().equals(baseline)) {
            out.add(new Recommendation("medium", "Continue with current version",
                    "Control version performs better or equivalent to " + s.challenger(), "medium"));
        } else if (s.confidence() > DEPLOY_CONFIDENCE) {
            out.add(new Recommendation("high", "Implement winning variant",
                    String.format(Locale.ROOT, "Variant %s shows %s improvement with %d%% confidence",
                            s.winner(), improvementText(s), s.confidence()),
                    "high"));
        } else {
            out.add(new Recommendation("medium", "Confirm winning variant with a follow-up test",
                    String.format(Locale.ROOT, "Variant %s leads with %d%% confidence, at or below the %d%% deploy bar",
                            s.winner(), s.confidence(), DEPLOY_CONFIDENCE),
                    "medium"));
        }
        return out;
    }

    List<String> insights(Experiment e, StatisticalResult s) {
        List<String> out = new ArrayList<>();

        Double improvement = s.improvement();
        if (improvement != null && Math.abs(improvement) > NOTABLE_IMPROVEMENT_PCT) {
            out.add(String.format(Locale.ROOT, "Significant %s of %.2f%% detected",
                    improvement > 0 ? "improvement" : "decline", Math.abs(improvement)));
        }

        if (e.totalImpressions() > LARGE_SAMPLE_IMPRESSIONS) {
            out.add("Large sample size provides high confidence in results");
        }

        if (PROFESSIONAL_SUMMARY.equals(e.getContentType())) {
            out.add("Professional summary optimization directly impacts first impressions");
        }
        return out;
    }

    List<String> nextSteps(Experiment e, StatisticalResult s) {
        if (s.hasWinner() && !s.winner().equals(e.baselineVariantId())) {
            return List.of(
                    "Deploy winning variant to production",
                    "Monitor performance post-implementation",
                    "Plan follow-up optimization tests");
        }
        return List.of(
                "Analyze why variant did not perform better",
                "Design improved test variants",
                "Consider testing different content elements");
    }

    private static String improvementText(StatisticalResult s) {
        return s.improvement() == null ? "an" : String.format(Locale.ROOT, "%.2f%%", s.improvement());
    }
}
