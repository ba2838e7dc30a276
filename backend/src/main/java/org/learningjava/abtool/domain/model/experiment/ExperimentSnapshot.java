package org.learningjava.abtool.domain.model.experiment;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only projection of an experiment. Built from a copy of the aggregate, so holders
 * can never reach the mutable counters.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExperimentSnapshot(
        String id,
        String name,
        String description,
        String contentType,
        ExperimentStatus status,
        Instant startDate,
        Instant plannedEndDate,
        Instant endDate,
        String duration,
        int minSampleSize,
        double significanceThreshold,
        Map<String, Variant> variants,
        Map<String, Integer> trafficSplit,
        List<String> metrics,
        int participantCount,
        Map<String, VariantResultsView> results,
        StatisticalResult statisticalSignificance,
        long samplesNeeded
) {

    public record MetricView(double total, long count, double average) { }

    public record VariantResultsView(
            long impressions,
            long conversions,
            double conversionRate,
            Map<String, MetricView> metrics
    ) {
        static VariantResultsView of(VariantResults r) {
            Map<String, MetricView> m = new LinkedHashMap<>();
            r.getMetrics().forEach((k, v) -> m.put(k, new MetricView(v.getTotal(), v.getCount(), v.getAverage())));
            double rate = r.getImpressions() == 0 ? 0.0 : (double) r.getConversions() / r.getImpressions();
            return new VariantResultsView(r.getImpressions(), r.getConversions(), rate,
                    Collections.unmodifiableMap(m));
        }
    }

    public static ExperimentSnapshot of(Experiment e) {
        Map<String, VariantResultsView> views = new LinkedHashMap<>();
        long smallest = Long.MAX_VALUE;
        for (String variantId : e.getVariants().keySet()) {
            VariantResults r = e.getResults().getOrDefault(variantId, new VariantResults());
            views.put(variantId, VariantResultsView.of(r));
            smallest = Math.min(smallest, r.getImpressions());
        }
        long needed = smallest == Long.MAX_VALUE ? e.getMinSampleSize() : Math.max(0, e.getMinSampleSize() - smallest);

        return new ExperimentSnapshot(
                e.getId(),
                e.getName(),
                e.getDescription(),
                e.getContentType(),
                e.getStatus(),
                e.getStartDate(),
                e.getPlannedEndDate(),
                e.getEndDate(),
                null,
                e.getMinSampleSize(),
                e.getSignificanceThreshold(),
                Collections.unmodifiableMap(new LinkedHashMap<>(e.getVariants())),
                Collections.unmodifiableMap(new LinkedHashMap<>(e.getTrafficSplit())),
                List.copyOf(e.getMetrics()),
                e.getParticipants().size(),
                Collections.unmodifiableMap(views),
                e.getStatisticalResult(),
                needed
        );
    }

    public ExperimentSnapshot withDuration(String newDuration) {
        return new ExperimentSnapshot(id, name, description, contentType, status, startDate, plannedEndDate,
                endDate, newDuration, minSampleSize, significanceThreshold, variants, trafficSplit, metrics,
                participantCount, results, statisticalSignificance, samplesNeeded);
    }

    @JsonIgnore
    public boolean isCompleted() {
        return status == ExperimentStatus.COMPLETED;
    }
}
