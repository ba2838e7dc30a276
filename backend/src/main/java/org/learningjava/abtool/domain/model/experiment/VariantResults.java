package org.learningjava.abtool.domain.model.experiment;

import java.util.LinkedHashMap;
import java.util.Map;

/** Outcome counters of one variant. Counters only ever grow. */
public class VariantResults {
    private long impressions;
    private long conversions;
    private Map<String, MetricAccumulator> metrics = new LinkedHashMap<>();

    public VariantResults() { }

    public void recordImpression() {
        impressions++;
    }

    public void recordConversion() {
        conversions++;
    }

    public MetricAccumulator metric(String name) {
        return metrics.computeIfAbsent(name, k -> new MetricAccumulator());
    }

    public long getImpressions() { return impressions; }
    public void setImpressions(long impressions) { this.impressions = impressions; }
    public long getConversions() { return conversions; }
    public void setConversions(long conversions) { this.conversions = conversions; }
    public Map<String, MetricAccumulator> getMetrics() { return metrics; }

    public void setMetrics(Map<String, MetricAccumulator> metrics) {
        this.metrics = metrics == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metrics);
    }
}
