package org.learningjava.abtool.domain.model.experiment;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable experiment aggregate. It is also the persisted JSON document, one per experiment.
 * Only {@code ExperimentLifecycleManager} mutates instances that are registered with it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Experiment {

    public static final String CONTROL = "control";

    private String id;
    private String name;
    private String description;
    private String contentType;
    private Map<String, Variant> variants = new LinkedHashMap<>();
    private Map<String, Integer> trafficSplit = new LinkedHashMap<>();
    private List<String> metrics = new ArrayList<>();
    private int minSampleSize;
    private double significanceThreshold;
    private double statisticalPower;
    private double expectedEffectSize;
    private ExperimentStatus status;
    private Instant startDate;
    private Instant plannedEndDate;
    private Instant endDate;
    private Map<String, Assignment> participants = new LinkedHashMap<>();
    private Map<String, VariantResults> results = new LinkedHashMap<>();
    private StatisticalResult statisticalResult;

    public Experiment() { }

    /** The variant every other variant is compared against: {@code control} when present, else the first one. */
    @JsonIgnore
    public String baselineVariantId() {
        if (variants.containsKey(CONTROL)) return CONTROL;
        return variants.keySet().stream().findFirst().orElse(null);
    }

    @JsonIgnore
    public boolean isCompleted() {
        return status == ExperimentStatus.COMPLETED;
    }

    public VariantResults resultsFor(String variantId) {
        return results.computeIfAbsent(variantId, k -> new VariantResults());
    }

    @JsonIgnore
    public long totalImpressions() {
        return results.values().stream().mapToLong(VariantResults::getImpressions).sum();
    }

    public void complete(StatisticalResult result, Instant at) {
        this.statisticalResult = result;
        this.endDate = at;
        this.status = ExperimentStatus.COMPLETED;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public String getContentType() { return contentType; }
    public void setContentType(String contentType) { this.contentType = contentType; }

    public Map<String, Variant> getVariants() { return variants; }
    public void setVariants(Map<String, Variant> variants) {
        this.variants = variants == null ? new LinkedHashMap<>() : new LinkedHashMap<>(variants);
    }

    public Map<String, Integer> getTrafficSplit() { return trafficSplit; }
    public void setTrafficSplit(Map<String, Integer> trafficSplit) {
        this.trafficSplit = trafficSplit == null ? new LinkedHashMap<>() : new LinkedHashMap<>(trafficSplit);
    }

    public List<String> getMetrics() { return metrics; }
    public void setMetrics(List<String> metrics) {
        this.metrics = metrics == null ? new ArrayList<>() : new ArrayList<>(metrics);
    }

    public int getMinSampleSize() { return minSampleSize; }
    public void setMinSampleSize(int minSampleSize) { this.minSampleSize = minSampleSize; }
    public double getSignificanceThreshold() { return significanceThreshold; }
    public void setSignificanceThreshold(double significanceThreshold) { this.significanceThreshold = significanceThreshold; }
    public double getStatisticalPower() { return statisticalPower; }
    public void setStatisticalPower(double statisticalPower) { this.statisticalPower = statisticalPower; }
    public double getExpectedEffectSize() { return expectedEffectSize; }
    public void setExpectedEffectSize(double expectedEffectSize) { this.expectedEffectSize = expectedEffectSize; }
    public ExperimentStatus getStatus() { return status; }
    public void setStatus(ExperimentStatus status) { this.status = status; }
    public Instant getStartDate() { return startDate; }
    public void setStartDate(Instant startDate) { this.startDate = startDate; }
    public Instant getPlannedEndDate() { return plannedEndDate; }
    public void setPlannedEndDate(Instant plannedEndDate) { this.plannedEndDate = plannedEndDate; }
    public Instant getEndDate() { return endDate; }
    public void setEndDate(Instant endDate) { this.endDate = endDate; }

    public Map<String, Assignment> getParticipants() { return participants; }
    public void setParticipants(Map<String, Assignment> participants) {
        this.participants = participants == null ? new LinkedHashMap<>() : new LinkedHashMap<>(participants);
    }

    public Map<String, VariantResults> getResults() { return results; }
    public void setResults(Map<String, VariantResults> results) {
        this.results = results == null ? new LinkedHashMap<>() : new LinkedHashMap<>(results);
    }

    @JsonProperty("statisticalSignificance")
    public StatisticalResult getStatisticalResult() { return statisticalResult; }

    @JsonProperty("statisticalSignificance")
    public void setStatisticalResult(StatisticalResult statisticalResult) { this.statisticalResult = statisticalResult; }
}
