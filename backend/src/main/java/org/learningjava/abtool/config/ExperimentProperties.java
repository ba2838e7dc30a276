package org.learningjava.abtool.config;

import org.learningjava.abtool.domain.model.experiment.ClosedExperimentPolicy;
import org.learningjava.abtool.domain.model.experiment.ExperimentDefaults;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "abtool.experiments")
public class ExperimentProperties {
    private String dataDir = "data/ab-tests";
    private boolean restoreOnStartup = true;
    private int minSampleSize = 100;
    private double significanceThreshold = 0.95;
    private int defaultDurationDays = 30;
    private double statisticalPower = 0.8;
    private double expectedEffectSize = 0.1;
    private List<String> defaultMetrics = new ArrayList<>(ExperimentDefaults.DEFAULT_METRICS);
    private ClosedExperimentPolicy closedPolicy = ClosedExperimentPolicy.REJECT;
    private Persistence persistence = new Persistence();

    public static class Persistence {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(200);
        private double backoffMultiplier = 2.0;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int v) { this.maxAttempts = v; }
        public Duration getInitialBackoff() { return initialBackoff; }
        public void setInitialBackoff(Duration v) { this.initialBackoff = v; }
        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double v) { this.backoffMultiplier = v; }
    }

    public ExperimentDefaults toDefaults() {
        return new ExperimentDefaults(minSampleSize, significanceThreshold, defaultDurationDays,
                statisticalPower, expectedEffectSize, defaultMetrics);
    }

    public String getDataDir() { return dataDir; }
    public void setDataDir(String v) { this.dataDir = v; }
    public boolean isRestoreOnStartup() { return restoreOnStartup; }
    public void setRestoreOnStartup(boolean v) { this.restoreOnStartup = v; }
    public int getMinSampleSize() { return minSampleSize; }
    public void setMinSampleSize(int v) { this.minSampleSize = v; }
    public double getSignificanceThreshold() { return significanceThreshold; }
    public void setSignificanceThreshold(double v) { this.significanceThreshold = v; }
    public int getDefaultDurationDays() { return defaultDurationDays; }
    public void setDefaultDurationDays(int v) { this.defaultDurationDays = v; }
    public double getStatisticalPower() { return statisticalPower; }
    public void setStatisticalPower(double v) { this.statisticalPower = v; }
    public double getExpectedEffectSize() { return expectedEffectSize; }
    public void setExpectedEffectSize(double v) { this.expectedEffectSize = v; }
    public List<String> getDefaultMetrics() { return defaultMetrics; }
    public void setDefaultMetrics(List<String> v) { this.defaultMetrics = v; }
    public ClosedExperimentPolicy getClosedPolicy() { return closedPolicy; }
    public void setClosedPolicy(ClosedExperimentPolicy v) { this.closedPolicy = v; }
    public Persistence getPersistence() { return persistence; }
    public void setPersistence(Persistence v) { this.persistence = v; }
}
