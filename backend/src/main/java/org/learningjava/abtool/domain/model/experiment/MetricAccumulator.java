package org.learningjava.abtool.domain.model.experiment;

/** Running {total, count, average} of one named metric for one variant. */
public class MetricAccumulator {
    private double total;
    private long count;
    private double average;

    public MetricAccumulator() { }

    public void add(double value) {
        total += value;
        count++;
        average = total / count;
    }

    public double getTotal() { return total; }
    public void setTotal(double total) { this.total = total; }
    public long getCount() { return count; }
    public void setCount(long count) { this.count = count; }
    public double getAverage() { return average; }
    public void setAverage(double average) { this.average = average; }
}
