package org.learningjava.abtool.domain.model.experiment;

/** Immutable impressions/conversions pair of one variant, the input of significance testing. */
public record VariantOutcome(String variantId, long impressions, long conversions) {

    public static VariantOutcome of(String variantId, VariantResults results) {
        return new VariantOutcome(variantId, results.getImpressions(), results.getConversions());
    }

    public double conversionRate() {
        return impressions == 0 ? 0.0 : (double) conversions / impressions;
    }
}
