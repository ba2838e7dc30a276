package org.learningjava.abtool.domain.model.experiment;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of a two-proportion z-test between a baseline and a challenger variant.
 * Rates are fractions in [0, 1]; {@code improvement} is the relative change of the
 * challenger over the baseline in percent and is null when the baseline rate is zero.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatisticalResult(
        String baseline,
        String challenger,
        double controlRate,
        double variantRate,
        Double improvement,
        double zScore,
        double pValue,
        String winner,
        int confidence
) {
    public static final String NO_SIGNIFICANT_DIFFERENCE = "no_significant_difference";

    @JsonIgnore
    public boolean hasWinner() {
        return winner != null && !NO_SIGNIFICANT_DIFFERENCE.equals(winner);
    }
}
