package org.learningjava.abtool.domain.model.experiment;

/** What happens to an interaction recorded against a completed experiment. */
public enum ClosedExperimentPolicy {
    /** Throw {@code ExperimentClosedException}. */
    REJECT,
    /** Drop the interaction and return the frozen results. */
    IGNORE
}
