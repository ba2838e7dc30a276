package org.learningjava.abtool.domain.exception;

public class ExperimentNotFoundException extends ExperimentException {
    public ExperimentNotFoundException(String experimentId) {
        super("Experiment not found: " + experimentId);
    }
}
