package org.learningjava.abtool.domain.exception;

public class ExperimentClosedException extends ExperimentException {
    public ExperimentClosedException(String experimentId) {
        super("Experiment " + experimentId + " is completed");
    }
}
