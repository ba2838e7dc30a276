package org.learningjava.abtool.domain.exception;

/** Malformed experiment configuration, rejected at creation time. */
public class InvalidExperimentException extends ExperimentException {
    public InvalidExperimentException(String message) {
        super(message);
    }
}
