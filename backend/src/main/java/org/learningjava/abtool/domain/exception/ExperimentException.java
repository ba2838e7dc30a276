package org.learningjava.abtool.domain.exception;

/** Root of the experiment engine errors. */
public class ExperimentException extends RuntimeException {
    public ExperimentException(String message) {
        super(message);
    }

    public ExperimentException(String message, Throwable cause) {
        super(message, cause);
    }
}
