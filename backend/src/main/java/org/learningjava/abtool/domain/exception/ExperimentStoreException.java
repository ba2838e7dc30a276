package org.learningjava.abtool.domain.exception;

/** Failure of the durable store. The in-memory state stays authoritative. */
public class ExperimentStoreException extends ExperimentException {
    public ExperimentStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
