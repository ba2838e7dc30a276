package org.learningjava.abtool.infrastructure.adapter.out.fs;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.learningjava.abtool.application.port.ExperimentStorePort;
import org.learningjava.abtool.domain.exception.ExperimentStoreException;
import org.learningjava.abtool.domain.model.experiment.Experiment;
import org.learningjava.abtool.domain.model.experiment.ExperimentReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/** Retries store failures with exponential backoff; the last failure is rethrown. */
public class RetryingExperimentStore implements ExperimentStorePort {

    private static final Logger log = LoggerFactory.getLogger(RetryingExperimentStore.class);

    private final ExperimentStorePort delegate;
    private final Retry retry;

    public RetryingExperimentStore(ExperimentStorePort delegate,
                                   int maxAttempts,
                                   Duration initialBackoff,
                                   double multiplier) {
        this.delegate = delegate;
        this.retry = Retry.of("experiment-store", RetryConfig.custom()
                .maxAttempts(Math.max(1, maxAttempts))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoff, multiplier))
                .retryExceptions(ExperimentStoreException.class)
                .build());
        this.retry.getEventPublisher().onRetry(ev ->
                log.warn("Store call failed (attempt {}), retrying in {} ms: {}",
                        ev.getNumberOfRetryAttempts(), ev.getWaitInterval().toMillis(),
                        ev.getLastThrowable() == null ? "?" : ev.getLastThrowable().getMessage()));
    }

    @Override
    public void ensureStorage() {
        retry.executeRunnable(delegate::ensureStorage);
    }

    @Override
    public Optional<Experiment> load(String id) {
        return retry.executeSupplier(() -> delegate.load(id));
    }

    @Override
    public void save(Experiment experiment) {
        retry.executeRunnable(() -> delegate.save(experiment));
    }

    @Override
    public List<Experiment> loadAll() {
        return retry.executeSupplier(delegate::loadAll);
    }

    @Override
    public void saveReport(ExperimentReport report) {
        retry.executeRunnable(() -> delegate.saveReport(report));
    }

    @Override
    public List<ExperimentReport> loadReports() {
        return retry.executeSupplier(delegate::loadReports);
    }
}
