package org.learningjava.abtool.application.port;

import org.learningjava.abtool.domain.model.experiment.Experiment;
import org.learningjava.abtool.domain.model.experiment.ExperimentReport;

import java.util.List;
import java.util.Optional;

/**
 * Durable home of experiment documents and completion reports.
 * Implementations signal I/O failures with {@code ExperimentStoreException}.
 */
public interface ExperimentStorePort {
    void ensureStorage();

    // Experiments
    Optional<Experiment> load(String id);

    void save(Experiment experiment);

    /** Every readable experiment document; unreadable ones are skipped. */
    List<Experiment> loadAll();

    // Reports
    void saveReport(ExperimentReport report);

    List<ExperimentReport> loadReports();
}
