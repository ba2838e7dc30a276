package org.learningjava.abtool.config;

import org.learningjava.abtool.application.port.ExperimentStorePort;
import org.learningjava.abtool.application.usecase.ExperimentLifecycleManager;
import org.learningjava.abtool.domain.exception.ExperimentStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/** Prepares the store directory and reloads experiments and reports written by earlier runs. */
@Component
public class StartupTasks implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(StartupTasks.class);

    private final ExperimentStorePort store;
    private final ExperimentLifecycleManager experiments;
    private final ExperimentProperties props;

    public StartupTasks(ExperimentStorePort store,
                        ExperimentLifecycleManager experiments,
                        ExperimentProperties props) {
        this.store = store;
        this.experiments = experiments;
        this.props = props;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!props.isRestoreOnStartup()) {
            log.info("Experiment restore disabled (abtool.experiments.restore-on-startup=false)");
            return;
        }

        log.info("=== StartupTasks BEGIN ===");
        try {
            store.ensureStorage();
        } catch (ExperimentStoreException e) {
            log.error("Experiment store unavailable at {}: {}", props.getDataDir(), e.getMessage(), e);
            return;
        }
        int n = experiments.restore();
        log.info("=== StartupTasks END ({} experiments from {}) ===", n, props.getDataDir());
    }
}
