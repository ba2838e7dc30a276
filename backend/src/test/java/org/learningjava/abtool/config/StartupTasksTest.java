package org.learningjava.abtool.config;

import org.junit.jupiter.api.Test;
import org.learningjava.abtool.application.port.ExperimentStorePort;
import org.learningjava.abtool.application.usecase.ExperimentLifecycleManager;
import org.learningjava.abtool.domain.exception.ExperimentStoreException;
import org.learningjava.abtool.domain.model.experiment.ExperimentDefaults;
import org.springframework.boot.DefaultApplicationArguments;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class StartupTasksTest {

    private final ExperimentStorePort store = mock(ExperimentStorePort.class);
    private final ExperimentLifecycleManager experiments = mock(ExperimentLifecycleManager.class);
    private final ExperimentProperties props = new ExperimentProperties();

    @Test
    void run_preparesStoreThenRestores() {
        new StartupTasks(store, experiments, props).run(new DefaultApplicationArguments());

        var order = inOrder(store, experiments);
        order.verify(store).ensureStorage();
        order.verify(experiments).restore();
    }

    @Test
    void run_disabled_touchesNothing() {
        props.setRestoreOnStartup(false);

        new StartupTasks(store, experiments, props).run(new DefaultApplicationArguments());

        verifyNoInteractions(store, experiments);
    }

    @Test
    void run_unusableStore_skipsRestore() {
        doThrow(new ExperimentStoreException("read-only", null)).when(store).ensureStorage();

        new StartupTasks(store, experiments, props).run(new DefaultApplicationArguments());

        verifyNoInteractions(experiments);
    }

    @Test
    void defaultsMatchConfiguredValues() {
        props.setMinSampleSize(250);

        ExperimentDefaults d = props.toDefaults();

        assertEquals(250, d.minSampleSize());
        assertEquals(0.95, d.significanceThreshold());
        assertEquals(30, d.durationDays());
        assertEquals(ExperimentDefaults.DEFAULT_METRICS, d.metrics());
    }
}
