package org.learningjava.abtool.config;

import org.learningjava.abtool.application.port.ExperimentStorePort;
import org.learningjava.abtool.infrastructure.adapter.out.fs.FileSystemExperimentStore;
import org.learningjava.abtool.infrastructure.adapter.out.fs.RetryingExperimentStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Random;
import java.util.random.RandomGenerator;

@Configuration
public class AppConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    // shared across experiments, so it has to be thread-safe
    @Bean
    RandomGenerator assignmentRandom() {
        return new Random();
    }

    @Bean
    ExperimentStorePort experimentStore(ExperimentProperties props) {
        ExperimentProperties.Persistence p = props.getPersistence();
        return new RetryingExperimentStore(
                new FileSystemExperimentStore(Path.of(props.getDataDir())),
                p.getMaxAttempts(),
                p.getInitialBackoff(),
                p.getBackoffMultiplier());
    }
}
