package org.learningjava.abtool.infrastructure.adapter.out.fs;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.learningjava.abtool.application.port.ExperimentStorePort;
import org.learningjava.abtool.domain.exception.ExperimentStoreException;
import org.learningjava.abtool.domain.model.experiment.Experiment;
import org.learningjava.abtool.domain.model.experiment.ExperimentReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * One pretty-printed JSON file per experiment ({@code test-<id>.json}) and per report
 * ({@code report-<id>.json}) in a single directory.
 */
public class FileSystemExperimentStore implements ExperimentStorePort {

    private static final Logger log = LoggerFactory.getLogger(FileSystemExperimentStore.class);

    static final String EXPERIMENT_PREFIX = "test-";
    static final String REPORT_PREFIX = "report-";
    static final String SUFFIX = ".json";

    private final Path dir;
    private final ObjectMapper om;

    public FileSystemExperimentStore(Path dir) {
        this.dir = dir;
        this.om = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void ensureStorage() {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new ExperimentStoreException("Cannot create store directory " + dir, e);
        }
    }

    @Override
    public Optional<Experiment> load(String id) {
        Path p = experimentPath(id);
        if (!Files.isRegularFile(p)) return Optional.empty();
        try {
            return Optional.of(om.readValue(p.toFile(), Experiment.class));
        } catch (IOException e) {
            throw new ExperimentStoreException("Cannot read experiment " + id, e);
        }
    }

    @Override
    public void save(Experiment experiment) {
        write(experimentPath(experiment.getId()), experiment);
    }

    @Override
    public List<Experiment> loadAll() {
        return scan(EXPERIMENT_PREFIX, Experiment.class);
    }

    @Override
    public void saveReport(ExperimentReport report) {
        write(dir.resolve(REPORT_PREFIX + safe(report.experimentId()) + SUFFIX), report);
    }

    @Override
    public List<ExperimentReport> loadReports() {
        return scan(REPORT_PREFIX, ExperimentReport.class);
    }

    // ---------- helpers ----------

    private <T> List<T> scan(String prefix, Class<T> type) {
        if (!Files.isDirectory(dir)) return List.of();

        List<Path> files;
        try (Stream<Path> s = Files.list(dir)) {
            files = s.filter(Files::isRegularFile)
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.startsWith(prefix) && name.endsWith(SUFFIX);
                    })
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new ExperimentStoreException("Cannot list store directory " + dir, e);
        }

        List<T> out = new ArrayList<>();
        for (Path p : files) {
            try {
                out.add(om.readValue(p.toFile(), type));
            } catch (IOException e) {
                log.warn("Skipping malformed file {}: {}", p.getFileName(), e.getMessage());
            }
        }
        return out;
    }

    private void write(Path target, Object value) {
        try {
            Files.createDirectories(dir);
            Path tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
            try {
                om.writeValue(tmp.toFile(), value);
                moveIntoPlace(tmp, target);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new ExperimentStoreException("Cannot write " + target.getFileName(), e);
        }
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private Path experimentPath(String id) {
        return dir.resolve(EXPERIMENT_PREFIX + safe(id) + SUFFIX);
    }

    /** Ids become file names; anything outside [A-Za-z0-9_-] is replaced. */
    private static String safe(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Experiment id is blank");
        }
        return id.replaceAll("[^A-Za-z0-9_-]", "_");
    }
}
