package org.learningjava.abtool.infrastructure.adapter.in.web;

import jakarta.validation.Valid;
import org.learningjava.abtool.application.usecase.ExperimentLifecycleManager;
import org.learningjava.abtool.domain.exception.ExperimentClosedException;
import org.learningjava.abtool.domain.exception.ExperimentNotFoundException;
import org.learningjava.abtool.domain.exception.InvalidExperimentException;
import org.learningjava.abtool.domain.exception.UnassignedParticipantException;
import org.learningjava.abtool.domain.model.experiment.ExperimentReport;
import org.learningjava.abtool.domain.model.experiment.ExperimentSnapshot;
import org.learningjava.abtool.domain.model.experiment.ExperimentSummary;
import org.learningjava.abtool.domain.model.experiment.ParticipantAssignment;
import org.learningjava.abtool.infrastructure.adapter.in.web.dto.CreateExperimentRequest;
import org.learningjava.abtool.infrastructure.adapter.in.web.dto.InteractionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/experiments")
public class ExperimentsController {

    private static final Logger log = LoggerFactory.getLogger(ExperimentsController.class);

    private final ExperimentLifecycleManager experiments;

    public ExperimentsController(ExperimentLifecycleManager experiments) {
        this.experiments = experiments;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ExperimentSnapshot create(@Valid @RequestBody CreateExperimentRequest request) {
        return experiments.create(request.toConfig());
    }

    /** Active experiments only. */
    @GetMapping
    public List<ExperimentSnapshot> listActive() {
        return experiments.listActive();
    }

    @GetMapping("/{id}")
    public ExperimentSnapshot results(@PathVariable("id") String id) {
        return experiments.getResults(id);
    }

    @PostMapping("/{id}/participants/{participantId}")
    public ParticipantAssignment assign(@PathVariable("id") String id,
                                        @PathVariable("participantId") String participantId) {
        return experiments.assign(id, participantId);
    }

    @PostMapping("/{id}/interactions")
    public ExperimentSnapshot record(@PathVariable("id") String id,
                                     @Valid @RequestBody InteractionRequest request) {
        return experiments.recordInteraction(id, request.participantId(), request.toInteraction());
    }

    @GetMapping("/reports")
    public List<ExperimentReport> reports() {
        return experiments.reportHistory();
    }

    @GetMapping("/summary")
    public ExperimentSummary summary() {
        return experiments.summary();
    }

    // ---------- error mapping ----------

    @ExceptionHandler(ExperimentNotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(ExperimentNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler({InvalidExperimentException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> badRequest(RuntimeException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler({UnassignedParticipantException.class, ExperimentClosedException.class})
    public ResponseEntity<Map<String, Object>> conflict(RuntimeException e) {
        return error(HttpStatus.CONFLICT, e.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        log.debug("{} -> {}", status.value(), message);
        return ResponseEntity.status(status).body(Map.of(
                "status", status.value(),
                "error", message == null ? status.getReasonPhrase() : message));
    }
}
