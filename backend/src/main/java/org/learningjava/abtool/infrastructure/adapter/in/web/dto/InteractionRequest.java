package org.learningjava.abtool.infrastructure.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import org.learningjava.abtool.domain.model.experiment.Interaction;

import java.util.Map;

/** {@code type} defaults to an impression; {@code "conversion"} also counts a conversion. */
public record InteractionRequest(
        @NotBlank String participantId,
        String type,
        Map<String, Double> metrics
) {
    public Interaction toInteraction() {
        return new Interaction(type == null || type.isBlank() ? Interaction.IMPRESSION : type.trim(), metrics);
    }
}
