package org.learningjava.abtool.domain.model.experiment;

import java.time.Instant;

/**
 * Result of assigning a participant.
 *
 * @param newlyAssigned false when the participant already had a sticky assignment
 */
public record ParticipantAssignment(
        String experimentId,
        String participantId,
        String variantId,
        Variant variant,
        Instant assignedAt,
        boolean newlyAssigned
) { }
