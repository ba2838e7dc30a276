package org.learningjava.abtool.domain.model.experiment;

import java.time.Instant;

public record Assignment(
        String variant,
        Instant assignedAt,
        String sessionId
) { }
