package org.learningjava.abtool.domain.exception;

public class UnassignedParticipantException extends ExperimentException {
    private final String experimentId;
    private final String participantId;

    public UnassignedParticipantException(String experimentId, String participantId) {
        super("Participant " + participantId + " has no assignment in experiment " + experimentId);
        this.experimentId = experimentId;
        this.participantId = participantId;
    }

    public String getExperimentId() { return experimentId; }
    public String getParticipantId() { return participantId; }
}
