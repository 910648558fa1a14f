package com.fightstats.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Totals for one fighter in one contest.
 */
@JsonPropertyOrder({
    "contest_id", "participant_id", "outcome",
    "strike_landed", "strike_attempted",
    "grapple_landed", "grapple_attempted",
    "submission_attempts", "control_seconds"
})
public record ContestParticipantResult(
    @JsonProperty("contest_id") String contestId,
    @JsonProperty("participant_id") String participantId,
    @JsonProperty("outcome") String outcome,
    @JsonProperty("strike_landed") int strikeLanded,
    @JsonProperty("strike_attempted") int strikeAttempted,
    @JsonProperty("grapple_landed") int grappleLanded,
    @JsonProperty("grapple_attempted") int grappleAttempted,
    @JsonProperty("submission_attempts") int submissionAttempts,
    @JsonProperty("control_seconds") int controlSeconds
) {

    public ContestParticipantResult {
        Objects.requireNonNull(contestId, "contestId");
        Objects.requireNonNull(participantId, "participantId");
        outcome = outcome == null ? "" : outcome;
    }
}
