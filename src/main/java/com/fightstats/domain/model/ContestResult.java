package com.fightstats.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Both participants' totals for a contest, in the order they appear on the fight page.
 * A contest is persisted with both rows or not at all.
 */
public record ContestResult(String contestId, ContestParticipantResult first, ContestParticipantResult second) {

    public ContestResult {
        Objects.requireNonNull(contestId, "contestId");
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
        if (!contestId.equals(first.contestId()) || !contestId.equals(second.contestId())) {
            throw new IllegalArgumentException("Participant rows do not belong to contest " + contestId);
        }
    }

    public static ContestResult of(List<ContestParticipantResult> participants) {
        if (participants == null || participants.size() != 2) {
            throw new IllegalArgumentException("A contest needs exactly two participants, got "
                + (participants == null ? 0 : participants.size()));
        }
        return new ContestResult(participants.get(0).contestId(), participants.get(0), participants.get(1));
    }

    public List<ContestParticipantResult> rows() {
        return List.of(first, second);
    }
}
