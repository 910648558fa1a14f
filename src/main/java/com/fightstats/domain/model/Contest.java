package com.fightstats.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A single bout on an event card.
 * <p>
 * {@code outcomeMethod} holds only the short method label (e.g. "KO/TKO"); the longer
 * detail line shown under it on the event page is not kept.
 */
@JsonPropertyOrder({"contest_id", "event_date", "category", "outcome_method", "outcome_round"})
public record Contest(
    @JsonProperty("contest_id") String id,
    @JsonIgnore String eventId,
    @JsonProperty("event_date") String eventDate,
    @JsonProperty("category") String category,
    @JsonProperty("outcome_method") String outcomeMethod,
    @JsonProperty("outcome_round") Integer outcomeRound
) {

    public Contest {
        Objects.requireNonNull(id, "id");
    }
}
