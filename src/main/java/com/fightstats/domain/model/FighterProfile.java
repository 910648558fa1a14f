package com.fightstats.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Fighter bio and career averages from the fighter-details page.
 * Numeric fields are null when the page shows no value ("--"), never zero.
 */
@JsonPropertyOrder({
    "id", "name", "nickname",
    "record_wins", "record_losses", "record_ties",
    "height_in", "weight_lb", "reach_in", "stance", "age",
    "strikes_landed_per_min", "strike_accuracy",
    "strikes_absorbed_per_min", "strike_defense",
    "grapple_avg", "grapple_accuracy", "grapple_defense",
    "submission_avg"
})
public record FighterProfile(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("nickname") String nickname,
    @JsonProperty("record_wins") Integer recordWins,
    @JsonProperty("record_losses") Integer recordLosses,
    @JsonProperty("record_ties") Integer recordTies,
    @JsonProperty("height_in") Integer heightIn,
    @JsonProperty("weight_lb") Integer weightLb,
    @JsonProperty("reach_in") Integer reachIn,
    @JsonProperty("stance") String stance,
    @JsonProperty("age") Integer age,
    @JsonProperty("strikes_landed_per_min") Double strikesLandedPerMin,
    @JsonProperty("strike_accuracy") Double strikeAccuracy,
    @JsonProperty("strikes_absorbed_per_min") Double strikesAbsorbedPerMin,
    @JsonProperty("strike_defense") Double strikeDefense,
    @JsonProperty("grapple_avg") Double grappleAvg,
    @JsonProperty("grapple_accuracy") Double grappleAccuracy,
    @JsonProperty("grapple_defense") Double grappleDefense,
    @JsonProperty("submission_avg") Double submissionAvg
) {

    public FighterProfile {
        Objects.requireNonNull(id, "id");
    }
}
