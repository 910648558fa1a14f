package com.fightstats.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A completed card as listed on the events page.
 *
 * @param id        opaque id taken from the event-details URL
 * @param date      ISO-8601 date, or the raw listing text when it could not be parsed
 * @param sourceUrl event-details page URL, used verbatim for the detail fetch
 */
@JsonPropertyOrder({"event_id", "event_date", "source_url"})
public record Event(
    @JsonProperty("event_id") String id,
    @JsonProperty("event_date") String date,
    @JsonProperty("source_url") String sourceUrl
) {

    public Event {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(sourceUrl, "sourceUrl");
    }
}
