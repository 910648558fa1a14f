package com.fightstats.domain.model;

/**
 * Career wins-losses-draws. A component is null when the page shows something that is not a number.
 */
public record FightRecord(Integer wins, Integer losses, Integer ties) {
}
