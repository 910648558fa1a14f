package com.fightstats.domain.model;

/**
 * A "landed of attempted" pair such as "12 of 34".
 */
public record Fraction(int landed, int attempted) {

    public static final Fraction ZERO = new Fraction(0, 0);
}
