package com.fightstats.infrastructure.scraper.ufcstats;

import com.fightstats.domain.model.FightRecord;
import com.fightstats.domain.model.Fraction;

import java.time.LocalDate;
import java.time.Period;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts scraped ufcstats.com text into typed values.
 * <p>
 * Every method is total: malformed input maps to a fixed sentinel (0, null, or the
 * input itself) and nothing is thrown.
 */
public final class FieldNormalizers {

    private static final DateTimeFormatter EVENT_DATE_FORMAT = strictDate("MMMM d, uuuu");
    private static final DateTimeFormatter DOB_FORMAT = strictDate("MMM d, uuuu");

    private static final Pattern FRACTION_PATTERN = Pattern.compile("^(\\d+)\\s+of\\s+(\\d+)");
    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final Pattern LEADING_DIGITS = Pattern.compile("^\\s*(\\d+)");
    private static final Pattern CONTROL_TIME = Pattern.compile("(\\d+):(\\d+)");

    private FieldNormalizers() {
    }

    /**
     * "4:32" to 272. Blank, "--", "---" and anything not M:SS give 0.
     */
    public static int controlSeconds(String text) {
        if (isMissing(text)) {
            return 0;
        }
        Matcher matcher = CONTROL_TIME.matcher(text.trim());
        if (!matcher.matches()) {
            return 0;
        }
        try {
            return Integer.parseInt(matcher.group(1)) * 60 + Integer.parseInt(matcher.group(2));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /**
     * "12 of 34" to (12, 34); a bare "5" to (5, 0); anything else to (0, 0).
     */
    public static Fraction fraction(String text) {
        if (text == null) {
            return Fraction.ZERO;
        }
        String trimmed = text.trim();
        try {
            Matcher matcher = FRACTION_PATTERN.matcher(trimmed);
            if (matcher.find()) {
                return new Fraction(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
            }
            if (DIGITS.matcher(trimmed).matches()) {
                return new Fraction(Integer.parseInt(trimmed), 0);
            }
        } catch (NumberFormatException e) {
            // digit run too long for an int
            return Fraction.ZERO;
        }
        return Fraction.ZERO;
    }

    /**
     * Plain non-negative count such as submission attempts. Non-digits give 0.
     */
    public static int count(String text) {
        if (text == null) {
            return 0;
        }
        String trimmed = text.trim();
        if (!DIGITS.matcher(trimmed).matches()) {
            return 0;
        }
        try {
            return Integer.parseInt(trimmed);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /**
     * "February 21, 2026" to "2026-02-21". Unparseable dates come back trimmed but
     * otherwise unchanged, so consumers see "ISO-8601 or opaque".
     */
    public static String isoDate(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.trim();
        try {
            return LocalDate.parse(trimmed, EVENT_DATE_FORMAT).toString();
        } catch (DateTimeParseException e) {
            return trimmed;
        }
    }

    /**
     * "50%" to 0.50. "--", blank and non-numeric give null.
     */
    public static Double percentage(String text) {
        if (isMissing(text)) {
            return null;
        }
        Double value = decimal(text.replace("%", ""));
        return value == null ? null : value / 100;
    }

    /**
     * "3.29" to 3.29. "--", blank and non-numeric give null.
     */
    public static Double decimal(String text) {
        if (isMissing(text)) {
            return null;
        }
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * {@code 5' 7"} to 67 inches. A missing inches part counts as zero.
     */
    public static Integer heightInches(String text) {
        if (isMissing(text)) {
            return null;
        }
        String[] parts = text.trim().replace("\"", "").split("'", -1);
        try {
            int feet = Integer.parseInt(parts[0].trim());
            String inchesPart = parts.length > 1 ? parts[1].trim() : "";
            int inches = inchesPart.isEmpty() ? 0 : Integer.parseInt(inchesPart);
            return feet * 12 + inches;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * "155 lbs." to 155.
     */
    public static Integer weightPounds(String text) {
        if (isMissing(text)) {
            return null;
        }
        return truncated(text.replace("lbs.", "").replace("lbs", ""));
    }

    /**
     * {@code 72"} to 72.
     */
    public static Integer reachInches(String text) {
        if (isMissing(text)) {
            return null;
        }
        return truncated(text.replace("\"", ""));
    }

    /**
     * "12-3-1" to (12, 3, 1). Missing components are 0. Each component is read from its
     * leading digits, so "1 (1 NC)" counts as 1; a component without digits is null.
     */
    public static FightRecord fightRecord(String text) {
        String cleaned = text == null ? "" : text.replace("Record:", "").trim();
        String[] parts = cleaned.isEmpty() ? new String[0] : cleaned.split("-", -1);
        return new FightRecord(recordComponent(parts, 0), recordComponent(parts, 1), recordComponent(parts, 2));
    }

    /**
     * Whole years between a "Jul 22, 1989" date of birth and {@code today}; null when the
     * date of birth is absent or unparseable.
     */
    public static Integer age(String dateOfBirth, LocalDate today) {
        if (isMissing(dateOfBirth) || today == null) {
            return null;
        }
        try {
            LocalDate dob = LocalDate.parse(dateOfBirth.trim(), DOB_FORMAT);
            return Period.between(dob, today).getYears();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Trimmed text, or null when blank or "--".
     */
    public static String textOrNull(String text) {
        return isMissing(text) ? null : text.trim();
    }

    // Impossible dates such as "February 30" are rejected, not clamped
    private static DateTimeFormatter strictDate(String pattern) {
        return new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern(pattern)
            .toFormatter(Locale.ENGLISH)
            .withResolverStyle(ResolverStyle.STRICT);
    }

    private static Integer recordComponent(String[] parts, int index) {
        if (index >= parts.length) {
            return 0;
        }
        Matcher matcher = LEADING_DIGITS.matcher(parts[index]);
        if (!matcher.find()) {
            return null;
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Integer truncated(String text) {
        try {
            return (int) Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean isMissing(String text) {
        if (text == null) {
            return true;
        }
        String trimmed = text.trim();
        return trimmed.isEmpty() || trimmed.equals("--") || trimmed.equals("---");
    }
}
