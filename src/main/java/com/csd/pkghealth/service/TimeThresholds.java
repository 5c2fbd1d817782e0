package com.csd.pkghealth.service;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Age threshold parsing ({@code 2y}, {@code 6m}, {@code 90d}) and human-readable durations.
 * A year counts 365 days and a month 30.
 */
public final class TimeThresholds {
    private static final Pattern THRESHOLD = Pattern.compile("^(\\d+)([ymd])$", Pattern.CASE_INSENSITIVE);
    private static final int DAYS_PER_YEAR = 365;
    private static final int DAYS_PER_MONTH = 30;

    private TimeThresholds() {}

    public static long toDays(String threshold) {
        Matcher m = threshold == null ? null : THRESHOLD.matcher(threshold.trim());
        if (m == null || !m.matches()) {
            throw new IllegalArgumentException("Invalid time threshold: " + threshold + " (use e.g. 2y, 6m or 90d)");
        }
        long value = Long.parseLong(m.group(1));
        switch (m.group(2).toLowerCase(Locale.ROOT)) {
            case "y":
                return value * DAYS_PER_YEAR;
            case "m":
                return value * DAYS_PER_MONTH;
            default:
                return value;
        }
    }

    public static String daysToHuman(long days) {
        if (days < 1) return "today";
        if (days == 1) return "1 day";
        if (days < 7) return days + " days";
        if (days < 30) return plural(days / 7, "week");
        if (days < DAYS_PER_YEAR) return plural(days / DAYS_PER_MONTH, "month");

        long years = days / DAYS_PER_YEAR;
        long months = (days % DAYS_PER_YEAR) / DAYS_PER_MONTH;
        if (months == 0) {
            return plural(years, "year");
        }
        return plural(years, "year") + " " + plural(months, "month");
    }

    private static String plural(long count, String unit) {
        return count == 1 ? "1 " + unit : count + " " + unit + "s";
    }
}
