package com.mux.sdk.jwt;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses human readable time spans such as {@code 7d}, {@code 1 hour}, {@code 90s},
 * {@code 2 days ago} or {@code -30m} into signed seconds.
 */
public final class TimeSpans {
    private static final Pattern SPAN = Pattern.compile(
            "^([+-])? ?(\\d+|\\d*\\.\\d+) ?"
                    + "(seconds?|secs?|s|minutes?|mins?|m|hours?|hrs?|h|days?|d|weeks?|w|years?|yrs?|y)"
                    + "(?: (ago|from now))?$",
            Pattern.CASE_INSENSITIVE);

    private static final long MINUTE = 60;
    private static final long HOUR = MINUTE * 60;
    private static final long DAY = HOUR * 24;
    private static final long WEEK = DAY * 7;
    private static final double YEAR = DAY * 365.25;

    private TimeSpans() {
    }

    public static long parseSeconds(String span) {
        if (span == null) {
            throw new IllegalArgumentException("Time span must not be null");
        }
        Matcher matcher = SPAN.matcher(span.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid time span format: " + span);
        }
        boolean negativeSign = "-".equals(matcher.group(1));
        String suffix = matcher.group(4) != null ? matcher.group(4).toLowerCase(Locale.ROOT) : null;
        if (negativeSign && "from now".equals(suffix)) {
            throw new IllegalArgumentException("Invalid time span format, only one of '-', 'ago' or 'from now' allowed: "
                    + span);
        }
        double value = Double.parseDouble(matcher.group(2));
        long seconds = Math.round(value * unitSeconds(matcher.group(3).toLowerCase(Locale.ROOT)));
        return negativeSign || "ago".equals(suffix) ? -seconds : seconds;
    }

    private static double unitSeconds(String unit) {
        switch (unit.charAt(0)) {
            case 's':
                return 1;
            case 'm':
                return MINUTE;
            case 'h':
                return HOUR;
            case 'd':
                return DAY;
            case 'w':
                return WEEK;
            default:
                return YEAR;
        }
    }
}
