package org.carball.deepanalysis.analyzer;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps a requested time window token to the window it is compared against and to its
 * granularity.
 */
public final class TimeframeMapper {

    // to-date windows keep their token: only a comparison probe can resolve their prior period
    private static final Map<String, String> RELATIVE_PREVIOUS = Map.of(
            "current_quarter", "last_quarter",
            "this_quarter", "last_quarter",
            "current_month", "last_month",
            "this_month", "last_month",
            "current_year", "last_year",
            "this_year", "last_year",
            "quarter_to_date", "quarter_to_date",
            "month_to_date", "month_to_date",
            "year_to_date", "year_to_date");

    private static final Pattern YEAR = Pattern.compile("^(?:fy)?(\\d{4})$");
    private static final Pattern YEAR_QUARTER = Pattern.compile("^(?:fy)?(\\d{4})[-/ ]?q([1-4])$");
    private static final Pattern YEAR_MONTH = Pattern.compile("^(?:fy)?(\\d{4})[-/ ]?(?:p|m)?(\\d{1,2})$");

    private TimeframeMapper() {
    }

    /**
     * The window immediately before {@code timeframe}, when one can be derived.
     * Relative tokens such as {@code current_quarter} and explicit periods such as
     * {@code 2025}, {@code 2025-Q1} or {@code 2025-03} are understood.
     */
    public static Optional<String> previous(String timeframe) {
        if (timeframe == null || timeframe.isBlank()) {
            return Optional.empty();
        }
        String token = timeframe.trim().toLowerCase(Locale.ROOT);
        String relative = RELATIVE_PREVIOUS.get(token);
        if (relative != null) {
            return Optional.of(relative);
        }

        Matcher m = YEAR.matcher(token);
        if (m.matches()) {
            return Optional.of(String.valueOf(Integer.parseInt(m.group(1)) - 1));
        }
        m = YEAR_QUARTER.matcher(token);
        if (m.matches()) {
            int year = Integer.parseInt(m.group(1));
            int quarter = Integer.parseInt(m.group(2));
            return Optional.of(quarter == 1 ? (year - 1) + "-Q4" : year + "-Q" + (quarter - 1));
        }
        m = YEAR_MONTH.matcher(token);
        if (m.matches()) {
            int year = Integer.parseInt(m.group(1));
            int month = Integer.parseInt(m.group(2));
            if (month < 1 || month > 12) {
                return Optional.empty();
            }
            return Optional.of(month == 1
                    ? String.format("%d-12", year - 1)
                    : String.format("%d-%02d", year, month - 1));
        }
        return Optional.empty();
    }

    public static boolean isQuarterly(String timeframe) {
        String token = normalize(timeframe);
        return token.contains("quarter") || YEAR_QUARTER.matcher(token).matches();
    }

    public static boolean isYearly(String timeframe) {
        String token = normalize(timeframe);
        return token.contains("year") || YEAR.matcher(token).matches();
    }

    private static String normalize(String timeframe) {
        return timeframe == null ? "" : timeframe.trim().toLowerCase(Locale.ROOT);
    }
}
