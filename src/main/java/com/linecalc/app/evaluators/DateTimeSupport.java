package com.linecalc.app.evaluators;

import com.linecalc.app.exceptions.DomainException;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.MonthDay;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Parsing and formatting shared by the date/time handlers.
 * Timestamps render as "yyyy-MM-dd HH:mm ZONE" and parse back through
 * {@link #parseDateTime(String, ZoneId, Clock)}, so a result can be fed to a later line.
 */
public final class DateTimeSupport {

    public static final DateTimeFormatter OUTPUT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm z", Locale.ENGLISH);
    public static final DateTimeFormatter DATE_OUTPUT = DateTimeFormatter.ofPattern("yyyy-MM-dd", Locale.ENGLISH);

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = formatters(
            "yyyy-MM-dd HH:mm:ss", "yyyy-MM-dd HH:mm", "yyyy-MM-dd'T'HH:mm:ss", "yyyy-MM-dd'T'HH:mm",
            "M/d/yyyy HH:mm:ss", "M/d/yyyy HH:mm", "M/d/yyyy h:mm a", "MMM d, yyyy HH:mm", "MMM d yyyy HH:mm");

    private static final List<DateTimeFormatter> DATE_FORMATS = formatters(
            "yyyy-MM-dd", "M/d/yyyy", "MMM d, yyyy", "MMM d yyyy", "MMMM d, yyyy", "MMMM d yyyy",
            "d MMM yyyy", "d MMMM yyyy");

    private static final List<DateTimeFormatter> TIME_FORMATS = formatters(
            "h:mm a", "h:mma", "h:mm:ss a", "h:mm:ssa", "h a", "ha", "H:mm:ss", "H:mm");

    private static final List<DateTimeFormatter> MONTH_DAY_FORMATS = formatters(
            "MMM d", "MMMM d", "d MMM", "d MMMM");

    private static final Map<String, Double> UNIT_SECONDS = new HashMap<>();

    static {
        for (String u : new String[]{"s", "sec", "secs", "second", "seconds"}) {
            UNIT_SECONDS.put(u, 1.0);
        }
        for (String u : new String[]{"m", "min", "mins", "minute", "minutes"}) {
            UNIT_SECONDS.put(u, 60.0);
        }
        for (String u : new String[]{"h", "hr", "hrs", "hour", "hours"}) {
            UNIT_SECONDS.put(u, 3600.0);
        }
        for (String u : new String[]{"d", "day", "days"}) {
            UNIT_SECONDS.put(u, 86400.0);
        }
        for (String u : new String[]{"w", "wk", "wks", "week", "weeks"}) {
            UNIT_SECONDS.put(u, 7 * 86400.0);
        }
        // months and years are approximate
        for (String u : new String[]{"mo", "month", "months"}) {
            UNIT_SECONDS.put(u, 30.44 * 86400.0);
        }
        for (String u : new String[]{"y", "yr", "yrs", "year", "years"}) {
            UNIT_SECONDS.put(u, 365.25 * 86400.0);
        }
    }

    /**
     * Alternation of every unit name, longest first so regexes prefer "minutes" over "m".
     */
    public static final String UNIT_REGEX = unitRegex();

    private DateTimeSupport() {
    }

    private static List<DateTimeFormatter> formatters(String... patterns) {
        List<DateTimeFormatter> list = new ArrayList<>();
        for (String pattern : patterns) {
            list.add(new DateTimeFormatterBuilder()
                    .parseCaseInsensitive()
                    .appendPattern(pattern)
                    .toFormatter(Locale.ENGLISH));
        }
        return list;
    }

    private static String unitRegex() {
        List<String> units = new ArrayList<>(UNIT_SECONDS.keySet());
        units.sort((a, b) -> b.length() != a.length() ? b.length() - a.length() : a.compareTo(b));
        return "(?:" + String.join("|", units) + ")";
    }

    public static String format(ZonedDateTime time) {
        return OUTPUT.format(time);
    }

    public static boolean isUnit(String unit) {
        return UNIT_SECONDS.containsKey(unit.toLowerCase(Locale.ROOT));
    }

    public static double unitSeconds(String unit) {
        Double seconds = UNIT_SECONDS.get(unit.toLowerCase(Locale.ROOT));
        if (seconds == null) {
            throw new DomainException("unknown time unit: " + unit);
        }
        return seconds;
    }

    public static Duration toDuration(double amount, String unit) {
        return Duration.ofMillis(Math.round(amount * unitSeconds(unit) * 1000));
    }

    public static double convert(Duration duration, String unit) {
        return duration.toMillis() / 1000.0 / unitSeconds(unit);
    }

    /**
     * Parses a date, date-time or time of day. A trailing zone token
     * ("PST", "seattle", "Europe/Paris") overrides 'defaultZone'; a bare time
     * of day falls on today's date in that zone.
     */
    public static Optional<ZonedDateTime> parseDateTime(String text, ZoneId defaultZone, Clock clock) {
        String s = text.trim().replaceAll("\\s+", " ");
        if (s.isEmpty()) {
            return Optional.empty();
        }
        ZoneId zone = defaultZone;
        int space = s.lastIndexOf(' ');
        if (space > 0) {
            Optional<ZoneId> trailing = TimezoneDirectory.lookup(s.substring(space + 1));
            if (trailing.isPresent()) {
                zone = trailing.get();
                s = s.substring(0, space);
            }
        }
        for (DateTimeFormatter f : DATE_TIME_FORMATS) {
            try {
                return Optional.of(LocalDateTime.parse(s, f).atZone(zone));
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        for (DateTimeFormatter f : DATE_FORMATS) {
            try {
                return Optional.of(LocalDate.parse(s, f).atStartOfDay(zone));
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        Optional<LocalTime> time = parseTime(s);
        if (time.isPresent()) {
            return Optional.of(ZonedDateTime.of(LocalDate.now(clock.withZone(zone)), time.get(), zone));
        }
        return Optional.empty();
    }

    public static Optional<LocalTime> parseTime(String text) {
        String s = text.trim();
        for (DateTimeFormatter f : TIME_FORMATS) {
            try {
                return Optional.of(LocalTime.parse(s, f));
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        return Optional.empty();
    }

    /**
     * Like {@link #parseDateTime} but also accepts "Dec 6" / "6 December",
     * placed in the current year.
     */
    public static Optional<LocalDate> parseDate(String text, ZoneId zone, Clock clock) {
        String s = text.trim().replaceAll("\\s+", " ");
        for (DateTimeFormatter f : MONTH_DAY_FORMATS) {
            try {
                return Optional.of(MonthDay.parse(s, f).atYear(LocalDate.now(clock.withZone(zone)).getYear()));
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        return parseDateTime(s, zone, clock).map(ZonedDateTime::toLocalDate);
    }

    /**
     * Human form of a duration, largest sensible unit first:
     * "2 days 3.5 hours", "5.5 hours", "45 minutes", "30 seconds".
     */
    public static String formatDuration(Duration duration) {
        double totalHours = duration.toMillis() / 3_600_000.0;
        double days = Math.floor(totalHours / 24);
        if (days >= 1) {
            double hours = totalHours - days * 24;
            if (hours > 0.05) {
                return String.format(Locale.ROOT, "%.0f days %.1f hours", days, hours);
            }
            return String.format(Locale.ROOT, "%.0f days", days);
        }
        if (totalHours >= 1) {
            return String.format(Locale.ROOT, "%.1f hours", totalHours);
        }
        double minutes = duration.toMillis() / 60_000.0;
        if (minutes >= 1) {
            return String.format(Locale.ROOT, "%.0f minutes", minutes);
        }
        return String.format(Locale.ROOT, "%.0f seconds", duration.toMillis() / 1000.0);
    }

    /**
     * "%.0f" for whole numbers, "%.2f" otherwise.
     */
    public static String formatAmount(double amount) {
        if (amount == Math.rint(amount)) {
            return String.format(Locale.ROOT, "%.0f", amount);
        }
        return String.format(Locale.ROOT, "%.2f", amount);
    }
}
