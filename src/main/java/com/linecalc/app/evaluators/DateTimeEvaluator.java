package com.linecalc.app.evaluators;

import com.linecalc.app.exceptions.DomainException;
import com.linecalc.app.models.EvaluatedLine;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Dates, times, time zones and durations: "now in tokyo",
 * "6:00 am seattle in kiev", "today + 3 weeks", "861.5 hours in days",
 * "dec 6 till march 11", "13 x 3 min".
 *
 * "\N" references to earlier date/time lines are substituted with their
 * timestamp before the chain runs. The clock and the default zone are
 * injected so results are reproducible.
 */
public class DateTimeEvaluator extends HandlerChainEvaluator {

    private static final String UNIT = DateTimeSupport.UNIT_REGEX;

    private static final Pattern REF = Pattern.compile("\\\\(\\d{1,9})");
    private static final Pattern NOW_IN = Pattern.compile("^now(?:\\(\\))?\\s+in\\s+(.+)$");
    private static final Pattern TIME_CONVERSION = Pattern.compile(
            "^(\\d{1,2}(?::\\d{2}){0,2}\\s*(?:am|pm)?)\\s+(.+?)\\s+in\\s+(.+)$");
    private static final Pattern DURATION_CONVERSION = Pattern.compile(
            "^(\\d+(?:\\.\\d+)?)\\s*(" + UNIT + ")\\s+(?:in|to)\\s+(" + UNIT + ")$");
    private static final Pattern DATE_ARITHMETIC = Pattern.compile(
            "^(.+?)\\s*([+-])\\s*(\\d+(?:\\.\\d+)?)\\s*(" + UNIT + ")$");
    private static final Pattern ZONE_CONVERSION = Pattern.compile(
            "^(.+?)\\s+([a-z]{2,5})\\s+in\\s+(.+)$");
    private static final Pattern DATE_RANGE = Pattern.compile(
            "^(.+?)\\s+(?:till|until|to|through|-)\\s+(.+)$");
    private static final Pattern COUNT_TIMES_DURATION = Pattern.compile(
            "^(\\d+(?:\\.\\d+)?)\\s*[x*]\\s*(\\d+(?:\\.\\d+)?)\\s*(" + UNIT + ")$");
    private static final Pattern DURATION_TIMES_COUNT = Pattern.compile(
            "^\\(?\\s*(\\d+(?:\\.\\d+)?)\\s*(" + UNIT + ")\\s*\\)?\\s*[x*]\\s*(\\d+(?:\\.\\d+)?)$");

    private static final Pattern DATE_LIKE = Pattern.compile(
            "\\d{4}-\\d{2}-\\d{2}|\\d{1,2}/\\d{1,2}/\\d{4}|\\d{1,2}:\\d{2}");

    private static final List<String> KEYWORDS = List.of(
            "now", "today", "yesterday", "tomorrow", " in ", "till", "until", " am", " pm",
            "am ", "pm ", "sec", "min", "hour", "hr", "day", "week", "month", "year",
            "jan", "feb", "mar", "apr", "may", "jun", "jul", "aug", "sep", "oct", "nov", "dec");

    private final Clock clock;
    private final ZoneId zone;

    private final List<Handler> chain = List.of(
            this::nowInCity,
            this::now,
            this::relativeDay,
            this::durationConversion,
            this::timeConversion,
            this::durationMultiplication,
            this::dateArithmetic,
            this::zoneConversion,
            this::dateRange
    );

    public DateTimeEvaluator(Clock clock, ZoneId zone) {
        super("datetime");
        this.clock = clock;
        this.zone = zone;
    }

    @Override
    protected List<Handler> handlers() {
        return chain;
    }

    @Override
    public boolean accepts(String expr) {
        if (expr.indexOf('\\') >= 0 || DATE_LIKE.matcher(expr).find()) {
            return true;
        }
        String lower = expr.toLowerCase(Locale.ROOT);
        for (String keyword : KEYWORDS) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    @Override
    protected String prepare(String expr, LineContext context) {
        Matcher m = REF.matcher(expr);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            EvaluatedLine line = context.priorLine(Integer.parseInt(m.group(1)));
            String replacement = line != null && line.isDateTime() ? line.getDateTimeRef() : m.group();
            m.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(out);
        return out.toString();
    }

    /**
     * Timestamps and dates are referenceable by later date/time lines;
     * durations and counts are plain text.
     */
    @Override
    protected DomainResult toResult(HandlerResult claim) {
        if (claim.getValue() != null) {
            return DomainResult.dateTime(claim.getText());
        }
        return DomainResult.text(claim.getText());
    }

    // A claim carrying a value marks a point in time. The number itself is unused.
    private static HandlerResult timestamp(String text) {
        return HandlerResult.claimed(text, 0);
    }

    private ZonedDateTime now(ZoneId in) {
        return ZonedDateTime.now(clock.withZone(in));
    }

    HandlerResult nowInCity(String expr, String lower) {
        Matcher m = NOW_IN.matcher(lower);
        if (!m.matches()) {
            return HandlerResult.notMine();
        }
        ZoneId target = TimezoneDirectory.lookup(m.group(1))
                .orElseThrow(() -> new DomainException("unknown city or time zone: " + m.group(1)));
        return timestamp(DateTimeSupport.format(now(target)));
    }

    HandlerResult now(String expr, String lower) {
        if (!lower.equals("now") && !lower.equals("now()")) {
            return HandlerResult.notMine();
        }
        return timestamp(DateTimeSupport.format(now(zone)));
    }

    HandlerResult relativeDay(String expr, String lower) {
        LocalDate today = LocalDate.now(clock.withZone(zone));
        switch (lower) {
            case "today":
                return timestamp(DateTimeSupport.DATE_OUTPUT.format(today));
            case "yesterday":
                return timestamp(DateTimeSupport.DATE_OUTPUT.format(today.minusDays(1)));
            case "tomorrow":
                return timestamp(DateTimeSupport.DATE_OUTPUT.format(today.plusDays(1)));
            default:
                return HandlerResult.notMine();
        }
    }

    HandlerResult timeConversion(String expr, String lower) {
        Matcher m = TIME_CONVERSION.matcher(lower);
        if (!m.matches()) {
            return HandlerResult.notMine();
        }
        Optional<LocalTime> time = DateTimeSupport.parseTime(m.group(1).replaceAll("\\s+", " "));
        Optional<ZoneId> from = TimezoneDirectory.lookup(m.group(2));
        Optional<ZoneId> to = TimezoneDirectory.lookup(m.group(3));
        if (time.isEmpty() || from.isEmpty() || to.isEmpty()) {
            return HandlerResult.notMine();
        }
        ZonedDateTime source = ZonedDateTime.of(LocalDate.now(clock.withZone(from.get())), time.get(), from.get());
        return timestamp(DateTimeSupport.format(source.withZoneSameInstant(to.get())));
    }

    HandlerResult durationConversion(String expr, String lower) {
        Matcher m = DURATION_CONVERSION.matcher(lower);
        if (!m.matches()) {
            return HandlerResult.notMine();
        }
        double amount = Double.parseDouble(m.group(1));
        double converted = amount * DateTimeSupport.unitSeconds(m.group(2)) / DateTimeSupport.unitSeconds(m.group(3));
        return HandlerResult.claimed(DateTimeSupport.formatAmount(converted) + " " + m.group(3));
    }

    HandlerResult dateArithmetic(String expr, String lower) {
        Matcher m = DATE_ARITHMETIC.matcher(lower);
        if (!m.matches()) {
            return HandlerResult.notMine();
        }
        String base = m.group(1).trim();
        ZonedDateTime start;
        if (base.equals("now") || base.equals("now()") || base.equals("0")) {
            start = now(zone);
        } else if (base.equals("today")) {
            start = LocalDate.now(clock.withZone(zone)).atStartOfDay(zone);
        } else {
            Optional<ZonedDateTime> parsed = DateTimeSupport.parseDateTime(base, zone, clock);
            if (parsed.isEmpty()) {
                return HandlerResult.notMine();
            }
            start = parsed.get();
        }
        Duration delta = DateTimeSupport.toDuration(Double.parseDouble(m.group(3)), m.group(4));
        ZonedDateTime result = m.group(2).equals("+") ? start.plus(delta) : start.minus(delta);
        return timestamp(DateTimeSupport.format(result));
    }

    HandlerResult zoneConversion(String expr, String lower) {
        Matcher m = ZONE_CONVERSION.matcher(lower);
        if (!m.matches() || !TimezoneDirectory.isAbbreviation(m.group(2))) {
            return HandlerResult.notMine();
        }
        Optional<ZoneId> to = TimezoneDirectory.lookup(m.group(3));
        if (to.isEmpty()) {
            return HandlerResult.notMine();
        }
        Optional<ZonedDateTime> source = DateTimeSupport.parseDateTime(m.group(1) + " " + m.group(2), zone, clock);
        if (source.isEmpty()) {
            return HandlerResult.notMine();
        }
        return timestamp(DateTimeSupport.format(source.get().withZoneSameInstant(to.get())));
    }

    HandlerResult dateRange(String expr, String lower) {
        Matcher m = DATE_RANGE.matcher(lower);
        if (!m.matches()) {
            return HandlerResult.notMine();
        }
        Optional<LocalDate> start = DateTimeSupport.parseDate(m.group(1), zone, clock);
        Optional<LocalDate> end = DateTimeSupport.parseDate(m.group(2), zone, clock);
        if (start.isEmpty() || end.isEmpty()) {
            return HandlerResult.notMine();
        }
        LocalDate to = end.get();
        // "dec 6 till march 11" runs into next year
        if (to.isBefore(start.get())) {
            to = to.plusYears(1);
        }
        long days = ChronoUnit.DAYS.between(start.get(), to);
        return HandlerResult.claimed(days + (days == 1 ? " day" : " days"));
    }

    HandlerResult durationMultiplication(String expr, String lower) {
        Matcher m = COUNT_TIMES_DURATION.matcher(lower);
        if (m.matches()) {
            return multiply(Double.parseDouble(m.group(1)), Double.parseDouble(m.group(2)), m.group(3));
        }
        m = DURATION_TIMES_COUNT.matcher(lower);
        if (m.matches()) {
            return multiply(Double.parseDouble(m.group(3)), Double.parseDouble(m.group(1)), m.group(2));
        }
        return HandlerResult.notMine();
    }

    private static HandlerResult multiply(double count, double amount, String unit) {
        return HandlerResult.claimed(DateTimeSupport.formatDuration(DateTimeSupport.toDuration(count * amount, unit)));
    }
}
