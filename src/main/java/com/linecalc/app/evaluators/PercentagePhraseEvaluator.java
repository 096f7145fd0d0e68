package com.linecalc.app.evaluators;

import com.linecalc.app.engine.ResultFormatter;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Percentages written as English phrases, e.g. "what is 15% of 200",
 * "increase 100 by 20%", "tip 20% on $85.50", "$150 split 4 ways".
 */
public class PercentagePhraseEvaluator extends HandlerChainEvaluator {

    private static final String NUM = "(\\d+(?:\\.\\d+)?)";

    private static final Pattern PERCENT_OF = Pattern.compile(
            "(?:what\\s+is\\s+)?" + NUM + "\\s*%?\\s+of\\s+" + NUM);
    private static final Pattern WHAT_PERCENT = Pattern.compile(
            NUM + "\\s+is\\s+what\\s+(?:%|percent|percentage)\\s+of\\s+" + NUM);
    private static final Pattern INCREASE = Pattern.compile("increase\\s+" + NUM + "\\s+by\\s+" + NUM + "\\s*%");
    private static final Pattern INCREASED = Pattern.compile(NUM + "\\s+increased\\s+by\\s+" + NUM + "\\s*%");
    private static final Pattern DECREASE = Pattern.compile("decrease\\s+" + NUM + "\\s+by\\s+" + NUM + "\\s*%");
    private static final Pattern DECREASED = Pattern.compile(NUM + "\\s+decreased\\s+by\\s+" + NUM + "\\s*%");
    private static final Pattern PERCENT_CHANGE = Pattern.compile(
            "percent(?:age)?\\s+change\\s+(?:from\\s+)?" + NUM + "\\s+to\\s+" + NUM);
    private static final Pattern TIP = Pattern.compile(
            "(?:tip\\s+)?" + NUM + "\\s*%\\s*(?:tip\\s+)?on\\s+\\$?" + NUM);
    private static final Pattern SPLIT = Pattern.compile(
            "\\$?" + NUM + "\\s+split\\s+(\\d{1,9})\\s+ways?(?:\\s+with\\s+" + NUM + "\\s*%\\s*tip)?");
    private static final Pattern SPLIT_PREFIX = Pattern.compile(
            "split\\s+\\$?" + NUM + "\\s+(\\d{1,9})\\s+ways?(?:\\s+with\\s+" + NUM + "\\s*%\\s*tip)?");

    private static final List<Pattern> PREFILTER = List.of(
            Pattern.compile("what\\s+is\\s+[\\d.]+%?\\s+of"),
            Pattern.compile("[\\d.]+%\\s+of\\s+[\\d.]"),
            Pattern.compile("[\\d.]+\\s+is\\s+what\\s+(?:%|percent|percentage)"),
            Pattern.compile("increased?\\s+(?:[\\d.]+\\s+)?by"),
            Pattern.compile("decreased?\\s+(?:[\\d.]+\\s+)?by"),
            Pattern.compile("percent(?:age)?\\s+change"),
            Pattern.compile("tip\\s+[\\d.]+%?\\s+on"),
            Pattern.compile("[\\d.]+%\\s*tip\\s+on"),
            Pattern.compile("split\\s+(?:\\$?[\\d.]+|\\d+\\s+ways?)"));

    private final ResultFormatter formatter;

    // decrease before increase so "decreased by" is never read as an increase
    private final List<Handler> chain = List.of(
            this::percentOf,
            this::whatPercent,
            this::decrease,
            this::increase,
            this::percentChange,
            this::tip,
            this::splitBill
    );

    public PercentagePhraseEvaluator(ResultFormatter formatter) {
        super("percentage");
        this.formatter = formatter;
    }

    @Override
    protected List<Handler> handlers() {
        return chain;
    }

    @Override
    public boolean accepts(String expr) {
        String lower = expr.toLowerCase(Locale.ROOT);
        for (Pattern p : PREFILTER) {
            if (p.matcher(lower).find()) {
                return true;
            }
        }
        return false;
    }

    private HandlerResult number(double value) {
        return HandlerResult.claimed(formatter.format(value, false), value);
    }

    private static String money(double value) {
        return String.format(Locale.ROOT, "$%.2f", value);
    }

    HandlerResult percentOf(String expr, String lower) {
        Matcher m = PERCENT_OF.matcher(lower);
        if (!m.find()) {
            return HandlerResult.notMine();
        }
        double percent = Double.parseDouble(m.group(1));
        double value = Double.parseDouble(m.group(2));
        return number(value * percent / 100);
    }

    HandlerResult whatPercent(String expr, String lower) {
        Matcher m = WHAT_PERCENT.matcher(lower);
        if (!m.find()) {
            return HandlerResult.notMine();
        }
        double part = Double.parseDouble(m.group(1));
        double whole = Double.parseDouble(m.group(2));
        if (whole == 0) {
            return HandlerResult.claimed("undefined (division by zero)");
        }
        return HandlerResult.claimed(String.format(Locale.ROOT, "%.2f%%", part / whole * 100));
    }

    HandlerResult increase(String expr, String lower) {
        Matcher m = firstMatch(lower, INCREASE, INCREASED);
        if (m == null) {
            return HandlerResult.notMine();
        }
        return number(Double.parseDouble(m.group(1)) * (1 + Double.parseDouble(m.group(2)) / 100));
    }

    HandlerResult decrease(String expr, String lower) {
        Matcher m = firstMatch(lower, DECREASE, DECREASED);
        if (m == null) {
            return HandlerResult.notMine();
        }
        return number(Double.parseDouble(m.group(1)) * (1 - Double.parseDouble(m.group(2)) / 100));
    }

    HandlerResult percentChange(String expr, String lower) {
        Matcher m = PERCENT_CHANGE.matcher(lower);
        if (!m.find()) {
            return HandlerResult.notMine();
        }
        double from = Double.parseDouble(m.group(1));
        double to = Double.parseDouble(m.group(2));
        if (from == 0) {
            return HandlerResult.claimed("undefined (division by zero)");
        }
        double change = (to - from) / from * 100;
        return HandlerResult.claimed(String.format(Locale.ROOT, "%s%.2f%%", change > 0 ? "+" : "", change));
    }

    HandlerResult tip(String expr, String lower) {
        Matcher m = TIP.matcher(lower);
        if (!m.find()) {
            return HandlerResult.notMine();
        }
        double amount = Double.parseDouble(m.group(2));
        double tip = amount * Double.parseDouble(m.group(1)) / 100;
        return HandlerResult.claimed("Tip: " + money(tip) + ", Total: " + money(amount + tip));
    }

    HandlerResult splitBill(String expr, String lower) {
        Matcher m = firstMatch(lower, SPLIT, SPLIT_PREFIX);
        if (m == null) {
            return HandlerResult.notMine();
        }
        double amount = Double.parseDouble(m.group(1));
        int ways = Integer.parseInt(m.group(2));
        if (ways == 0) {
            return HandlerResult.notMine();
        }
        double tipPercent = m.group(3) == null ? 0 : Double.parseDouble(m.group(3));
        double tip = amount * tipPercent / 100;
        double total = amount + tip;
        double perPerson = total / ways;
        if (tipPercent > 0) {
            return HandlerResult.claimed("Total: " + money(total) + " (incl. " + money(tip) + " tip), Per person: "
                    + money(perPerson));
        }
        return HandlerResult.claimed("Per person: " + money(perPerson));
    }

    private static Matcher firstMatch(String lower, Pattern... patterns) {
        for (Pattern p : patterns) {
            Matcher m = p.matcher(lower);
            if (m.find()) {
                return m;
            }
        }
        return null;
    }
}
