package com.linecalc.app.evaluators;

/**
 * What a domain evaluator hands back to dispatch for a successful line.
 * The text may span several lines; the orchestrator turns the extra ones
 * into "> " continuation lines.
 */
public final class DomainResult {

    private final String text;
    private final boolean hasValue;
    private final double value;
    private final boolean currency;
    private final String dateTimeRef;

    private DomainResult(String text, boolean hasValue, double value, boolean currency, String dateTimeRef) {
        this.text = text;
        this.hasValue = hasValue;
        this.value = value;
        this.currency = currency;
        this.dateTimeRef = dateTimeRef;
    }

    public static DomainResult text(String text) {
        return new DomainResult(text, false, 0, false, null);
    }

    public static DomainResult numeric(String text, double value, boolean currency) {
        return new DomainResult(text, true, value, currency, null);
    }

    public static DomainResult dateTime(String text) {
        return new DomainResult(text, false, 0, false, text);
    }

    public String getText() {
        return text;
    }

    public boolean hasValue() {
        return hasValue;
    }

    public double getValue() {
        return value;
    }

    public boolean isCurrency() {
        return currency;
    }

    public boolean isDateTime() {
        return dateTimeRef != null;
    }

    public String getDateTimeRef() {
        return dateTimeRef;
    }
}
