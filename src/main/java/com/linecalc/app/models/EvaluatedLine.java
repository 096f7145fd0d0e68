package com.linecalc.app.models;

/**
 * Per-pass state of one document line.
 * Created once by the orchestrator at the line's own index; never mutated
 * after the pass moves on to the next line.
 */
public class EvaluatedLine {
    private final String input;
    private final String output;
    private final double value;
    private final boolean hasResult;
    private final boolean hasValue;
    private final boolean currency;
    private final boolean dateTime;
    private final String dateTimeRef;

    private EvaluatedLine(String input, String output, double value, boolean hasResult, boolean hasValue,
                          boolean currency, boolean dateTime, String dateTimeRef) {
        this.input = input;
        this.output = output;
        this.value = value;
        this.hasResult = hasResult;
        this.hasValue = hasValue;
        this.currency = currency;
        this.dateTime = dateTime;
        this.dateTimeRef = dateTimeRef;
    }

    /**
     * A line that was not evaluated (blank, comment, pending) or that failed.
     */
    public static EvaluatedLine unevaluated(String input, String output) {
        return new EvaluatedLine(input, output, 0, false, false, false, false, null);
    }

    public static EvaluatedLine text(String input, String output) {
        return new EvaluatedLine(input, output, 0, true, false, false, false, null);
    }

    public static EvaluatedLine numeric(String input, String output, double value, boolean currency) {
        return new EvaluatedLine(input, output, value, true, true, currency, false, null);
    }

    public static EvaluatedLine dateTime(String input, String output, String dateTimeRef) {
        return new EvaluatedLine(input, output, 0, true, false, false, true, dateTimeRef);
    }

    public String getInput() {
        return input;
    }

    public String getOutput() {
        return output;
    }

    public double getValue() {
        return value;
    }

    public boolean hasResult() {
        return hasResult;
    }

    /**
     * True when arithmetic references may read {@link #getValue()}.
     */
    public boolean hasValue() {
        return hasValue;
    }

    public boolean isCurrency() {
        return currency;
    }

    public boolean isDateTime() {
        return dateTime;
    }

    public String getDateTimeRef() {
        return dateTimeRef;
    }
}
