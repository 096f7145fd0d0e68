package com.linecalc.app.models;

/**
 * Intermediate parser value. The percent flag survives only while the value
 * is still a bare percent literal, so that "A + P%" can apply P to A.
 */
public final class Value {
    private final double number;
    private final boolean percent;

    public Value(double number, boolean percent) {
        this.number = number;
        this.percent = percent;
    }

    public static Value of(double number) {
        return new Value(number, false);
    }

    public double getNumber() {
        return number;
    }

    public boolean isPercent() {
        return percent;
    }
}
