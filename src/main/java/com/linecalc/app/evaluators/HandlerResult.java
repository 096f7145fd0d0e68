package com.linecalc.app.evaluators;

/**
 * Outcome of one handler: either it claimed the expression and produced text
 * (optionally with a number later lines may reference), or it is not its phrasing.
 */
public final class HandlerResult {

    private static final HandlerResult NOT_MINE = new HandlerResult(false, null, null);

    private final boolean claimed;
    private final String text;
    private final Double value;

    private HandlerResult(boolean claimed, String text, Double value) {
        this.claimed = claimed;
        this.text = text;
        this.value = value;
    }

    public static HandlerResult claimed(String text) {
        return new HandlerResult(true, text, null);
    }

    public static HandlerResult claimed(String text, double value) {
        return new HandlerResult(true, text, value);
    }

    public static HandlerResult notMine() {
        return NOT_MINE;
    }

    public boolean isClaimed() {
        return claimed;
    }

    public String getText() {
        return text;
    }

    /**
     * Numeric value of the claim, or null when the result is text only.
     */
    public Double getValue() {
        return value;
    }
}
