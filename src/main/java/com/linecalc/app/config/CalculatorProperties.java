package com.linecalc.app.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings under the "linecalc" prefix.
 */
@ConfigurationProperties(prefix = "linecalc")
public class CalculatorProperties {

    /**
     * Largest document, in lines, the service accepts.
     */
    private int maxLines = 5000;

    /**
     * Zone for "now" and "today"; blank means the system zone.
     */
    private String timeZone = "";

    private final Format format = new Format();

    public int getMaxLines() {
        return maxLines;
    }

    public void setMaxLines(int maxLines) {
        this.maxLines = maxLines;
    }

    public String getTimeZone() {
        return timeZone;
    }

    public void setTimeZone(String timeZone) {
        this.timeZone = timeZone;
    }

    public Format getFormat() {
        return format;
    }

    public static class Format {

        /**
         * Maximum fractional digits for plain numbers.
         */
        private int plainFractionDigits = 10;

        public int getPlainFractionDigits() {
            return plainFractionDigits;
        }

        public void setPlainFractionDigits(int plainFractionDigits) {
            this.plainFractionDigits = plainFractionDigits;
        }
    }
}
