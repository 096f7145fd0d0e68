package com.linecalc.app.services;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keeps "\N" references pointing at the same logical line across one edit.
 *
 * Only a single contiguous insertion or deletion is recognised: the line
 * counts give the size of the edit, the first line that differs gives its
 * position. References into a deleted range are left as they are and fail
 * on the next evaluation.
 *
 * Both are measured on the lines left after dropping "> " continuation
 * output, the same numbering "\N" uses.
 */
public class ReferenceAdjuster {

    private static final Pattern REF_PATTERN = Pattern.compile("\\\\(\\d+)");
    // longer numbers cannot name a line and are left alone
    private static final int MAX_REF_DIGITS = 9;

    public String adjustReferences(String oldText, String newText) {
        String[] oldLines = LineOrchestrator.cleanOutputLines(lines(oldText)).toArray(new String[0]);
        String[] newLines = LineOrchestrator.cleanOutputLines(lines(newText)).toArray(new String[0]);

        int delta = newLines.length - oldLines.length;
        if (delta == 0) {
            return newText;
        }
        if (delta > 0) {
            return adjustForInsert(newText, firstDifference(oldLines, newLines), delta);
        }
        return adjustForDelete(newText, firstDifference(oldLines, newLines), -delta);
    }

    /**
     * 1-based number of the first line that differs; one past the shorter
     * text when one is a prefix of the other.
     */
    static int firstDifference(String[] oldLines, String[] newLines) {
        int min = Math.min(oldLines.length, newLines.length);
        for (int i = 0; i < min; i++) {
            if (!oldLines[i].equals(newLines[i])) {
                return i + 1;
            }
        }
        return min + 1;
    }

    /**
     * References to 'insertAt' or later move down by 'count'.
     */
    public String adjustForInsert(String text, int insertAt, int count) {
        return rewrite(text, n -> n >= insertAt ? n + count : n);
    }

    /**
     * References past the deleted range move up by 'count';
     * references inside it are left unchanged.
     */
    public String adjustForDelete(String text, int deleteAt, int count) {
        long end = (long) deleteAt + count;
        return rewrite(text, n -> n >= end ? n - count : n);
    }

    /**
     * Replaces each "\N" that has an entry in 'values' with that value.
     */
    public String replaceReferencesWithValues(String text, Map<Integer, String> values) {
        Matcher m = REF_PATTERN.matcher(text);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String replacement = m.group();
            if (m.group(1).length() <= MAX_REF_DIGITS) {
                replacement = values.getOrDefault(Integer.parseInt(m.group(1)), replacement);
            }
            m.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(out);
        return out.toString();
    }

    /**
     * Splits a text into lines the way the adjuster counts them.
     */
    public static List<String> lines(String text) {
        return List.of(text.split("\n", -1));
    }

    private interface Renumbering {
        long apply(long line);
    }

    private static String rewrite(String text, Renumbering renumbering) {
        Matcher m = REF_PATTERN.matcher(text);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String replacement = m.group();
            if (m.group(1).length() <= MAX_REF_DIGITS) {
                long n = Long.parseLong(m.group(1));
                long renumbered = renumbering.apply(n);
                if (renumbered != n) {
                    replacement = "\\" + renumbered;
                }
            }
            m.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(out);
        return out.toString();
    }
}
