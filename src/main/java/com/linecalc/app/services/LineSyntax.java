package com.linecalc.app.services;

/**
 * Single-line text rules: where the result separator is, what counts as
 * a comment or a continuation line, and how to strip a computed result.
 */
public final class LineSyntax {

    public static final String CONTINUATION_PREFIX = "> ";

    private LineSyntax() {
    }

    /**
     * Index of the '=' that separates expression from result: the last '='
     * preceded by a space and not part of >=, <=, == or !=. Returns -1 if none.
     */
    public static int findResultEquals(String s) {
        for (int i = s.length() - 1; i >= 0; i--) {
            if (s.charAt(i) != '=') {
                continue;
            }
            if (i == 0) {
                return i;
            }
            char prev = s.charAt(i - 1);
            if (prev == '>' || prev == '<' || prev == '=' || prev == '!') {
                continue;
            }
            if (i + 1 < s.length() && s.charAt(i + 1) == '=') {
                continue;
            }
            if (prev != ' ') {
                continue;
            }
            return i;
        }
        return -1;
    }

    public static boolean isBlank(String line) {
        return line.trim().isEmpty();
    }

    public static boolean isComment(String line) {
        return line.stripLeading().startsWith("#");
    }

    /**
     * Output line of an earlier multi-line result; regenerated on every pass.
     */
    public static boolean isContinuation(String line) {
        String t = line.trim();
        return t.equals(">") || line.stripLeading().startsWith(CONTINUATION_PREFIX);
    }

    /**
     * Start of an inline comment, or -1.
     */
    public static int inlineCommentStart(String line) {
        return line.indexOf('#');
    }

    /**
     * "2 + 3 = 5 # note" becomes "2 + 3 = # note"; "2 + 3 = 5" becomes "2 + 3 =".
     */
    public static String stripResult(String line) {
        int hash = inlineCommentStart(line);
        String working = hash >= 0 ? line.substring(0, hash) : line;
        int eq = findResultEquals(working);
        if (eq < 0) {
            return line;
        }
        String head = line.substring(0, eq + 1);
        if (hash >= 0) {
            return head + " " + line.substring(hash);
        }
        return head;
    }

    /**
     * True when something other than whitespace or a comment follows the result '='.
     */
    public static boolean hasResult(String line) {
        int hash = inlineCommentStart(line);
        String working = hash >= 0 ? line.substring(0, hash) : line;
        int eq = findResultEquals(working);
        return eq >= 0 && !working.substring(eq + 1).trim().isEmpty();
    }
}
