package com.linecalc.app.evaluators;

import com.linecalc.app.models.EvaluatedLine;

/**
 * Read-only view of the current evaluation pass, as seen from one line.
 */
public interface LineContext {

    /**
     * 1-based number of the line being evaluated.
     */
    int currentLine();

    /**
     * State of an already evaluated line, or null when 'lineNumber' is not
     * strictly before the current line (self and forward references).
     */
    EvaluatedLine priorLine(int lineNumber);
}
