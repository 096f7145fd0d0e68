package com.linecalc.app.models;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of POST /evaluate: the document lines plus an optional
 * 1-based active line (0 = none).
 */
public class EvaluationRequest {
    private List<String> lines = new ArrayList<>();
    private int activeLine;

    public EvaluationRequest() {
    }

    public EvaluationRequest(List<String> lines, int activeLine) {
        this.lines = lines;
        this.activeLine = activeLine;
    }

    public List<String> getLines() {
        return lines;
    }

    public int getActiveLine() {
        return activeLine;
    }

    public void setLines(List<String> lines) {
        this.lines = lines;
    }

    public void setActiveLine(int activeLine) {
        this.activeLine = activeLine;
    }
}
