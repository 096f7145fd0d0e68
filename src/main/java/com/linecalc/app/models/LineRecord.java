package com.linecalc.app.models;

/**
 * Output record for one document line: { lineNumber, input, output }.
 */
public class LineRecord {
    private int lineNumber;
    private String input;
    private String output;

    // Default constructor needed for JSON (de)serialization
    public LineRecord() {
    }

    public LineRecord(int lineNumber, String input, String output) {
        this.lineNumber = lineNumber;
        this.input = input;
        this.output = output;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public String getInput() {
        return input;
    }

    public String getOutput() {
        return output;
    }

    public void setLineNumber(int lineNumber) {
        this.lineNumber = lineNumber;
    }

    public void setInput(String input) {
        this.input = input;
    }

    public void setOutput(String output) {
        this.output = output;
    }
}
