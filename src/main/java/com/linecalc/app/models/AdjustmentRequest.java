package com.linecalc.app.models;

/**
 * Body of POST /references/adjust: document text before and after one edit.
 */
public class AdjustmentRequest {
    private String oldText;
    private String newText;

    public AdjustmentRequest() {
    }

    public AdjustmentRequest(String oldText, String newText) {
        this.oldText = oldText;
        this.newText = newText;
    }

    public String getOldText() {
        return oldText;
    }

    public String getNewText() {
        return newText;
    }

    public void setOldText(String oldText) {
        this.oldText = oldText;
    }

    public void setNewText(String newText) {
        this.newText = newText;
    }
}
