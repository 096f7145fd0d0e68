package com.linecalc.app.models;

import java.util.List;

/**
 * Read-only snapshot of a document returned by the HTTP API.
 */
public class DocumentView {
    private final long id;
    private final long version;
    private final String text;
    private final List<LineRecord> lines;

    public DocumentView(long id, long version, String text, List<LineRecord> lines) {
        this.id = id;
        this.version = version;
        this.text = text;
        this.lines = lines;
    }

    public long getId() {
        return id;
    }

    public long getVersion() {
        return version;
    }

    public String getText() {
        return text;
    }

    public List<LineRecord> getLines() {
        return lines;
    }
}
