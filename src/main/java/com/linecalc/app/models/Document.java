package com.linecalc.app.models;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Represents one calculation document held by the host:
 * - a unique ID
 * - the current text (already reference-adjusted and evaluated)
 * - a version counter, bumped on each accepted update
 * - the records produced by the last evaluation
 * - a read/write lock so only one evaluation is current per version
 */
public class Document {

    // Generates unique IDs for newly created documents
    private static final AtomicLong ID_GENERATOR = new AtomicLong(1);

    private final long id;
    private String text;
    private long version;
    private List<LineRecord> records = new ArrayList<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Document(String text) {
        this.id = ID_GENERATOR.getAndIncrement();
        this.text = text;
    }

    public long getId() {
        return id;
    }

    public String getText() {
        return text;
    }

    public long getVersion() {
        return version;
    }

    public List<LineRecord> getRecords() {
        return records;
    }

    /**
     * Replaces text and records together and bumps the version.
     * Callers hold the write lock.
     */
    public void update(String text, List<LineRecord> records) {
        this.text = text;
        this.records = records;
        this.version++;
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }
}
