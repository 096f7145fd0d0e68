package com.linecalc.app.services;

import com.linecalc.app.engine.ResultFormatter;
import com.linecalc.app.exceptions.DocumentNotFoundException;
import com.linecalc.app.exceptions.DocumentTooLargeException;
import com.linecalc.app.models.DependencyGraph;
import com.linecalc.app.models.Document;
import com.linecalc.app.models.DocumentView;
import com.linecalc.app.models.EvaluatedLine;
import com.linecalc.app.models.LineRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds documents in memory and runs every edit through
 * reference adjustment and evaluation.
 */
public class DocumentService {

    private static final Logger log = LoggerFactory.getLogger(DocumentService.class);

    // All documents live here in memory; nothing is persisted
    private final Map<Long, Document> documents = new ConcurrentHashMap<>();

    private final LineOrchestrator orchestrator;
    private final ReferenceAdjuster adjuster;
    private final ResultFormatter formatter;
    private final int maxLines;

    public DocumentService(LineOrchestrator orchestrator, ReferenceAdjuster adjuster,
                           ResultFormatter formatter, int maxLines) {
        this.orchestrator = orchestrator;
        this.adjuster = adjuster;
        this.formatter = formatter;
        this.maxLines = maxLines;
    }

    /**
     * Creates and evaluates a new document, returning its ID.
     */
    public long createDocument(String text) {
        String source = text == null ? "" : text;
        List<String> lines = checkSize(source);
        Document document = new Document(source);
        List<EvaluatedLine> evaluated = orchestrator.evaluateDocument(lines, 0);
        document.update(LineOrchestrator.render(evaluated), LineOrchestrator.toRecords(evaluated));
        documents.put(document.getId(), document);
        log.info("Created document {} with {} lines", document.getId(), lines.size());
        return document.getId();
    }

    /**
     * Retrieves a document by ID. Throws if not found.
     */
    public Document getDocument(long id) {
        Document document = documents.get(id);
        if (document == null) {
            throw new DocumentNotFoundException("Document not found: " + id);
        }
        return document;
    }

    /**
     * Applies one edit:
     * 1) renumber references against the stored text,
     * 2) evaluate the adjusted text,
     * 3) store text and records together under a new version.
     * Runs under the document's write lock so only one evaluation is current per version.
     */
    public DocumentView updateText(long id, String newText, int activeLine) {
        Document document = getDocument(id);
        String source = newText == null ? "" : newText;
        checkSize(source);

        document.getLock().writeLock().lock();
        try {
            String adjusted = adjuster.adjustReferences(document.getText(), source);
            List<EvaluatedLine> evaluated = orchestrator.evaluateDocument(ReferenceAdjuster.lines(adjusted), activeLine);
            document.update(LineOrchestrator.render(evaluated), LineOrchestrator.toRecords(evaluated));
            log.debug("Document {} now at version {}", id, document.getVersion());
            return view(document);
        } finally {
            document.getLock().writeLock().unlock();
        }
    }

    public DocumentView getView(long id) {
        Document document = getDocument(id);
        document.getLock().readLock().lock();
        try {
            return view(document);
        } finally {
            document.getLock().readLock().unlock();
        }
    }

    /**
     * Lines to re-render after 'line' changed: one hop, or the full closure when 'transitive'.
     */
    public List<Integer> dependents(long id, int line, boolean transitive) {
        List<String> lines = currentLines(id);
        return transitive ? orchestrator.affectedLines(lines, line) : orchestrator.dependents(lines, line);
    }

    public Map<Integer, Set<Integer>> forwardDependencies(long id) {
        return DependencyGraph.fromLines(LineOrchestrator.cleanOutputLines(currentLines(id))).getForwardGraph();
    }

    public Map<Integer, Set<Integer>> reverseDependencies(long id) {
        return DependencyGraph.fromLines(LineOrchestrator.cleanOutputLines(currentLines(id))).getReverseGraph();
    }

    /**
     * Document text with every resolvable "\N" replaced by that line's value.
     */
    public String inlineReferences(long id) {
        List<String> lines = currentLines(id);
        String text = String.join("\n", lines);
        return adjuster.replaceReferencesWithValues(text, orchestrator.referenceValues(lines, formatter));
    }

    /**
     * Stateless evaluation, no document stored.
     */
    public List<LineRecord> evaluate(List<String> lines, int activeLine) {
        if (lines.size() > maxLines) {
            throw new DocumentTooLargeException("Document has " + lines.size() + " lines, limit is " + maxLines);
        }
        return orchestrator.evaluate(lines, activeLine);
    }

    public String adjustReferences(String oldText, String newText) {
        if (oldText == null || newText == null) {
            throw new IllegalArgumentException("oldText and newText are required");
        }
        return adjuster.adjustReferences(oldText, newText);
    }

    private List<String> currentLines(long id) {
        Document document = getDocument(id);
        document.getLock().readLock().lock();
        try {
            return ReferenceAdjuster.lines(document.getText());
        } finally {
            document.getLock().readLock().unlock();
        }
    }

    private List<String> checkSize(String text) {
        List<String> lines = ReferenceAdjuster.lines(text);
        if (lines.size() > maxLines) {
            throw new DocumentTooLargeException("Document has " + lines.size() + " lines, limit is " + maxLines);
        }
        return lines;
    }

    private static DocumentView view(Document document) {
        return new DocumentView(document.getId(), document.getVersion(), document.getText(), document.getRecords());
    }
}
