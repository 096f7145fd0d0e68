package com.linecalc.app.controllers;

import com.linecalc.app.models.DocumentView;
import com.linecalc.app.services.DocumentService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST endpoints for stored calculation documents.
 * "/document" is the base path.
 */
@RestController
@RequestMapping("/document")
public class DocumentController {

    @Autowired
    private DocumentService documentService;

    /**
     * POST /document
     * Body: { "text": "..." }. Creates and evaluates a document, returns its ID.
     */
    @PostMapping
    public ResponseEntity<Long> createDocument(@RequestBody Map<String, String> request) {
        long id = documentService.createDocument(request.get("text"));
        return ResponseEntity.ok(id);
    }

    /**
     * PUT /document/{id}?activeLine=N
     * Body: the edited text as text/plain. References are renumbered against
     * the stored text before evaluation.
     */
    @PutMapping(value = "/{id}", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<DocumentView> updateDocument(
            @PathVariable long id,
            @RequestParam(defaultValue = "0") int activeLine,
            @RequestBody(required = false) String text
    ) {
        return ResponseEntity.ok(documentService.updateText(id, text, activeLine));
    }

    /**
     * GET /document/{id}
     * Returns the evaluated text and one record per line.
     */
    @GetMapping("/{id}")
    public ResponseEntity<DocumentView> getDocument(@PathVariable long id) {
        return ResponseEntity.ok(documentService.getView(id));
    }

    /**
     * GET /document/{id}/dependents/{line}
     * Lines referencing 'line'; with transitive=true, everything downstream of it.
     */
    @GetMapping("/{id}/dependents/{line}")
    public ResponseEntity<List<Integer>> getDependents(
            @PathVariable long id,
            @PathVariable int line,
            @RequestParam(defaultValue = "false") boolean transitive
    ) {
        return ResponseEntity.ok(documentService.dependents(id, line, transitive));
    }

    /**
     * GET /document/{id}/forwardDependencies
     * For each line, the lines it references.
     */
    @GetMapping("/{id}/forwardDependencies")
    public ResponseEntity<Map<Integer, Set<Integer>>> getForwardDependencyGraph(@PathVariable long id) {
        return ResponseEntity.ok(documentService.forwardDependencies(id));
    }

    /**
     * GET /document/{id}/reverseDependencies
     * For each line, the lines that reference it.
     */
    @GetMapping("/{id}/reverseDependencies")
    public ResponseEntity<Map<Integer, Set<Integer>>> getReverseDependencyGraph(@PathVariable long id) {
        return ResponseEntity.ok(documentService.reverseDependencies(id));
    }

    /**
     * GET /document/{id}/inlined
     * The text with "\N" references replaced by their values.
     */
    @GetMapping("/{id}/inlined")
    public ResponseEntity<Map<String, String>> getInlined(@PathVariable long id) {
        return ResponseEntity.ok(Map.of("text", documentService.inlineReferences(id)));
    }
}
