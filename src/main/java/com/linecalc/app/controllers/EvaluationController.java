package com.linecalc.app.controllers;

import com.linecalc.app.models.AdjustmentRequest;
import com.linecalc.app.models.EvaluationRequest;
import com.linecalc.app.models.LineRecord;
import com.linecalc.app.services.DocumentService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Stateless engine endpoints: nothing is stored.
 */
@RestController
public class EvaluationController {

    @Autowired
    private DocumentService documentService;

    /**
     * POST /evaluate
     * Body: { "lines": [...], "activeLine": n }. Returns one record per line
     * left after stale-output cleanup.
     */
    @PostMapping("/evaluate")
    public ResponseEntity<List<LineRecord>> evaluate(@RequestBody EvaluationRequest request) {
        List<String> lines = request.getLines() == null ? List.of() : request.getLines();
        return ResponseEntity.ok(documentService.evaluate(lines, request.getActiveLine()));
    }

    /**
     * POST /references/adjust
     * Body: { "oldText", "newText" }. Returns { "text": adjusted newText }.
     */
    @PostMapping("/references/adjust")
    public ResponseEntity<Map<String, String>> adjust(@RequestBody AdjustmentRequest request) {
        String text = documentService.adjustReferences(request.getOldText(), request.getNewText());
        return ResponseEntity.ok(Map.of("text", text));
    }
}
