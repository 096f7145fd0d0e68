package com.linecalc.app.services;

import com.linecalc.app.engine.ResultFormatter;
import com.linecalc.app.evaluators.DomainResult;
import com.linecalc.app.evaluators.LineContext;
import com.linecalc.app.models.DependencyGraph;
import com.linecalc.app.models.EvaluatedLine;
import com.linecalc.app.models.LineRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Evaluates a whole document in one forward pass.
 *
 * Each call:
 * 1) drops stale "> " continuation lines left by the previous pass,
 * 2) evaluates every line that has a result '=', in order, through the dispatcher,
 * 3) writes each line's state once, at its own index.
 * Later lines may read earlier state through {@link LineContext}; nothing
 * is shared between calls.
 */
public class LineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(LineOrchestrator.class);

    private final DomainDispatcher dispatcher;

    public LineOrchestrator(DomainDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    /**
     * @param activeLine 1-based line being edited (display is left as typed), 0 for none
     */
    public List<EvaluatedLine> evaluateDocument(List<String> lines, int activeLine) {
        List<String> cleaned = cleanOutputLines(lines);
        PassState state = new PassState(cleaned.size());
        for (int i = 0; i < cleaned.size(); i++) {
            state.current = i + 1;
            state.results.add(evaluateLine(cleaned.get(i), i + 1 == activeLine, state));
        }
        log.debug("Evaluated {} lines ({} stale output lines dropped)", cleaned.size(), lines.size() - cleaned.size());
        return state.results;
    }

    public List<LineRecord> evaluate(List<String> lines, int activeLine) {
        return toRecords(evaluateDocument(lines, activeLine));
    }

    public static List<LineRecord> toRecords(List<EvaluatedLine> evaluated) {
        List<LineRecord> records = new ArrayList<>(evaluated.size());
        for (int i = 0; i < evaluated.size(); i++) {
            EvaluatedLine line = evaluated.get(i);
            records.add(new LineRecord(i + 1, line.getInput(), line.getOutput()));
        }
        return records;
    }

    /**
     * Joins the outputs back into document text.
     */
    public static String render(List<EvaluatedLine> evaluated) {
        List<String> outputs = new ArrayList<>(evaluated.size());
        for (EvaluatedLine line : evaluated) {
            outputs.add(line.getOutput());
        }
        return String.join("\n", outputs);
    }

    public static List<String> cleanOutputLines(List<String> lines) {
        List<String> cleaned = new ArrayList<>(lines.size());
        for (String line : lines) {
            String l = line == null ? "" : line;
            if (!LineSyntax.isContinuation(l)) {
                cleaned.add(l);
            }
        }
        return cleaned;
    }

    /**
     * Lines that reference 'changedLine' directly, numbered after stale-output cleanup.
     */
    public List<Integer> dependents(List<String> lines, int changedLine) {
        return DependencyGraph.fromLines(cleanOutputLines(lines)).directDependents(changedLine);
    }

    /**
     * Every line whose result may change when 'changedLine' changes.
     */
    public List<Integer> affectedLines(List<String> lines, int changedLine) {
        return DependencyGraph.fromLines(cleanOutputLines(lines)).transitiveDependents(changedLine);
    }

    /**
     * Formatted numeric value of every line that has one, keyed by line number.
     * Used to inline "\N" references when copying a document out.
     */
    public Map<Integer, String> referenceValues(List<String> lines, ResultFormatter formatter) {
        Map<Integer, String> values = new HashMap<>();
        List<EvaluatedLine> evaluated = evaluateDocument(lines, 0);
        for (int i = 0; i < evaluated.size(); i++) {
            EvaluatedLine line = evaluated.get(i);
            if (line.hasValue()) {
                values.put(i + 1, formatter.format(line.getValue(), line.isCurrency()));
            }
        }
        return values;
    }

    private EvaluatedLine evaluateLine(String line, boolean active, PassState state) {
        if (LineSyntax.isBlank(line) || LineSyntax.isComment(line)) {
            return EvaluatedLine.unevaluated(line, line);
        }

        int hash = LineSyntax.inlineCommentStart(line);
        String working = hash >= 0 ? line.substring(0, hash) : line;
        int eq = LineSyntax.findResultEquals(working);
        if (eq < 0) {
            return EvaluatedLine.unevaluated(line, line);
        }
        String expr = working.substring(0, eq).trim();
        if (expr.isEmpty()) {
            return EvaluatedLine.unevaluated(line, line);
        }
        String comment = hash >= 0 ? " " + line.substring(hash) : "";
        String shown = active ? expr : ExpressionFormatter.format(expr);

        Optional<DomainResult> result = dispatcher.dispatch(expr, state);
        if (result.isEmpty()) {
            return EvaluatedLine.unevaluated(expr, shown + " = ERR" + comment);
        }

        DomainResult r = result.get();
        String output = shown + " = " + withContinuations(r.getText(), comment);
        if (r.isDateTime()) {
            return EvaluatedLine.dateTime(expr, output, r.getDateTimeRef());
        }
        if (r.hasValue()) {
            return EvaluatedLine.numeric(expr, output, r.getValue(), r.isCurrency());
        }
        return EvaluatedLine.text(expr, output);
    }

    // The comment stays on the expression line; extra result lines become "> " continuations.
    private static String withContinuations(String text, String comment) {
        String[] parts = text.split("\n");
        StringBuilder out = new StringBuilder(parts[0]).append(comment);
        for (int i = 1; i < parts.length; i++) {
            out.append('\n').append(LineSyntax.CONTINUATION_PREFIX).append(parts[i]);
        }
        return out.toString();
    }

    private static final class PassState implements LineContext {
        private final List<EvaluatedLine> results;
        private int current;

        PassState(int size) {
            this.results = new ArrayList<>(size);
        }

        @Override
        public int currentLine() {
            return current;
        }

        @Override
        public EvaluatedLine priorLine(int lineNumber) {
            if (lineNumber < 1 || lineNumber >= current) {
                return null;
            }
            return results.get(lineNumber - 1);
        }
    }
}
