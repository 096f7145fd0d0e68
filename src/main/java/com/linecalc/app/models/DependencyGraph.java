package com.linecalc.app.models;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-to-line reference graph of a document, built from its "\N" tokens.
 * - forward: line -> lines it references
 * - reverse: line -> lines that reference it
 * Line numbers are 1-based. Used only for host-side re-render hints;
 * evaluation itself never consults it.
 */
public class DependencyGraph {

    private static final Pattern REF_PATTERN = Pattern.compile("\\\\(\\d{1,9})");

    private final Map<Integer, Set<Integer>> forward = new TreeMap<>();
    private final Map<Integer, Set<Integer>> reverse = new TreeMap<>();

    /**
     * Builds the graph for the given lines. Every line gets an entry in both maps,
     * so lines without references map to an empty set.
     */
    public static DependencyGraph fromLines(List<String> lines) {
        DependencyGraph graph = new DependencyGraph();
        for (int i = 0; i < lines.size(); i++) {
            int lineNumber = i + 1;
            graph.forward.putIfAbsent(lineNumber, new TreeSet<>());
            graph.reverse.putIfAbsent(lineNumber, new TreeSet<>());
            Matcher matcher = REF_PATTERN.matcher(lines.get(i));
            while (matcher.find()) {
                graph.addDependency(lineNumber, Integer.parseInt(matcher.group(1)));
            }
        }
        return graph;
    }

    /**
     * Adds a reference from 'source' -> 'target' in the forward graph,
     * and the reverse edge 'target' -> 'source'.
     */
    public void addDependency(int source, int target) {
        forward.computeIfAbsent(source, k -> new TreeSet<>()).add(target);
        forward.putIfAbsent(target, new TreeSet<>());

        reverse.computeIfAbsent(target, k -> new TreeSet<>()).add(source);
        reverse.putIfAbsent(source, new TreeSet<>());
    }

    /**
     * Lines that reference 'line' directly (one hop), ascending.
     */
    public List<Integer> directDependents(int line) {
        return new ArrayList<>(reverse.getOrDefault(line, Collections.emptySet()));
    }

    /**
     * All lines that reach 'line' through one or more references, ascending.
     * Breadth-first over the reverse adjacency.
     */
    public List<Integer> transitiveDependents(int line) {
        Queue<Integer> queue = new LinkedList<>();
        Set<Integer> visited = new HashSet<>();
        Set<Integer> result = new TreeSet<>();
        queue.add(line);
        visited.add(line);

        while (!queue.isEmpty()) {
            int current = queue.poll();
            for (int child : reverse.getOrDefault(current, Collections.emptySet())) {
                if (visited.add(child)) {
                    result.add(child);
                    queue.add(child);
                }
            }
        }
        return new ArrayList<>(result);
    }

    public Map<Integer, Set<Integer>> getForwardGraph() {
        return forward;
    }

    public Map<Integer, Set<Integer>> getReverseGraph() {
        return reverse;
    }
}
