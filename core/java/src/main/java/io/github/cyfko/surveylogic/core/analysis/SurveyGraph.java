package io.github.cyfko.surveylogic.core.analysis;

import io.github.cyfko.surveylogic.core.model.Transition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Directed multigraph of survey transitions.
 * <p>
 * Nodes are state ids as they appear in transitions, declared or not. One edge is kept
 * per transition, so parallel transitions between the same two states count towards
 * {@link #outDegree(String)}. Source nodes are kept in the order of their first outgoing
 * transition, which makes every traversal deterministic.
 * </p>
 * <p>
 * All traversals use explicit stacks.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class SurveyGraph {

    private final Map<String, List<String>> forward = new LinkedHashMap<>();
    private final Map<String, List<String>> reverse = new LinkedHashMap<>();

    private SurveyGraph() {}

    /**
     * Builds the graph of a list of transitions.
     *
     * @param transitions the transitions, in declaration order
     * @return the graph
     */
    public static SurveyGraph of(List<Transition> transitions) {
        Objects.requireNonNull(transitions, "Transitions cannot be null");

        SurveyGraph graph = new SurveyGraph();
        for (Transition t : transitions) {
            graph.forward.computeIfAbsent(t.fromState(), k -> new ArrayList<>()).add(t.toState());
            graph.reverse.computeIfAbsent(t.toState(), k -> new ArrayList<>()).add(t.fromState());
        }
        return graph;
    }

    /** Nodes with at least one outgoing edge, in first-appearance order. */
    public Set<String> sourceNodes() {
        return Collections.unmodifiableSet(forward.keySet());
    }

    /** Distinct direct successors, in edge order. */
    public List<String> successors(String node) {
        return List.copyOf(new LinkedHashSet<>(forward.getOrDefault(node, List.of())));
    }

    /** Distinct direct predecessors, in edge order. */
    public List<String> predecessors(String node) {
        return List.copyOf(new LinkedHashSet<>(reverse.getOrDefault(node, List.of())));
    }

    public int outDegree(String node) {
        return forward.getOrDefault(node, List.of()).size();
    }

    /** Out-degree of every source node, in {@link #sourceNodes()} order. */
    public Map<String, Integer> outDegrees() {
        Map<String, Integer> degrees = new LinkedHashMap<>();
        forward.forEach((node, targets) -> degrees.put(node, targets.size()));
        return Collections.unmodifiableMap(degrees);
    }

    /**
     * Collects every node reachable from {@code start}, {@code start} included.
     *
     * @param start the root node, which need not appear in the graph
     * @return the reachable nodes
     */
    public Set<String> reachableFrom(String start) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(start);

        while (!stack.isEmpty()) {
            String node = stack.pop();
            if (!visited.add(node)) {
                continue;
            }
            for (String next : forward.getOrDefault(node, List.of())) {
                if (!visited.contains(next)) {
                    stack.push(next);
                }
            }
        }
        return visited;
    }

    /**
     * Looks for a cycle with a depth-first search started from each unvisited source node in
     * turn, stopping at the first back edge.
     *
     * @return the cycle path with its first node repeated at the end
     *         (e.g. {@code [S1, S2, S1]}), or an empty list if the graph is acyclic
     */
    public List<String> findCycle() {
        Set<String> visited = new HashSet<>();

        for (String root : forward.keySet()) {
            if (visited.contains(root)) {
                continue;
            }

            // path holds the DFS recursion stack, cursors the next edge index per path entry
            List<String> path = new ArrayList<>();
            Set<String> onPath = new HashSet<>();
            Deque<int[]> cursors = new ArrayDeque<>();

            visited.add(root);
            path.add(root);
            onPath.add(root);
            cursors.push(new int[]{0});

            while (!path.isEmpty()) {
                String node = path.get(path.size() - 1);
                List<String> targets = forward.getOrDefault(node, List.of());
                int[] cursor = cursors.peek();

                if (cursor[0] >= targets.size()) {
                    path.remove(path.size() - 1);
                    onPath.remove(node);
                    cursors.pop();
                    continue;
                }

                String next = targets.get(cursor[0]++);
                if (onPath.contains(next)) {
                    List<String> cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                    cycle.add(next);
                    return List.copyOf(cycle);
                }
                if (visited.add(next)) {
                    path.add(next);
                    onPath.add(next);
                    cursors.push(new int[]{0});
                }
            }
        }
        return List.of();
    }
}
