package com.herzen.unlock.validation;

import com.herzen.unlock.domain.DomainModels.Dependency;
import com.herzen.unlock.domain.DomainModels.EdgeKind;
import com.herzen.unlock.domain.DomainModels.Unit;
import org.springframework.stereotype.Component;

import java.util.*;

@Component
public class GraphIntegrityValidator {

    public List<Diagnostic> validate(Map<String, Unit> nodes, List<Dependency> edges) {
        List<Diagnostic> issues = new ArrayList<>();

        for (Dependency edge : edges) {
            if (!nodes.containsKey(edge.fromId()) || !nodes.containsKey(edge.toId())) {
                issues.add(Diagnostic.of(DiagnosticType.GRAPH_INTEGRITY_WARNING, edge.fromId() + "->" + edge.toId(),
                        "Edge references a unit missing from the node set"));
            }
        }

        Map<String, List<String>> adj = new LinkedHashMap<>();
        nodes.keySet().forEach(id -> adj.put(id, new ArrayList<>()));
        edges.stream()
                .filter(e -> e.kind() == EdgeKind.ACTIVATION)
                .forEach(e -> adj.computeIfAbsent(e.fromId(), k -> new ArrayList<>()).add(e.toId()));

        Deque<String> visiting = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        Set<Set<String>> reported = new HashSet<>();
        for (String node : adj.keySet()) {
            findCycles(node, adj, visiting, visited, reported, issues);
        }
        return issues;
    }

    private void findCycles(String node, Map<String, List<String>> adj, Deque<String> visiting,
                            Set<String> visited, Set<Set<String>> reported, List<Diagnostic> issues) {
        if (visited.contains(node)) return;

        visiting.addLast(node);
        for (String next : adj.getOrDefault(node, List.of())) {
            if (visiting.contains(next)) {
                List<String> cycle = cyclePath(visiting, next);
                if (reported.add(new HashSet<>(cycle))) {
                    issues.add(Diagnostic.of(DiagnosticType.GRAPH_INTEGRITY_WARNING, next,
                            "Cycle detected in activation edges: " + String.join(" -> ", cycle) + " -> " + next));
                }
            } else {
                findCycles(next, adj, visiting, visited, reported, issues);
            }
        }
        visiting.removeLast();
        visited.add(node);
    }

    private List<String> cyclePath(Deque<String> visiting, String start) {
        List<String> path = new ArrayList<>();
        boolean inCycle = false;
        for (String id : visiting) {
            if (id.equals(start)) inCycle = true;
            if (inCycle) path.add(id);
        }
        return path;
    }
}
