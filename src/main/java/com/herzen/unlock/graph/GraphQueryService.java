package com.herzen.unlock.graph;

import com.herzen.unlock.config.UnlockGraphProperties;
import com.herzen.unlock.domain.DomainModels.Dependency;
import com.herzen.unlock.domain.DomainModels.EdgeKey;
import com.herzen.unlock.domain.DomainModels.EdgeKind;
import com.herzen.unlock.domain.DomainModels.Unit;
import com.herzen.unlock.domain.DomainModels.UnitKind;
import com.herzen.unlock.graph.DependencyGraphModels.Focus;
import com.herzen.unlock.graph.DependencyGraphModels.Graph;
import com.herzen.unlock.graph.DependencyGraphModels.Traversal;
import com.herzen.unlock.validation.Diagnostic;
import com.herzen.unlock.validation.DiagnosticType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
public class GraphQueryService {
    private final UnlockGraphProperties properties;

    public GraphQueryService(UnlockGraphProperties properties) {
        this.properties = properties;
    }

    public Graph filterByObjectives(Graph graph, Collection<String> objectiveIds) {
        Set<String> selected = objectiveIds == null ? Set.of() : objectiveIds.stream()
                .filter(id -> id != null && !id.isBlank())
                .map(String::trim)
                .collect(Collectors.toSet());
        if (selected.isEmpty()) return Graph.empty(graph.moduleId());

        Map<String, Unit> nodes = new LinkedHashMap<>();
        graph.nodes().forEach((id, unit) -> {
            boolean sameModule = graph.moduleId() == null || graph.moduleId().equals(unit.moduleId());
            if (sameModule && selected.contains(unit.owningObjectiveId())) {
                nodes.put(id, unit);
            }
        });
        List<Dependency> edges = graph.edges().stream()
                .filter(e -> nodes.containsKey(e.fromId()) && nodes.containsKey(e.toId()))
                .toList();
        return new Graph(graph.moduleId(), nodes, edges);
    }

    public Traversal ancestors(Graph graph, String unitId) {
        return ancestors(graph, unitId, properties.objectiveBridging());
    }

    public Traversal ancestors(Graph graph, String unitId, boolean objectiveBridging) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        if (!graph.nodes().containsKey(unitId)) {
            return unknownUnit(unitId, diagnostics);
        }
        Map<String, List<Dependency>> incoming = index(graph, Dependency::toId);

        Set<String> visited = new LinkedHashSet<>(List.of(unitId));
        Set<String> bridged = new HashSet<>();
        List<Dependency> bridgedEdges = new ArrayList<>();
        Deque<String> queue = new ArrayDeque<>(List.of(unitId));
        if (objectiveBridging) {
            bridge(graph, unitId, unitId, bridged, bridgedEdges, visited, queue);
        }

        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (Dependency edge : incoming.getOrDefault(current, List.of())) {
                String parent = edge.fromId();
                if (visited.add(parent)) {
                    queue.add(parent);
                    if (objectiveBridging) {
                        bridge(graph, unitId, parent, bridged, bridgedEdges, visited, queue);
                    }
                }
            }
        }
        diagnostics.addAll(cycles(visited, incoming, Dependency::fromId, "ancestors"));

        visited.remove(unitId);
        return new Traversal(unitId, visited, bridgedEdges, diagnostics);
    }

    public Traversal descendants(Graph graph, String unitId) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        if (!graph.nodes().containsKey(unitId)) {
            return unknownUnit(unitId, diagnostics);
        }
        Map<String, List<Dependency>> outgoing = index(graph, Dependency::fromId);

        Set<String> visited = new LinkedHashSet<>(List.of(unitId));
        Deque<String> queue = new ArrayDeque<>(List.of(unitId));
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (Dependency edge : outgoing.getOrDefault(current, List.of())) {
                if (visited.add(edge.toId())) {
                    queue.add(edge.toId());
                }
            }
        }
        diagnostics.addAll(cycles(visited, outgoing, Dependency::toId, "descendants"));

        visited.remove(unitId);
        return new Traversal(unitId, visited, List.of(), diagnostics);
    }

    public Focus focusNeighborhood(Graph graph, String unitId) {
        if (!graph.nodes().containsKey(unitId)) {
            Traversal unknown = unknownUnit(unitId, new ArrayList<>());
            return new Focus(unitId, Set.of(), List.of(), unknown.diagnostics());
        }
        Traversal up = ancestors(graph, unitId);
        Traversal down = descendants(graph, unitId);

        Set<String> highlighted = new LinkedHashSet<>();
        highlighted.add(unitId);
        highlighted.addAll(up.unitIds());
        highlighted.addAll(down.unitIds());

        List<Dependency> edges = new ArrayList<>();
        graph.edges().stream()
                .filter(e -> highlighted.contains(e.fromId()) && highlighted.contains(e.toId()))
                .forEach(edges::add);
        Set<EdgeKey> direct = edges.stream().map(Dependency::key).collect(Collectors.toSet());
        up.bridgedEdges().stream()
                .filter(e -> !direct.contains(e.key()))
                .forEach(edges::add);

        List<Diagnostic> diagnostics = new ArrayList<>(up.diagnostics());
        diagnostics.addAll(down.diagnostics());
        log.debug("Focus on {} in module {}: {} units, {} edges", unitId, graph.moduleId(), highlighted.size(), edges.size());
        return new Focus(unitId, highlighted, edges, diagnostics);
    }

    private void bridge(Graph graph, String startId, String activityId, Set<String> bridged, List<Dependency> bridgedEdges,
                        Set<String> visited, Deque<String> queue) {
        Unit unit = graph.nodes().get(activityId);
        if (unit == null || unit.kind() != UnitKind.ACTIVITY || unit.objectiveId() == null) return;
        String objectiveId = unit.objectiveId();
        if (objectiveId.equals(startId) || !graph.nodes().containsKey(objectiveId) || !bridged.add(activityId)) return;

        bridgedEdges.add(Dependency.bridge(objectiveId, activityId));
        if (visited.add(objectiveId)) {
            queue.add(objectiveId);
        }
    }

    private Map<String, List<Dependency>> index(Graph graph, Function<Dependency, String> key) {
        return graph.edges().stream()
                .filter(e -> e.kind() == EdgeKind.ACTIVATION)
                .collect(Collectors.groupingBy(key, LinkedHashMap::new, Collectors.toList()));
    }

    private List<Diagnostic> cycles(Set<String> reached, Map<String, List<Dependency>> index,
                                    Function<Dependency, String> step, String direction) {
        Set<String> onPath = new HashSet<>();
        Set<String> done = new HashSet<>();
        Set<String> closing = new LinkedHashSet<>();
        for (String id : reached) {
            walk(id, reached, index, step, onPath, done, closing);
        }
        return closing.stream().map(id -> {
            log.warn("Cycle through {} met while computing {}", id, direction);
            return Diagnostic.of(DiagnosticType.GRAPH_INTEGRITY_WARNING, id,
                    "Cycle through this unit met while computing " + direction);
        }).toList();
    }

    private void walk(String id, Set<String> reached, Map<String, List<Dependency>> index, Function<Dependency, String> step,
                      Set<String> onPath, Set<String> done, Set<String> closing) {
        if (done.contains(id)) return;
        onPath.add(id);
        for (Dependency edge : index.getOrDefault(id, List.of())) {
            String next = step.apply(edge);
            if (!reached.contains(next)) continue;
            if (onPath.contains(next)) {
                closing.add(next);
            } else {
                walk(next, reached, index, step, onPath, done, closing);
            }
        }
        onPath.remove(id);
        done.add(id);
    }

    private Traversal unknownUnit(String unitId, List<Diagnostic> diagnostics) {
        diagnostics.add(Diagnostic.of(DiagnosticType.UNRESOLVED_REFERENCE, unitId, "Unit is not part of the graph"));
        return new Traversal(unitId, Set.of(), List.of(), diagnostics);
    }
}
