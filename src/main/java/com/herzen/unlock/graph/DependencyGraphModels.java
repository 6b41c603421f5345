package com.herzen.unlock.graph;

import com.herzen.unlock.domain.DomainModels.Dependency;
import com.herzen.unlock.domain.DomainModels.Unit;
import com.herzen.unlock.validation.Diagnostic;

import java.util.*;

public class DependencyGraphModels {
    public record Graph(String moduleId, Map<String, Unit> nodes, List<Dependency> edges) {
        public Graph {
            nodes = nodes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
            edges = edges == null ? List.of() : List.copyOf(edges);
        }

        public static Graph empty(String moduleId) {
            return new Graph(moduleId, Map.of(), List.of());
        }
    }

    public record BuildResult(Graph graph, List<Diagnostic> diagnostics) {
        public BuildResult {
            diagnostics = List.copyOf(diagnostics);
        }
    }

    public record ModuleCatalog(List<CatalogObjective> objectives) {
        public ModuleCatalog {
            objectives = objectives == null ? List.of() : List.copyOf(objectives);
        }
    }

    public record CatalogObjective(String id, String code, String label, List<CatalogActivity> activities) {
        public CatalogObjective {
            activities = activities == null ? List.of() : List.copyOf(activities);
        }
    }

    public record CatalogActivity(String id, String code, String label) {}

    /** Pre-resolved topology shipped instead of raw rules. */
    public record TopologySnapshot(List<Unit> nodes, List<Dependency> edges) {
        public TopologySnapshot {
            nodes = nodes == null ? List.of() : List.copyOf(nodes);
            edges = edges == null ? List.of() : List.copyOf(edges);
        }
    }

    public record Traversal(String unitId, Set<String> unitIds, List<Dependency> bridgedEdges, List<Diagnostic> diagnostics) {
        public Traversal {
            unitIds = Collections.unmodifiableSet(new LinkedHashSet<>(unitIds));
            bridgedEdges = List.copyOf(bridgedEdges);
            diagnostics = List.copyOf(diagnostics);
        }
    }

    public record Focus(String unitId, Set<String> highlightedNodes, List<Dependency> highlightedEdges, List<Diagnostic> diagnostics) {
        public Focus {
            highlightedNodes = Collections.unmodifiableSet(new LinkedHashSet<>(highlightedNodes));
            highlightedEdges = List.copyOf(highlightedEdges);
            diagnostics = List.copyOf(diagnostics);
        }
    }
}
