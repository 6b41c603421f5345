package com.herzen.unlock.graph;

import com.herzen.unlock.domain.DomainModels.*;
import com.herzen.unlock.graph.DependencyGraphModels.BuildResult;
import com.herzen.unlock.graph.DependencyGraphModels.CatalogActivity;
import com.herzen.unlock.graph.DependencyGraphModels.CatalogObjective;
import com.herzen.unlock.graph.DependencyGraphModels.Graph;
import com.herzen.unlock.graph.DependencyGraphModels.ModuleCatalog;
import com.herzen.unlock.graph.DependencyGraphModels.TopologySnapshot;
import com.herzen.unlock.parser.ParserDtos.Requirement;
import com.herzen.unlock.parser.ParserDtos.RuleSpec;
import com.herzen.unlock.resolver.CodeIdResolver;
import com.herzen.unlock.resolver.UnitCodes;
import com.herzen.unlock.validation.Diagnostic;
import com.herzen.unlock.validation.DiagnosticType;
import com.herzen.unlock.validation.GraphIntegrityValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

@Slf4j
@Component
public class DependencyGraphBuilder {
    private final GraphIntegrityValidator integrityValidator;

    public DependencyGraphBuilder(GraphIntegrityValidator integrityValidator) {
        this.integrityValidator = integrityValidator;
    }

    public BuildResult build(String moduleId, List<RuleSpec> ruleSpecs, CodeIdResolver resolver) {
        return build(moduleId, ruleSpecs, resolver, null, null, null);
    }

    public BuildResult build(String moduleId,
                             List<RuleSpec> ruleSpecs,
                             CodeIdResolver resolver,
                             TopologySnapshot topologySnapshot,
                             Map<String, Map<String, Double>> enrichment) {
        return build(moduleId, ruleSpecs, resolver, null, topologySnapshot, enrichment);
    }

    public BuildResult build(String moduleId,
                             List<RuleSpec> ruleSpecs,
                             CodeIdResolver resolver,
                             ModuleCatalog catalog,
                             TopologySnapshot topologySnapshot,
                             Map<String, Map<String, Double>> enrichment) {
        BuildContext ctx = new BuildContext(moduleId, resolver == null ? CodeIdResolver.empty() : resolver);

        if (topologySnapshot != null && (!topologySnapshot.nodes().isEmpty() || !topologySnapshot.edges().isEmpty())) {
            log.debug("Module {}: using precomputed topology ({} nodes, {} edges)",
                    moduleId, topologySnapshot.nodes().size(), topologySnapshot.edges().size());
            ctx.loadSnapshot(topologySnapshot);
        } else {
            if (catalog != null) {
                ctx.seedCatalog(catalog);
            }
            List<RuleSpec> specs = ruleSpecs == null ? List.of() : ruleSpecs;
            Map<String, String> targetIds = new HashMap<>();
            for (RuleSpec spec : specs) {
                targetIds.put(spec.targetCode(), ctx.target(spec));
            }
            for (RuleSpec spec : specs) {
                String targetId = targetIds.get(spec.targetCode());
                for (Requirement requirement : spec.requirements()) {
                    String sourceId = ctx.reference(requirement.sourceCode());
                    ctx.addEdge(Dependency.of(sourceId, targetId, spec.direction(), requirement.threshold(), requirement.sourceCode()));
                }
            }
            ctx.openUnlockedRoots();
        }

        List<Dependency> edges = ctx.enrichedEdges(enrichment);
        Graph graph = new Graph(moduleId, ctx.nodes, edges);
        ctx.diagnostics.addAll(integrityValidator.validate(graph.nodes(), graph.edges()));

        long ghosts = graph.nodes().values().stream().filter(Unit::ghost).count();
        if (ghosts > 0) {
            log.warn("Module {}: created {} ghost node(s) for unresolved rule references", moduleId, ghosts);
        }
        log.info("Built dependency graph for module {}: nodes={} edges={} diagnostics={}",
                moduleId, graph.nodes().size(), graph.edges().size(), ctx.diagnostics.size());
        return new BuildResult(graph, ctx.diagnostics);
    }

    /**
     * Modules that rules, catalog and (when given and non-empty) observed data all cover, in module-number order.
     */
    public Set<String> supportedModules(Collection<String> ruleModuleIds,
                                        Collection<String> catalogModuleIds,
                                        Collection<String> observedModuleIds) {
        Set<String> supported = clean(ruleModuleIds);
        supported.retainAll(clean(catalogModuleIds));
        Set<String> observed = clean(observedModuleIds);
        if (!observed.isEmpty()) {
            supported.retainAll(observed);
        }
        return supported.stream()
                .sorted(UnitCodes.moduleOrder())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private Set<String> clean(Collection<String> ids) {
        if (ids == null) return new HashSet<>();
        return ids.stream().filter(id -> id != null && !id.isBlank()).map(String::trim).collect(Collectors.toCollection(HashSet::new));
    }

    private static final class BuildContext {
        private final String moduleId;
        private final CodeIdResolver resolver;
        private final Map<String, Unit> nodes = new LinkedHashMap<>();
        private final Map<EdgeKey, Dependency> edges = new LinkedHashMap<>();
        private final Map<String, Optional<String>> resolved = new HashMap<>();
        private final Set<String> ghostReported = new HashSet<>();
        private final Set<String> ambiguityReported = new HashSet<>();
        private final Map<String, String> catalogIds = new HashMap<>();
        private final List<Diagnostic> diagnostics = new ArrayList<>();

        private BuildContext(String moduleId, CodeIdResolver resolver) {
            this.moduleId = moduleId;
            this.resolver = resolver;
        }

        void seedCatalog(ModuleCatalog catalog) {
            for (CatalogObjective objective : catalog.objectives()) {
                if (objective == null || isBlank(objective.code())) continue;
                String objectiveId = seed(objective.id(), objective.code().trim(), UnitKind.OBJECTIVE, objective.label(), null);
                for (CatalogActivity activity : objective.activities()) {
                    if (activity == null || isBlank(activity.code())) continue;
                    seed(activity.id(), activity.code().trim(), UnitKind.ACTIVITY, activity.label(), objectiveId);
                }
            }
            log.debug("Module {}: seeded {} catalog unit(s)", moduleId, nodes.size());
        }

        String target(RuleSpec spec) {
            String code = spec.targetCode();
            Optional<String> id = resolve(code);
            String nodeId = id.orElse(code);
            Unit existing = nodes.get(nodeId);
            if (existing == null) {
                nodes.put(nodeId, newUnit(nodeId, code, id.isEmpty(), spec.kind(), spec.objective(), spec.label(), spec.initiallyOpen()));
            } else if (spec.initiallyOpen() && !existing.initiallyOpen()) {
                nodes.put(nodeId, existing.opened());
            }
            return nodeId;
        }

        String reference(String code) {
            Optional<String> id = resolve(code);
            String nodeId = id.orElse(code);
            if (!nodes.containsKey(nodeId)) {
                nodes.put(nodeId, newUnit(nodeId, code, id.isEmpty(), null, null, null, false));
            }
            return nodeId;
        }

        void addEdge(Dependency edge) {
            if (edge.fromId().equals(edge.toId())) {
                diagnostics.add(Diagnostic.of(DiagnosticType.SELF_LOOP_REJECTED, edge.fromId(),
                        "Dropped " + edge.kind().wire() + " edge from a unit to itself"));
                return;
            }
            EdgeKey key = edge.key();
            Dependency existing = edges.get(key);
            if (existing == null) {
                edges.put(key, edge);
                return;
            }
            if (Objects.equals(existing.threshold(), edge.threshold())) return;

            Dependency kept = edge.threshold() != null && edge.threshold().stricterThan(existing.threshold()) ? edge : existing;
            edges.put(key, kept);
            diagnostics.add(Diagnostic.of(DiagnosticType.GRAPH_INTEGRITY_WARNING, edge.fromId() + "->" + edge.toId(),
                    "Duplicate " + edge.kind().wire() + " edge with conflicting thresholds " + existing.threshold()
                            + " and " + edge.threshold() + "; kept " + kept.threshold()));
        }

        void openUnlockedRoots() {
            Set<String> gated = edges.values().stream()
                    .filter(e -> e.kind() == EdgeKind.ACTIVATION)
                    .map(Dependency::toId)
                    .collect(Collectors.toSet());
            nodes.replaceAll((id, unit) -> !unit.ghost() && !unit.initiallyOpen() && !gated.contains(id) ? unit.opened() : unit);
        }

        void loadSnapshot(TopologySnapshot snapshot) {
            for (Unit unit : snapshot.nodes()) {
                if (unit == null || unit.id() == null || unit.id().isBlank()) {
                    diagnostics.add(Diagnostic.of(DiagnosticType.GRAPH_INTEGRITY_WARNING, moduleId, "Topology node without id skipped"));
                    continue;
                }
                Unit normalized = unit.moduleId() == null ? unit.withModuleId(moduleId) : unit;
                if (nodes.putIfAbsent(unit.id(), normalized) != null) {
                    diagnostics.add(Diagnostic.of(DiagnosticType.GRAPH_INTEGRITY_WARNING, unit.id(), "Duplicate topology node id; first entry kept"));
                }
            }
            for (Dependency edge : snapshot.edges()) {
                if (edge == null || edge.fromId() == null || edge.toId() == null || edge.kind() == null) {
                    diagnostics.add(Diagnostic.of(DiagnosticType.GRAPH_INTEGRITY_WARNING, moduleId, "Incomplete topology edge skipped"));
                    continue;
                }
                ensureEndpoint(edge.fromId());
                ensureEndpoint(edge.toId());
                addEdge(new Dependency(edge.fromId(), edge.toId(), edge.kind(), edge.threshold(), edge.sourceCode(), edge.enrichment(), false));
            }
        }

        List<Dependency> enrichedEdges(Map<String, Map<String, Double>> enrichment) {
            if (enrichment == null || enrichment.isEmpty()) return new ArrayList<>(edges.values());

            Set<String> used = new HashSet<>();
            List<Dependency> out = new ArrayList<>(edges.size());
            for (Dependency edge : edges.values()) {
                String code = edge.sourceCode() != null ? edge.sourceCode()
                        : Optional.ofNullable(nodes.get(edge.fromId())).map(Unit::code).orElse(null);
                Map<String, Double> extra = code == null ? null : enrichment.get(code);
                if (extra == null) {
                    out.add(edge);
                    continue;
                }
                used.add(code);
                Map<String, Double> merged = new LinkedHashMap<>(edge.enrichment());
                merged.putAll(extra);
                out.add(edge.withEnrichment(merged));
            }
            enrichment.keySet().stream()
                    .filter(code -> !used.contains(code))
                    .sorted()
                    .forEach(code -> diagnostics.add(Diagnostic.of(DiagnosticType.ENRICHMENT_UNUSED, code,
                            "Enrichment matches no edge source code")));
            return out;
        }

        private void ensureEndpoint(String id) {
            if (nodes.containsKey(id)) return;
            nodes.put(id, newUnit(id, id, true, null, null, null, false));
            if (ghostReported.add(id)) {
                diagnostics.add(Diagnostic.of(DiagnosticType.UNRESOLVED_REFERENCE, id, "Topology edge references an unknown unit; ghost node created"));
            }
        }

        private String seed(String declaredId, String code, UnitKind kind, String label, String objectiveId) {
            String id = isBlank(declaredId) ? lookup(code).orElse(code) : declaredId.trim();
            catalogIds.putIfAbsent(code, id);
            nodes.putIfAbsent(id, new Unit(id, kind, moduleId, code, isBlank(label) ? code : label.trim(), objectiveId,
                    kind == UnitKind.ACTIVITY ? UnitCodes.activityIndexOf(code) : null, false, false, null));
            return id;
        }

        private Optional<String> resolve(String code) {
            Optional<String> cached = resolved.get(code);
            if (cached != null) return cached;

            Optional<String> id = Optional.ofNullable(catalogIds.get(code)).or(() -> lookup(code));
            if (id.isEmpty() && ghostReported.add(code)) {
                diagnostics.add(Diagnostic.of(DiagnosticType.UNRESOLVED_REFERENCE, code, "Code has no known id; ghost node created"));
            }
            resolved.put(code, id);
            return id;
        }

        private String objectiveIdFor(String objectiveCode) {
            Optional<String> cached = resolved.get(objectiveCode);
            if (cached != null) return cached.orElse(objectiveCode);
            return Optional.ofNullable(catalogIds.get(objectiveCode)).or(() -> lookup(objectiveCode)).orElse(objectiveCode);
        }

        private Optional<String> lookup(String code) {
            List<String> candidates = resolver.resolveCode(code);
            if (candidates.isEmpty()) return Optional.empty();
            if (candidates.size() > 1 && ambiguityReported.add(code)) {
                log.warn("Module {}: code {} maps to {} ids {}, using {}", moduleId, code, candidates.size(), candidates, candidates.get(0));
                diagnostics.add(Diagnostic.of(DiagnosticType.AMBIGUOUS_CODE_RESOLUTION, code,
                        "Code maps to " + candidates + "; picked " + candidates.get(0)));
            }
            return Optional.of(candidates.get(0));
        }

        private static boolean isBlank(String value) {
            return value == null || value.isBlank();
        }

        private Unit newUnit(String id, String code, boolean ghost, UnitKind kindHint, String objectiveHint, String label, boolean initiallyOpen) {
            String displayCode = ghost ? code : resolver.preferredCodeFor(id).orElse(code);
            UnitKind kind = kindHint != null ? kindHint
                    : UnitCodes.kindOf(displayCode).or(() -> UnitCodes.kindOf(code)).orElse(UnitKind.ACTIVITY);

            String objectiveId = null;
            if (kind == UnitKind.ACTIVITY) {
                String objectiveCode = objectiveHint != null && !objectiveHint.isBlank()
                        ? objectiveHint.trim()
                        : UnitCodes.objectiveCodeOf(displayCode).orElse(null);
                if (objectiveCode != null) {
                    objectiveId = objectiveIdFor(objectiveCode);
                }
            }
            return new Unit(id, kind, moduleId, displayCode, label, objectiveId,
                    UnitCodes.activityIndexOf(displayCode), initiallyOpen, ghost, null);
        }
    }
}
