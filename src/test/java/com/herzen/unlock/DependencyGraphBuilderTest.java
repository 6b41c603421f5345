package com.herzen.unlock;

import com.herzen.unlock.domain.DomainModels.*;
import com.herzen.unlock.graph.DependencyGraphBuilder;
import com.herzen.unlock.graph.GraphQueryService;
import com.herzen.unlock.graph.DependencyGraphModels.BuildResult;
import com.herzen.unlock.graph.DependencyGraphModels.CatalogActivity;
import com.herzen.unlock.graph.DependencyGraphModels.CatalogObjective;
import com.herzen.unlock.graph.DependencyGraphModels.ModuleCatalog;
import com.herzen.unlock.graph.DependencyGraphModels.TopologySnapshot;
import com.herzen.unlock.parser.ParserDtos.RawRulePayload;
import com.herzen.unlock.parser.RuleParser;
import com.herzen.unlock.resolver.CodeIdResolver;
import com.herzen.unlock.resolver.UnitCodes;
import com.herzen.unlock.validation.Diagnostic;
import com.herzen.unlock.validation.DiagnosticType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.herzen.unlock.GraphFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class DependencyGraphBuilderTest {
    @Autowired
    private RuleParser parser;
    @Autowired
    private DependencyGraphBuilder builder;
    @Autowired
    private GraphQueryService queries;

    private BuildResult build(CodeIdResolver resolver, RawRulePayload... payloads) {
        var parsed = parser.parseAll(List.of(payloads));
        assertTrue(parsed.errors().isEmpty(), () -> "unexpected parse errors " + parsed.errors());
        return builder.build("M1", parsed.specs(), resolver);
    }

    private long count(BuildResult result, DiagnosticType type) {
        return result.diagnostics().stream().filter(d -> d.type() == type).count();
    }

    @Test
    void buildsActivationChainWithThresholds() {
        var result = build(identity("A1", "A2", "O2"),
                open("A1"),
                requires("A2", "A1@60%"),
                objective("O2", "A2"));

        var graph = result.graph();
        assertEquals(Set.of("A1", "A2", "O2"), graph.nodes().keySet());
        assertEquals(2, graph.edges().size());
        assertTrue(result.diagnostics().isEmpty(), () -> result.diagnostics().toString());

        Dependency a1ToA2 = graph.edges().stream().filter(e -> e.fromId().equals("A1")).findFirst().orElseThrow();
        assertEquals("A2", a1ToA2.toId());
        assertEquals(EdgeKind.ACTIVATION, a1ToA2.kind());
        assertEquals(ThresholdMetric.SUCCESS_RATE, a1ToA2.threshold().metric());
        assertEquals(0.60, a1ToA2.threshold().value(), 1e-12);
        assertFalse(a1ToA2.inferred());

        Dependency a2ToO2 = graph.edges().stream().filter(e -> e.fromId().equals("A2")).findFirst().orElseThrow();
        assertEquals("O2", a2ToO2.toId());
        assertNull(a2ToO2.threshold());

        assertEquals(UnitKind.OBJECTIVE, graph.nodes().get("O2").kind());
        assertTrue(graph.nodes().get("A1").initiallyOpen());
        assertFalse(graph.nodes().get("A2").initiallyOpen());
        assertTrue(graph.nodes().values().stream().noneMatch(Unit::ghost));
    }

    @Test
    void synthesizesOneGhostPerUnresolvedCode() {
        var result = build(identity("A1", "A2", "A3"),
                open("A1"),
                requires("A2", "A99"),
                requires("A3", "A99@50%", "A1"));

        Unit ghost = result.graph().nodes().get("A99");
        assertNotNull(ghost);
        assertTrue(ghost.ghost());
        assertEquals("A99", ghost.code());
        assertEquals(1, count(result, DiagnosticType.UNRESOLVED_REFERENCE));
        assertEquals("A99", result.diagnostics().stream()
                .filter(d -> d.type() == DiagnosticType.UNRESOLVED_REFERENCE)
                .map(Diagnostic::subject).findFirst().orElseThrow());
        assertTrue(result.graph().edges().stream().anyMatch(e -> e.fromId().equals("A99") && e.toId().equals("A2")));
        assertTrue(result.graph().edges().stream().anyMatch(e -> e.fromId().equals("A99") && e.toId().equals("A3")));

        assertTrue(queries.ancestors(result.graph(), "A2").unitIds().contains("A99"));
        assertEquals(Set.of("A2", "A3"), queries.descendants(result.graph(), "A99").unitIds());
    }

    @Test
    void toleratesOversizedNumbersInCodes() {
        var result = assertDoesNotThrow(() -> build(identity("M1O1A1"), requires("M1O1A1", "M1O1A99999999999")));

        Unit ghost = result.graph().nodes().get("M1O1A99999999999");
        assertTrue(ghost.ghost());
        assertNull(ghost.activityIndex());
        assertNull(UnitCodes.activityIndexOf("M1O1A99999999999"));
        assertEquals(7, UnitCodes.activityIndexOf("M1O1A7"));

        Set<String> modules = Set.of("M10", "M99999999999999999999", "M1");
        assertEquals(List.of("M1", "M10", "M99999999999999999999"),
                List.copyOf(assertDoesNotThrow(() -> builder.supportedModules(modules, modules, null))));
    }

    @Test
    void reportsAmbiguousParentObjectiveOnce() {
        CodeIdResolver resolver = new CodeIdResolver(Map.of(
                "M1O1", List.of("o-b", "o-a"),
                "M1O1A1", List.of("a1"),
                "M1O1A2", List.of("a2")), Map.of());
        var result = build(resolver, open("M1O1A1"), requires("M1O1A2", "M1O1A1"));

        assertEquals("o-a", result.graph().nodes().get("a2").objectiveId());
        assertEquals("o-a", result.graph().nodes().get("a1").objectiveId());
        assertEquals(1, count(result, DiagnosticType.AMBIGUOUS_CODE_RESOLUTION));
        assertEquals("M1O1", result.diagnostics().get(0).subject());
        assertEquals(0, count(result, DiagnosticType.UNRESOLVED_REFERENCE));
        assertEquals(Set.of("a1", "a2"), result.graph().nodes().keySet());
    }

    @Test
    void seedsUnitsFromModuleCatalog() {
        ModuleCatalog catalog = new ModuleCatalog(List.of(
                new CatalogObjective("o1", "M1O1", "Fractions", List.of(
                        new CatalogActivity("a1", "M1O1A1", "Halves"),
                        new CatalogActivity("a2", "M1O1A2", null))),
                new CatalogObjective(null, "M1O2", null, null)));
        CodeIdResolver resolver = CodeIdResolver.ofSingle(Map.of("M1O1A2", "a2", "M1O2", "o2"));
        var specs = parser.parseAll(List.of(requires("M1O1A2", "M1O1A1@50%"))).specs();

        var result = builder.build("M1", specs, resolver, catalog, null, null);
        var nodes = result.graph().nodes();

        assertTrue(result.diagnostics().isEmpty(), () -> result.diagnostics().toString());
        assertEquals(Set.of("o1", "a1", "a2", "o2"), nodes.keySet());
        assertTrue(nodes.values().stream().noneMatch(Unit::ghost));
        assertEquals("Halves", nodes.get("a1").label());
        assertEquals("o1", nodes.get("a1").objectiveId());
        assertEquals(1, nodes.get("a1").activityIndex());
        assertEquals("M1O1A2", nodes.get("a2").label());
        assertEquals(UnitKind.OBJECTIVE, nodes.get("o2").kind());
        assertEquals("M1O2", nodes.get("o2").code());

        assertTrue(nodes.get("o1").initiallyOpen());
        assertTrue(nodes.get("a1").initiallyOpen());
        assertTrue(nodes.get("o2").initiallyOpen());
        assertFalse(nodes.get("a2").initiallyOpen());
        assertEquals(List.of("a1"), result.graph().edges().stream().map(Dependency::fromId).toList());
    }

    @Test
    void unresolvedTargetBecomesGhostToo() {
        var result = build(identity("A1"), requires("A7", "A1"));

        assertTrue(result.graph().nodes().get("A7").ghost());
        assertFalse(result.graph().nodes().get("A1").ghost());
        assertEquals(1, count(result, DiagnosticType.UNRESOLVED_REFERENCE));
    }

    @Test
    void rejectsSelfLoops() {
        var result = build(identity("A1", "A2"), requires("A1", "A1@50%", "A2"), open("A2"));

        assertTrue(result.graph().edges().stream().noneMatch(e -> e.fromId().equals(e.toId())));
        assertEquals(1, result.graph().edges().size());
        assertEquals(1, count(result, DiagnosticType.SELF_LOOP_REJECTED));
    }

    @Test
    void keepsStricterThresholdForDuplicateEdge() {
        var result = build(identity("A1", "A2"), open("A1"), requires("A2", "A1@60%", "A1@80%", "A1"));

        assertEquals(1, result.graph().edges().size());
        assertEquals(Threshold.successRate(0.8), result.graph().edges().get(0).threshold());
        assertEquals(2, count(result, DiagnosticType.GRAPH_INTEGRITY_WARNING));
    }

    @Test
    void picksLowestIdForAmbiguousCodeAndReportsIt() {
        var resolver = new CodeIdResolver(
                Map.of("M1O1A1", List.of("id-b", "id-a"), "M1O1A2", List.of("id-c")),
                Map.of());
        var result = build(resolver, open("M1O1A1"), requires("M1O1A2", "M1O1A1"));

        assertTrue(result.graph().nodes().containsKey("id-a"));
        assertFalse(result.graph().nodes().containsKey("id-b"));
        assertEquals(1, count(result, DiagnosticType.AMBIGUOUS_CODE_RESOLUTION));
        assertEquals("id-a", result.graph().edges().get(0).fromId());
        assertFalse(result.graph().edges().get(0).inferred());
    }

    @Test
    void collapsesCodesSharingAnIdIntoOneNode() {
        var resolver = new CodeIdResolver(
                Map.of("M1O1A1", List.of("a1"), "legacy-a1", List.of("a1"), "M1O1A2", List.of("a2")),
                Map.of());
        var result = build(resolver, open("M1O1A1"), requires("M1O1A2", "legacy-a1", "M1O1A1"));

        assertEquals(2, result.graph().nodes().size());
        assertEquals(1, result.graph().edges().size());
        assertEquals("M1O1A1", result.graph().nodes().get("a1").code());
    }

    @Test
    void derivesKindObjectiveAndIndexFromCodes() {
        var resolver = new CodeIdResolver(
                Map.of("M1O1A3", List.of("a3"), "M1O1", List.of("o1"), "M1O2", List.of("o2")),
                Map.of("a3", List.of("legacy-3", "M1O1A3")));
        var result = build(resolver, open("M1O1"), requires("M1O1A3", "M1O2#1"));

        Unit activity = result.graph().nodes().get("a3");
        assertEquals(UnitKind.ACTIVITY, activity.kind());
        assertEquals("M1O1A3", activity.code());
        assertEquals("o1", activity.objectiveId());
        assertEquals(3, activity.activityIndex());
        assertEquals("M1", activity.moduleId());

        assertEquals(UnitKind.OBJECTIVE, result.graph().nodes().get("o2").kind());
        assertEquals(Threshold.level(1), result.graph().edges().get(0).threshold());
    }

    @Test
    void keepsDeactivationEdgesSeparateFromActivation() {
        var parsed = parser.parseAll(List.of(
                open("A1"),
                RawRulePayload.of("A2", List.of("A1"), List.of("A1@90%"), false)));
        var result = builder.build("M1", parsed.specs(), identity("A1", "A2"));

        assertEquals(2, result.graph().edges().size());
        assertTrue(result.graph().edges().stream().anyMatch(e -> e.kind() == EdgeKind.DEACTIVATION
                && e.threshold().equals(Threshold.successRate(0.9))));
        assertEquals(0, count(result, DiagnosticType.GRAPH_INTEGRITY_WARNING));
    }

    @Test
    void opensUnitsWithoutIncomingActivation() {
        var parsed = parser.parseAll(List.of(
                RawRulePayload.of("A1", List.of(), List.of(), false),
                RawRulePayload.of("A2", List.of(), List.of("A1"), false),
                requires("A3", "A2")));
        var graph = builder.build("M1", parsed.specs(), identity("A1", "A2", "A3")).graph();

        assertTrue(graph.nodes().get("A1").initiallyOpen());
        assertTrue(graph.nodes().get("A2").initiallyOpen());
        assertFalse(graph.nodes().get("A3").initiallyOpen());
    }

    @Test
    void reportsActivationCycles() {
        var result = build(identity("A1", "A2", "A3"), requires("A1", "A3"), requires("A2", "A1"), requires("A3", "A2"));

        var cycles = result.diagnostics().stream()
                .filter(d -> d.type() == DiagnosticType.GRAPH_INTEGRITY_WARNING && d.message().startsWith("Cycle"))
                .toList();
        assertEquals(1, cycles.size());
        assertEquals(3, result.graph().edges().size());
    }

    @Test
    void usesTopologySnapshotInsteadOfRules() {
        var snapshot = new TopologySnapshot(
                List.of(new Unit("o1", UnitKind.OBJECTIVE, null, "M1O1", "Objective 1", null, null, true, false, null),
                        new Unit("a1", UnitKind.ACTIVITY, "M1", "M1O1A1", "Activity 1", "o1", 1, false, false, null)),
                List.of(Dependency.of("o1", "a1", EdgeKind.ACTIVATION, Threshold.successRate(0.7), null),
                        Dependency.of("a1", "a1", EdgeKind.ACTIVATION, null, null),
                        Dependency.of("gone", "a1", EdgeKind.DEACTIVATION, null, "M1O9")));
        var parsed = parser.parseAll(List.of(requires("X1", "X2")));

        var result = builder.build("M1", parsed.specs(), CodeIdResolver.empty(), snapshot,
                Map.of("M1O1", Map.of("observed_sr", 0.66), "M1O7", Map.of("lvl", 2.0)));

        var graph = result.graph();
        assertEquals(Set.of("o1", "a1", "gone"), graph.nodes().keySet());
        assertEquals("M1", graph.nodes().get("o1").moduleId());
        assertTrue(graph.nodes().get("gone").ghost());
        assertEquals(2, graph.edges().size());

        Dependency gated = graph.edges().stream().filter(e -> e.fromId().equals("o1")).findFirst().orElseThrow();
        assertEquals(Map.of("observed_sr", 0.66), gated.enrichment());
        assertEquals(EdgeKind.ACTIVATION, gated.kind());

        assertEquals(1, count(result, DiagnosticType.SELF_LOOP_REJECTED));
        assertEquals(1, count(result, DiagnosticType.UNRESOLVED_REFERENCE));
        assertEquals(List.of("M1O7"), result.diagnostics().stream()
                .filter(d -> d.type() == DiagnosticType.ENRICHMENT_UNUSED)
                .map(Diagnostic::subject).toList());
    }

    @Test
    void attachesEnrichmentByRequirementCode() {
        var parsed = parser.parseAll(List.of(open("A1"), requires("A2", "A1@50%")));
        var result = builder.build("M1", parsed.specs(), identity("A1", "A2"), null, Map.of("A1", Map.of("lvl", 3.0)));

        Dependency edge = result.graph().edges().get(0);
        assertEquals(Map.of("lvl", 3.0), edge.enrichment());
        assertEquals(Threshold.successRate(0.5), edge.threshold());
        assertEquals(0, count(result, DiagnosticType.ENRICHMENT_UNUSED));
    }

    @Test
    void intersectsModuleSupportSets() {
        var withObserved = builder.supportedModules(Set.of("M1", "M2", "M10", "M3"), Set.of("M1", "M2", "M10"), Set.of("M10", "M2", "M7"));
        assertEquals(List.of("M2", "M10"), List.copyOf(withObserved));

        var withoutObserved = builder.supportedModules(Set.of("M10", "M1", "M2"), Set.of("M2", "M10", "M1", "M4"), null);
        assertEquals(List.of("M1", "M2", "M10"), List.copyOf(withoutObserved));

        assertTrue(builder.supportedModules(Set.of("M1"), Set.of(), null).isEmpty());
    }
}
