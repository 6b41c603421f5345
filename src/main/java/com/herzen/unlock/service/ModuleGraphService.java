package com.herzen.unlock.service;

import com.herzen.unlock.config.UnlockGraphProperties;
import com.herzen.unlock.graph.DependencyGraphBuilder;
import com.herzen.unlock.graph.DependencyGraphModels.BuildResult;
import com.herzen.unlock.graph.DependencyGraphModels.Graph;
import com.herzen.unlock.graph.DependencyGraphModels.ModuleCatalog;
import com.herzen.unlock.graph.DependencyGraphModels.TopologySnapshot;
import com.herzen.unlock.overlay.OverlayMerger;
import com.herzen.unlock.overlay.OverlayModels.DailyActivityMetric;
import com.herzen.unlock.parser.ParserDtos.RawRulePayload;
import com.herzen.unlock.parser.ParserDtos.RuleParseResult;
import com.herzen.unlock.parser.ParserDtos.StrictnessMode;
import com.herzen.unlock.parser.RuleParser;
import com.herzen.unlock.parser.RulesDocumentReader.RulesDocument;
import com.herzen.unlock.resolver.CodeIdResolver;
import com.herzen.unlock.validation.Diagnostic;
import com.herzen.unlock.validation.RuleImportException;
import com.herzen.unlock.validation.UnsupportedModuleException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.*;

@Slf4j
@Service
public class ModuleGraphService {
    private final RuleParser parser;
    private final DependencyGraphBuilder builder;
    private final OverlayMerger overlayMerger;
    private final UnlockGraphProperties properties;

    public ModuleGraphService(RuleParser parser,
                              DependencyGraphBuilder builder,
                              OverlayMerger overlayMerger,
                              UnlockGraphProperties properties) {
        this.parser = parser;
        this.builder = builder;
        this.overlayMerger = overlayMerger;
        this.properties = properties;
    }

    public Set<String> supportedModules(RulesDocument rules,
                                        Collection<String> catalogModuleIds,
                                        Collection<String> observedModuleIds) {
        Collection<String> catalog = catalogModuleIds == null || catalogModuleIds.isEmpty()
                ? rules.catalogModuleIds()
                : catalogModuleIds;
        return builder.supportedModules(rules.moduleIds(), catalog, observedModuleIds);
    }

    public BuildResult buildModuleGraph(ModuleBuildRequest request) {
        String moduleId = request.moduleId();
        Set<String> supported = request.supportedModules() == null ? Set.of() : request.supportedModules();
        if (!supported.contains(moduleId)) {
            log.warn("Refusing to build graph for unsupported module {} (supported: {})", moduleId, supported);
            throw new UnsupportedModuleException(moduleId, supported);
        }

        StrictnessMode mode = request.strictness() != null ? request.strictness() : properties.strictness();
        RuleParseResult parsed = parser.parseAll(request.payloads());
        if (!parsed.errors().isEmpty()) {
            if (mode == StrictnessMode.STRICT) {
                log.warn("Strict build of module {} aborted: {} malformed requirement(s)", moduleId, parsed.errors().size());
                throw new RuleImportException(moduleId, parsed.errors());
            }
            log.info("Module {}: dropped {} malformed requirement(s)", moduleId, parsed.errors().size());
        }

        BuildResult built = builder.build(moduleId, parsed.specs(), request.resolver(), request.catalog(),
                request.topology(), request.enrichment());
        List<Diagnostic> diagnostics = new ArrayList<>(parsed.errors());
        diagnostics.addAll(built.diagnostics());
        return new BuildResult(built.graph(), diagnostics);
    }

    public Graph withOverlay(Graph graph, List<DailyActivityMetric> rows, LocalDate start, LocalDate end) {
        return overlayMerger.mergeOverlays(graph, overlayMerger.aggregateDaily(rows, graph.moduleId(), start, end));
    }

    public record ModuleBuildRequest(String moduleId,
                                     List<RawRulePayload> payloads,
                                     CodeIdResolver resolver,
                                     ModuleCatalog catalog,
                                     TopologySnapshot topology,
                                     Map<String, Map<String, Double>> enrichment,
                                     Set<String> supportedModules,
                                     StrictnessMode strictness) {
        public ModuleBuildRequest {
            payloads = payloads == null ? List.of() : List.copyOf(payloads);
            resolver = resolver == null ? CodeIdResolver.empty() : resolver;
        }

        public static ModuleBuildRequest from(RulesDocument rules,
                                              String moduleId,
                                              Set<String> supportedModules,
                                              StrictnessMode strictness,
                                              Map<String, Map<String, Double>> enrichment) {
            return new ModuleBuildRequest(moduleId, rules.payloads(moduleId), rules.resolver(), rules.catalog(moduleId),
                    rules.topology(moduleId),
                    enrichment, supportedModules, strictness);
        }
    }
}
