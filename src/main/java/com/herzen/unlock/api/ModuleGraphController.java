package com.herzen.unlock.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.herzen.unlock.graph.DependencyGraphModels;
import com.herzen.unlock.graph.DependencyGraphModels.BuildResult;
import com.herzen.unlock.graph.DependencyGraphModels.Graph;
import com.herzen.unlock.graph.GraphQueryService;
import com.herzen.unlock.overlay.OverlayModels.DailyActivityMetric;
import com.herzen.unlock.parser.ParserDtos;
import com.herzen.unlock.parser.ParserDtos.StrictnessMode;
import com.herzen.unlock.parser.RuleParser;
import com.herzen.unlock.parser.RulesDocumentReader;
import com.herzen.unlock.parser.RulesDocumentReader.RulesDocument;
import com.herzen.unlock.parser.TokenParseException;
import com.herzen.unlock.service.ModuleGraphService;
import com.herzen.unlock.service.ModuleGraphService.ModuleBuildRequest;
import com.herzen.unlock.validation.Diagnostic;
import com.herzen.unlock.validation.RuleImportException;
import com.herzen.unlock.validation.UnsupportedModuleException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;

@RestController
@RequestMapping("/api/modules")
public class ModuleGraphController {
    private final ModuleGraphService graphService;
    private final GraphQueryService queryService;
    private final RulesDocumentReader rulesReader;
    private final RuleParser ruleParser;

    public ModuleGraphController(ModuleGraphService graphService,
                                 GraphQueryService queryService,
                                 RulesDocumentReader rulesReader,
                                 RuleParser ruleParser) {
        this.graphService = graphService;
        this.queryService = queryService;
        this.rulesReader = rulesReader;
        this.ruleParser = ruleParser;
    }

    @PostMapping("/supported")
    public ResponseEntity<Set<String>> supportedModules(@RequestBody GraphRequest request) {
        RulesDocument rules = rulesReader.read(request.rules());
        return ResponseEntity.ok(graphService.supportedModules(rules, request.catalogModuleIds(), request.observedModuleIds()));
    }

    @PostMapping("/{moduleId}/graph")
    public ResponseEntity<BuildResult> graph(@PathVariable String moduleId, @RequestBody GraphRequest request) {
        return ResponseEntity.ok(build(moduleId, request));
    }

    @PostMapping("/{moduleId}/units/{unitId}/ancestors")
    public ResponseEntity<DependencyGraphModels.Traversal> ancestors(@PathVariable String moduleId,
                                                                     @PathVariable String unitId,
                                                                     @RequestBody GraphRequest request) {
        return ResponseEntity.ok(queryService.ancestors(build(moduleId, request).graph(), unitId));
    }

    @PostMapping("/{moduleId}/units/{unitId}/descendants")
    public ResponseEntity<DependencyGraphModels.Traversal> descendants(@PathVariable String moduleId,
                                                                       @PathVariable String unitId,
                                                                       @RequestBody GraphRequest request) {
        return ResponseEntity.ok(queryService.descendants(build(moduleId, request).graph(), unitId));
    }

    @PostMapping("/{moduleId}/units/{unitId}/focus")
    public ResponseEntity<DependencyGraphModels.Focus> focus(@PathVariable String moduleId,
                                                             @PathVariable String unitId,
                                                             @RequestBody GraphRequest request) {
        return ResponseEntity.ok(queryService.focusNeighborhood(build(moduleId, request).graph(), unitId));
    }

    @GetMapping("/requirements/parse")
    public ResponseEntity<ParserDtos.Requirement> parseRequirement(@RequestParam String token) {
        return ResponseEntity.ok(ruleParser.parseRequirement(token));
    }

    @ExceptionHandler(UnsupportedModuleException.class)
    public ResponseEntity<ErrorResponse> unsupportedModule(UnsupportedModuleException e) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ErrorResponse("UNSUPPORTED_MODULE", e.getMessage(), List.of(e.toDiagnostic())));
    }

    @ExceptionHandler(RuleImportException.class)
    public ResponseEntity<ErrorResponse> ruleImport(RuleImportException e) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ErrorResponse("RULE_IMPORT_ABORTED", e.getMessage(), e.getDiagnostics()));
    }

    @ExceptionHandler({TokenParseException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> badInput(RuntimeException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse("BAD_REQUEST", e.getMessage(), List.of()));
    }

    private BuildResult build(String moduleId, GraphRequest request) {
        RulesDocument rules = rulesReader.read(request.rules());
        Set<String> supported = graphService.supportedModules(rules, request.catalogModuleIds(), request.observedModuleIds());
        BuildResult result = graphService.buildModuleGraph(
                ModuleBuildRequest.from(rules, moduleId, supported, request.strictness(), request.enrichment()));

        Graph graph = result.graph();
        if (request.objectiveIds() != null && !request.objectiveIds().isEmpty()) {
            graph = queryService.filterByObjectives(graph, request.objectiveIds());
        }
        if (request.overlayRows() != null && !request.overlayRows().isEmpty()) {
            graph = graphService.withOverlay(graph, request.overlayRows(), request.overlayStart(), request.overlayEnd());
        }
        return new BuildResult(graph, result.diagnostics());
    }

    public record GraphRequest(JsonNode rules,
                               Set<String> catalogModuleIds,
                               Set<String> observedModuleIds,
                               StrictnessMode strictness,
                               Map<String, Map<String, Double>> enrichment,
                               List<String> objectiveIds,
                               List<DailyActivityMetric> overlayRows,
                               LocalDate overlayStart,
                               LocalDate overlayEnd) {}

    public record ErrorResponse(String code, String message, List<Diagnostic> diagnostics) {}
}
