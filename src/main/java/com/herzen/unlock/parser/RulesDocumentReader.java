package com.herzen.unlock.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.herzen.unlock.domain.DomainModels.UnitKind;
import com.herzen.unlock.graph.DependencyGraphModels.CatalogActivity;
import com.herzen.unlock.graph.DependencyGraphModels.CatalogObjective;
import com.herzen.unlock.graph.DependencyGraphModels.ModuleCatalog;
import com.herzen.unlock.graph.DependencyGraphModels.TopologySnapshot;
import com.herzen.unlock.resolver.CodeIdResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

import static com.herzen.unlock.parser.ParserDtos.RawRulePayload;

/**
 * Turns an already-loaded rules document into typed payloads, the code/id resolver and topology snapshots.
 * <pre>
 * { "map_id_code": { "code_to_id": {...}, "id_to_codes": {...} },
 *   "module_rules": [ { "module_code": "M1", "rules": { "M1O1A2": { "activation_requirements": [...], ... } } } ],
 *   "dependency_topology": { "M1": { "nodes": [...], "edges": [...] } },
 *   "catalog": { "modules": [ { "code": "M1", "objectives": [ { "id": ..., "code": "M1O1", "activities": [...] } ] } ] } }
 * </pre>
 */
@Slf4j
@Component
public class RulesDocumentReader {
    private final ObjectMapper objectMapper;

    public RulesDocumentReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public RulesDocument read(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Rules document must be a JSON object");
        }
        CodeIdResolver resolver = readResolver(root.path("map_id_code"));

        Map<String, List<RawRulePayload>> payloads = new LinkedHashMap<>();
        JsonNode moduleRules = root.path("module_rules");
        if (!moduleRules.isMissingNode() && !moduleRules.isArray()) {
            throw new IllegalArgumentException("module_rules must be an array");
        }
        for (JsonNode module : moduleRules) {
            String moduleId = text(module.path("module_code"));
            if (moduleId == null) {
                log.warn("Skipping module_rules entry without module_code");
                continue;
            }
            payloads.computeIfAbsent(moduleId, k -> new ArrayList<>()).addAll(readPayloads(moduleId, module.path("rules")));
        }

        Map<String, TopologySnapshot> topology = new LinkedHashMap<>();
        JsonNode topologyNode = root.path("dependency_topology");
        if (topologyNode.isObject()) {
            topologyNode.fields().forEachRemaining(e -> topology.put(e.getKey(), readTopology(e.getKey(), e.getValue())));
        }

        Map<String, ModuleCatalog> catalog = readCatalog(root.path("catalog"));

        log.debug("Read rules document: codes={} modules={} topologies={} catalog modules={}",
                resolver.codes().size(), payloads.size(), topology.size(), catalog.size());
        return new RulesDocument(resolver, payloads, topology, catalog);
    }

    private CodeIdResolver readResolver(JsonNode mapIdCode) {
        if (mapIdCode.isMissingNode()) return CodeIdResolver.empty();
        if (!mapIdCode.isObject()) {
            throw new IllegalArgumentException("map_id_code must be an object");
        }
        return new CodeIdResolver(stringLists(mapIdCode.path("code_to_id"), "code_to_id"),
                stringLists(mapIdCode.path("id_to_codes"), "id_to_codes"));
    }

    private Map<String, List<String>> stringLists(JsonNode node, String field) {
        if (node.isMissingNode()) return Map.of();
        if (!node.isObject()) {
            throw new IllegalArgumentException("map_id_code." + field + " must be an object");
        }
        Map<String, List<String>> out = new LinkedHashMap<>();
        node.fields().forEachRemaining(e -> out.put(e.getKey(), strings(e.getValue())));
        return out;
    }

    private List<RawRulePayload> readPayloads(String moduleId, JsonNode rules) {
        List<RawRulePayload> out = new ArrayList<>();
        if (rules.isObject()) {
            rules.fields().forEachRemaining(e -> out.add(payload(e.getKey(), e.getValue())));
        } else if (rules.isArray()) {
            for (JsonNode rule : rules) {
                out.add(payload(text(rule.path("code")), rule));
            }
        } else if (!rules.isMissingNode()) {
            throw new IllegalArgumentException("rules of module " + moduleId + " must be an object or an array");
        }
        return out;
    }

    private RawRulePayload payload(String targetCode, JsonNode rule) {
        String kind = text(rule.path("kind"));
        return new RawRulePayload(targetCode,
                strings(rule.path("activation_requirements")),
                strings(rule.path("deactivation_requirements")),
                rule.path("initially_open").asBoolean(false),
                kind == null ? null : UnitKind.fromWire(kind),
                text(rule.path("objective")),
                text(rule.path("label")));
    }

    private Map<String, ModuleCatalog> readCatalog(JsonNode catalog) {
        if (catalog.isMissingNode() || catalog.isNull()) return Map.of();
        JsonNode modules = catalog.path("modules");
        if (!catalog.isObject() || !modules.isArray()) {
            throw new IllegalArgumentException("catalog must be an object with a modules array");
        }
        Map<String, ModuleCatalog> out = new LinkedHashMap<>();
        for (JsonNode module : modules) {
            String moduleId = text(module.path("code"));
            if (moduleId == null) {
                log.warn("Skipping catalog module without code");
                continue;
            }
            List<CatalogObjective> objectives = new ArrayList<>();
            for (JsonNode objective : module.path("objectives")) {
                List<CatalogActivity> activities = new ArrayList<>();
                for (JsonNode activity : objective.path("activities")) {
                    activities.add(new CatalogActivity(text(activity.path("id")), text(activity.path("code")), label(activity)));
                }
                objectives.add(new CatalogObjective(text(objective.path("id")), text(objective.path("code")), label(objective), activities));
            }
            out.put(moduleId, new ModuleCatalog(objectives));
        }
        return out;
    }

    private String label(JsonNode entry) {
        String label = text(entry.path("label"));
        if (label != null) return label;
        JsonNode title = entry.path("title");
        return Optional.ofNullable(text(title.path("short"))).orElseGet(() -> text(title.path("long")));
    }

    private TopologySnapshot readTopology(String moduleId, JsonNode node) {
        try {
            return objectMapper.treeToValue(node, TopologySnapshot.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("dependency_topology of module " + moduleId + " is malformed", e);
        }
    }

    private List<String> strings(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) return List.of();
        if (node.isArray()) {
            List<String> out = new ArrayList<>();
            node.forEach(item -> out.add(item.isNull() ? "" : item.asText()));
            return out;
        }
        return List.of(node.asText());
    }

    private String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) return null;
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }

    public record RulesDocument(CodeIdResolver resolver,
                                Map<String, List<RawRulePayload>> payloadsByModule,
                                Map<String, TopologySnapshot> topologyByModule,
                                Map<String, ModuleCatalog> catalogByModule) {
        public Set<String> moduleIds() {
            Set<String> ids = new LinkedHashSet<>(payloadsByModule.keySet());
            ids.addAll(topologyByModule.keySet());
            return ids;
        }

        public List<RawRulePayload> payloads(String moduleId) {
            return payloadsByModule.getOrDefault(moduleId, List.of());
        }

        public TopologySnapshot topology(String moduleId) {
            return topologyByModule.get(moduleId);
        }

        public ModuleCatalog catalog(String moduleId) {
            return catalogByModule.get(moduleId);
        }

        public Set<String> catalogModuleIds() {
            return catalogByModule.keySet();
        }
    }
}
