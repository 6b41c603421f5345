package com.herzen.unlock.overlay;

import com.herzen.unlock.domain.DomainModels.Overlay;
import com.herzen.unlock.domain.DomainModels.Unit;
import com.herzen.unlock.graph.DependencyGraphModels.Graph;
import com.herzen.unlock.overlay.OverlayModels.DailyActivityMetric;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Component
public class OverlayMerger {

    public Graph mergeOverlays(Graph graph, Map<String, Overlay> metricsByUnitId) {
        Map<String, Overlay> metrics = metricsByUnitId == null ? Map.of() : metricsByUnitId;
        Map<String, Unit> nodes = new LinkedHashMap<>();
        graph.nodes().forEach((id, unit) -> nodes.put(id, unit.withOverlay(unit.ghost() ? null : metrics.get(id))));
        log.debug("Merged overlays for module {}: {} of {} units matched",
                graph.moduleId(), nodes.values().stream().filter(u -> u.overlay() != null).count(), nodes.size());
        return new Graph(graph.moduleId(), nodes, graph.edges());
    }

    public Map<String, Overlay> aggregateDaily(List<DailyActivityMetric> rows, String moduleId, LocalDate start, LocalDate end) {
        if (start != null && end != null && start.isAfter(end)) {
            throw new IllegalArgumentException("Overlay window start " + start + " is after end " + end);
        }
        List<DailyActivityMetric> window = rows.stream()
                .filter(Objects::nonNull)
                .filter(r -> Objects.equals(moduleId, r.moduleId()))
                .filter(r -> r.date() != null)
                .filter(r -> start == null || !r.date().isBefore(start))
                .filter(r -> end == null || !r.date().isAfter(end))
                .toList();

        Map<String, Overlay> out = new LinkedHashMap<>();
        out.putAll(weighted(window, DailyActivityMetric::activityId));
        out.putAll(weighted(window, DailyActivityMetric::objectiveId));
        return out;
    }

    private Map<String, Overlay> weighted(List<DailyActivityMetric> rows, Function<DailyActivityMetric, String> key) {
        Map<String, List<DailyActivityMetric>> grouped = rows.stream()
                .filter(r -> key.apply(r) != null)
                .collect(Collectors.groupingBy(key, LinkedHashMap::new, Collectors.toList()));

        Map<String, Overlay> out = new LinkedHashMap<>();
        grouped.forEach((id, group) -> {
            double attempts = group.stream().mapToLong(DailyActivityMetric::attempts).sum();
            if (attempts <= 0) {
                out.put(id, new Overlay(attempts, null, null));
                return;
            }
            double success = group.stream().mapToDouble(r -> r.successRate() * r.attempts()).sum() / attempts;
            double repeat = group.stream().mapToDouble(r -> r.repeatAttemptRate() * r.attempts()).sum() / attempts;
            out.put(id, new Overlay(attempts, success, repeat));
        });
        return out;
    }
}
