package com.herzen.unlock.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

public class DomainModels {
    public enum UnitKind {
        ACTIVITY, OBJECTIVE;

        @JsonValue
        public String wire() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static UnitKind fromWire(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    public enum EdgeKind {
        ACTIVATION, DEACTIVATION;

        @JsonValue
        public String wire() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static EdgeKind fromWire(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    public enum ThresholdMetric {
        SUCCESS_RATE, LEVEL;

        @JsonValue
        public String wire() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static ThresholdMetric fromWire(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    public record Threshold(ThresholdMetric metric, double value) {
        public static Threshold successRate(double value) {
            return new Threshold(ThresholdMetric.SUCCESS_RATE, value);
        }

        public static Threshold level(int value) {
            return new Threshold(ThresholdMetric.LEVEL, value);
        }

        public boolean stricterThan(Threshold other) {
            if (other == null) return true;
            return metric == other.metric && value > other.value;
        }
    }

    public record Overlay(Double attempts, Double successRate, Double repeatAttemptRate) {}

    public record Unit(String id,
                       UnitKind kind,
                       String moduleId,
                       String code,
                       String label,
                       String objectiveId,
                       Integer activityIndex,
                       boolean initiallyOpen,
                       @JsonProperty("is_ghost") boolean ghost,
                       Overlay overlay) {

        public String owningObjectiveId() {
            return kind == UnitKind.OBJECTIVE ? id : objectiveId;
        }

        public Unit withOverlay(Overlay value) {
            return new Unit(id, kind, moduleId, code, label, objectiveId, activityIndex, initiallyOpen, ghost, value);
        }

        public Unit withModuleId(String value) {
            return new Unit(id, kind, value, code, label, objectiveId, activityIndex, initiallyOpen, ghost, overlay);
        }

        public Unit opened() {
            return new Unit(id, kind, moduleId, code, label, objectiveId, activityIndex, true, ghost, overlay);
        }
    }

    public record Dependency(String fromId,
                             String toId,
                             EdgeKind kind,
                             Threshold threshold,
                             String sourceCode,
                             Map<String, Double> enrichment,
                             @JsonProperty("is_inferred") boolean inferred) {
        public Dependency {
            enrichment = enrichment == null ? Map.of() : enrichment.entrySet().stream()
                    .filter(e -> e.getKey() != null && e.getValue() != null)
                    .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));
        }

        public static Dependency of(String fromId, String toId, EdgeKind kind, Threshold threshold, String sourceCode) {
            return new Dependency(fromId, toId, kind, threshold, sourceCode, Map.of(), false);
        }

        public static Dependency bridge(String objectiveId, String activityId) {
            return new Dependency(objectiveId, activityId, EdgeKind.ACTIVATION, null, null, Map.of(), true);
        }

        public EdgeKey key() {
            return new EdgeKey(fromId, toId, kind);
        }

        public Dependency withEnrichment(Map<String, Double> value) {
            return new Dependency(fromId, toId, kind, threshold, sourceCode, value, inferred);
        }
    }

    public record EdgeKey(String fromId, String toId, EdgeKind kind) {}
}
