package com.herzen.unlock.parser;

import com.herzen.unlock.domain.DomainModels.EdgeKind;
import com.herzen.unlock.domain.DomainModels.Threshold;
import com.herzen.unlock.domain.DomainModels.UnitKind;
import com.herzen.unlock.validation.Diagnostic;

import java.util.List;

public class ParserDtos {
    public record RawRulePayload(String targetCode,
                                 List<String> activationRequirements,
                                 List<String> deactivationRequirements,
                                 boolean initiallyOpen,
                                 UnitKind kind,
                                 String objective,
                                 String label) {
        public RawRulePayload {
            activationRequirements = activationRequirements == null ? List.of() : List.copyOf(activationRequirements);
            deactivationRequirements = deactivationRequirements == null ? List.of() : List.copyOf(deactivationRequirements);
        }

        public static RawRulePayload of(String targetCode, List<String> activation, List<String> deactivation, boolean initiallyOpen) {
            return new RawRulePayload(targetCode, activation, deactivation, initiallyOpen, null, null, null);
        }
    }

    public record Requirement(String sourceCode, Threshold threshold) {}

    public record RuleSpec(String targetCode,
                           EdgeKind direction,
                           List<Requirement> requirements,
                           boolean initiallyOpen,
                           UnitKind kind,
                           String objective,
                           String label) {
        public RuleSpec {
            requirements = List.copyOf(requirements);
        }
    }

    public record RuleParseResult(List<RuleSpec> specs, List<Diagnostic> errors) {}

    public enum StrictnessMode { LENIENT, STRICT }
}
