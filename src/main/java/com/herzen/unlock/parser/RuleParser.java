package com.herzen.unlock.parser;

import com.herzen.unlock.domain.DomainModels.EdgeKind;
import com.herzen.unlock.domain.DomainModels.Threshold;
import com.herzen.unlock.validation.Diagnostic;
import com.herzen.unlock.validation.DiagnosticType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Pattern;

import static com.herzen.unlock.parser.ParserDtos.*;

/**
 * Requirement token grammar: {@code CODE}, {@code CODE@P%}, {@code CODE(P%)} and {@code CODE#L}.
 */
@Slf4j
@Component
public class RuleParser {
    private static final Pattern CODE_PATTERN = Pattern.compile("[A-Za-z0-9_.:-]+");
    private static final Pattern NUMBER_PATTERN = Pattern.compile("-?(?:\\d+(?:\\.\\d+)?|\\.\\d+)");
    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[,;\\s]+");
    private static final Pattern SPACE_AROUND_SUFFIX = Pattern.compile("\\s*([@#(])\\s*");
    private static final Pattern SPACE_BEFORE_CLOSE = Pattern.compile("\\s+([%)])");

    public Requirement parseRequirement(String token) {
        if (token == null || token.isBlank()) {
            throw new TokenParseException(String.valueOf(token), "Empty requirement token");
        }
        String text = token.trim();

        int at = text.indexOf('@');
        if (at >= 0) {
            return withSuccessRate(text, text.substring(0, at), text.substring(at + 1));
        }
        int paren = text.indexOf('(');
        if (paren >= 0) {
            if (!text.endsWith(")")) throw new TokenParseException(text, "Unclosed threshold parenthesis");
            return withSuccessRate(text, text.substring(0, paren), text.substring(paren + 1, text.length() - 1));
        }
        int hash = text.indexOf('#');
        if (hash >= 0) {
            return withLevel(text, text.substring(0, hash), text.substring(hash + 1));
        }
        return new Requirement(code(text, text), null);
    }

    public RuleParseResult parseRulePayload(RawRulePayload raw) {
        List<Diagnostic> errors = new ArrayList<>();
        String target = raw.targetCode() == null ? "" : raw.targetCode().trim();
        if (target.isEmpty() || !CODE_PATTERN.matcher(target).matches()) {
            errors.add(Diagnostic.of(DiagnosticType.TOKEN_PARSE_ERROR, target,
                    "Rule payload has a missing or malformed target code"));
            return new RuleParseResult(List.of(), errors);
        }

        List<RuleSpec> specs = List.of(
                toSpec(raw, target, EdgeKind.ACTIVATION, raw.activationRequirements(), errors),
                toSpec(raw, target, EdgeKind.DEACTIVATION, raw.deactivationRequirements(), errors));
        return new RuleParseResult(specs, errors);
    }

    public RuleParseResult parseAll(Collection<RawRulePayload> payloads) {
        List<RuleSpec> specs = new ArrayList<>();
        List<Diagnostic> errors = new ArrayList<>();
        for (RawRulePayload payload : payloads) {
            RuleParseResult result = parseRulePayload(payload);
            specs.addAll(result.specs());
            errors.addAll(result.errors());
        }
        return new RuleParseResult(specs, errors);
    }

    private RuleSpec toSpec(RawRulePayload raw, String target, EdgeKind direction, List<String> entries, List<Diagnostic> errors) {
        LinkedHashSet<Requirement> requirements = new LinkedHashSet<>();
        for (String entry : entries) {
            for (String token : splitTokens(entry)) {
                try {
                    requirements.add(parseRequirement(token));
                } catch (TokenParseException e) {
                    log.debug("Skipping requirement of {} ({}): {}", target, direction.wire(), e.getMessage());
                    errors.add(Diagnostic.of(DiagnosticType.TOKEN_PARSE_ERROR,
                            target + ":" + direction.wire() + ":" + e.getToken(), e.getMessage()));
                }
            }
        }
        return new RuleSpec(target, direction, List.copyOf(requirements), raw.initiallyOpen(), raw.kind(), raw.objective(), raw.label());
    }

    private List<String> splitTokens(String entry) {
        if (entry == null || entry.isBlank()) return Collections.singletonList(entry == null ? "" : entry);
        String compact = SPACE_BEFORE_CLOSE.matcher(SPACE_AROUND_SUFFIX.matcher(entry.trim()).replaceAll("$1")).replaceAll("$1");
        return Arrays.stream(TOKEN_SEPARATOR.split(compact)).filter(t -> !t.isEmpty()).toList();
    }

    private Requirement withSuccessRate(String token, String code, String suffix) {
        String text = suffix.trim();
        if (!text.endsWith("%")) throw new TokenParseException(token, "Success-rate threshold must end with '%'");
        String number = text.substring(0, text.length() - 1).trim();
        if (!NUMBER_PATTERN.matcher(number).matches()) {
            throw new TokenParseException(token, "Malformed success-rate percentage");
        }
        double percent = Double.parseDouble(number);
        if (percent < 0.0 || percent > 100.0) {
            throw new TokenParseException(token, "Success-rate percentage outside [0,100]");
        }
        double value = Math.min(1.0, Math.max(0.0, percent / 100.0));
        return new Requirement(code(token, code), Threshold.successRate(value));
    }

    private Requirement withLevel(String token, String code, String suffix) {
        String number = suffix.trim();
        if (!NUMBER_PATTERN.matcher(number).matches()) {
            throw new TokenParseException(token, "Malformed level threshold");
        }
        if (number.contains(".")) throw new TokenParseException(token, "Level threshold must be an integer");
        if (number.startsWith("-")) throw new TokenParseException(token, "Level threshold must not be negative");
        try {
            return new Requirement(code(token, code), Threshold.level(Integer.parseInt(number)));
        } catch (NumberFormatException e) {
            throw new TokenParseException(token, "Level threshold out of range");
        }
    }

    private String code(String token, String raw) {
        String code = raw.trim();
        if (code.isEmpty()) throw new TokenParseException(token, "Empty unit code");
        if (!CODE_PATTERN.matcher(code).matches()) throw new TokenParseException(token, "Unrecognized unit code");
        return code;
    }
}
