package com.herzen.unlock;

import com.herzen.unlock.domain.DomainModels.UnitKind;
import com.herzen.unlock.parser.ParserDtos.RawRulePayload;
import com.herzen.unlock.resolver.CodeIdResolver;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class GraphFixtures {
    private GraphFixtures() {
    }

    /** Every code resolves to an id equal to itself. */
    static CodeIdResolver identity(String... codes) {
        Map<String, String> map = new LinkedHashMap<>();
        Arrays.stream(codes).forEach(c -> map.put(c, c));
        return CodeIdResolver.ofSingle(map);
    }

    static RawRulePayload open(String target) {
        return RawRulePayload.of(target, List.of(), List.of(), true);
    }

    static RawRulePayload requires(String target, String... tokens) {
        return RawRulePayload.of(target, List.of(tokens), List.of(), false);
    }

    static RawRulePayload objective(String target, String... tokens) {
        return new RawRulePayload(target, List.of(tokens), List.of(), false, UnitKind.OBJECTIVE, null, null);
    }

    static RawRulePayload activity(String target, String objective, String... tokens) {
        return new RawRulePayload(target, List.of(tokens), List.of(), false, UnitKind.ACTIVITY, objective, null);
    }
}
