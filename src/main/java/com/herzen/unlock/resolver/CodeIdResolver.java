package com.herzen.unlock.resolver;

import java.util.*;

public final class CodeIdResolver {
    private final Map<String, List<String>> codeToIds;
    private final Map<String, List<String>> idToCodes;

    public CodeIdResolver(Map<String, List<String>> codeToIds, Map<String, List<String>> idToCodes) {
        this.codeToIds = normalize(codeToIds);
        Map<String, List<String>> inverse = normalize(idToCodes);
        if (inverse.isEmpty()) {
            inverse = invert(this.codeToIds);
        }
        this.idToCodes = inverse;
    }

    public static CodeIdResolver empty() {
        return new CodeIdResolver(Map.of(), Map.of());
    }

    public static CodeIdResolver ofSingle(Map<String, String> codeToId) {
        Map<String, List<String>> lists = new LinkedHashMap<>();
        codeToId.forEach((code, id) -> lists.put(code, List.of(id)));
        return new CodeIdResolver(lists, Map.of());
    }

    public List<String> resolveCode(String code) {
        if (code == null) return List.of();
        return codeToIds.getOrDefault(code.trim(), List.of());
    }

    public List<String> codesFor(String id) {
        if (id == null) return List.of();
        return idToCodes.getOrDefault(id.trim(), List.of());
    }

    public Optional<String> preferredCodeFor(String id) {
        return UnitCodes.preferredCode(codesFor(id));
    }

    public Set<String> codes() {
        return codeToIds.keySet();
    }

    private static Map<String, List<String>> normalize(Map<String, List<String>> raw) {
        if (raw == null || raw.isEmpty()) return Map.of();
        Map<String, List<String>> out = new LinkedHashMap<>();
        raw.forEach((key, values) -> {
            if (key == null || key.isBlank() || values == null) return;
            List<String> cleaned = values.stream()
                    .filter(v -> v != null && !v.isBlank())
                    .map(String::trim)
                    .distinct()
                    .sorted()
                    .toList();
            if (!cleaned.isEmpty()) {
                out.merge(key.trim(), cleaned, (a, b) -> {
                    TreeSet<String> merged = new TreeSet<>(a);
                    merged.addAll(b);
                    return List.copyOf(merged);
                });
            }
        });
        return Collections.unmodifiableMap(out);
    }

    private static Map<String, List<String>> invert(Map<String, List<String>> codeToIds) {
        Map<String, List<String>> inverse = new LinkedHashMap<>();
        codeToIds.forEach((code, ids) -> ids.forEach(id -> inverse.computeIfAbsent(id, k -> new ArrayList<>()).add(code)));
        return normalize(inverse);
    }
}
