package com.herzen.unlock.resolver;

import com.herzen.unlock.domain.DomainModels.UnitKind;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class UnitCodes {
    private static final Pattern MODULE_CODE = Pattern.compile("^M\\d+$");
    private static final Pattern OBJECTIVE_CODE = Pattern.compile("^(M\\d+O\\d+)$");
    private static final Pattern ACTIVITY_CODE = Pattern.compile("^(M\\d+O\\d+)A(\\d+)$");

    private static final Comparator<String> PREFERRED = Comparator
            .comparingInt(UnitCodes::shapeRank)
            .thenComparing(Comparator.comparingInt(String::length).reversed())
            .thenComparing(Comparator.naturalOrder());

    private UnitCodes() {
    }

    public static Optional<UnitKind> kindOf(String code) {
        if (code == null) return Optional.empty();
        String trimmed = code.trim();
        if (ACTIVITY_CODE.matcher(trimmed).matches()) return Optional.of(UnitKind.ACTIVITY);
        if (OBJECTIVE_CODE.matcher(trimmed).matches()) return Optional.of(UnitKind.OBJECTIVE);
        return Optional.empty();
    }

    public static Optional<String> objectiveCodeOf(String activityCode) {
        if (activityCode == null) return Optional.empty();
        Matcher matcher = ACTIVITY_CODE.matcher(activityCode.trim());
        return matcher.matches() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    public static Integer activityIndexOf(String code) {
        if (code == null) return null;
        Matcher matcher = ACTIVITY_CODE.matcher(code.trim());
        if (!matcher.matches()) return null;
        try {
            return Integer.valueOf(matcher.group(2));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static boolean isModuleCode(String code) {
        return code != null && MODULE_CODE.matcher(code.trim()).matches();
    }

    public static Optional<String> preferredCode(List<String> codes) {
        return codes.stream()
                .filter(c -> c != null && !c.isBlank())
                .map(String::trim)
                .min(PREFERRED);
    }

    // M2 before M10; non-numeric and oversized module codes sort last
    public static Comparator<String> moduleOrder() {
        return Comparator.comparingLong(UnitCodes::moduleNumber).thenComparing(Comparator.naturalOrder());
    }

    private static long moduleNumber(String code) {
        if (!isModuleCode(code)) return Long.MAX_VALUE;
        try {
            return Long.parseLong(code.trim().substring(1));
        } catch (NumberFormatException e) {
            return Long.MAX_VALUE;
        }
    }

    private static int shapeRank(String code) {
        if (ACTIVITY_CODE.matcher(code).matches()) return 0;
        if (OBJECTIVE_CODE.matcher(code).matches()) return 1;
        if (MODULE_CODE.matcher(code).matches()) return 2;
        return 3;
    }
}
