package com.herzen.unlock.validation;

import java.util.Set;

public class UnsupportedModuleException extends RuntimeException {
    private final String moduleId;

    public UnsupportedModuleException(String moduleId, Set<String> supportedModules) {
        super("Module " + moduleId + " is not covered by rules, catalog and observed data; supported: " + supportedModules);
        this.moduleId = moduleId;
    }

    public String getModuleId() {
        return moduleId;
    }

    public Diagnostic toDiagnostic() {
        return Diagnostic.of(DiagnosticType.UNSUPPORTED_MODULE, moduleId, getMessage());
    }
}
