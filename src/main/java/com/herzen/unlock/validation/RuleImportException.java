package com.herzen.unlock.validation;

import java.util.List;

/**
 * Raised when a strict build meets a requirement token it cannot parse.
 */
public class RuleImportException extends RuntimeException {
    private final String moduleId;
    private final List<Diagnostic> diagnostics;

    public RuleImportException(String moduleId, List<Diagnostic> diagnostics) {
        super("Rule import for module " + moduleId + " aborted: " + diagnostics.size() + " malformed requirement(s)");
        this.moduleId = moduleId;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public String getModuleId() {
        return moduleId;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
