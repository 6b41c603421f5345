package com.herzen.unlock.validation;

public record Diagnostic(DiagnosticType type, String message, String subject) {
    public static Diagnostic of(DiagnosticType type, String subject, String message) {
        return new Diagnostic(type, message, subject);
    }
}
