package com.herzen.unlock.validation;

public enum DiagnosticType {
    TOKEN_PARSE_ERROR,
    AMBIGUOUS_CODE_RESOLUTION,
    UNRESOLVED_REFERENCE,
    UNSUPPORTED_MODULE,
    GRAPH_INTEGRITY_WARNING,
    SELF_LOOP_REJECTED,
    ENRICHMENT_UNUSED
}
