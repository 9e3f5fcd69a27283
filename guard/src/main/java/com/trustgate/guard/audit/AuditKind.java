package com.trustgate.guard.audit;

/**
 * Fixed event vocabulary shared with the UI/telemetry collaborator, which
 * maps each kind to its own display semantics.
 */
public enum AuditKind {
    WRITE("TWRT"),
    EDIT("TEDT"),
    DIFF("KDIF"),
    CODE("KCOD"),
    WARNING("SWRN"),
    FILE_CHANGE("FCHG"),
    BASH("TBSH"),
    PACKAGE("TPKG"),
    QUESTION("UASK"),
    AUTO_ANSWER("UAUT");

    private final String code;

    AuditKind(String code) {
        this.code = code;
    }

    /** Four-letter wire code used in log lines and by event consumers. */
    public String code() { return code; }
}
