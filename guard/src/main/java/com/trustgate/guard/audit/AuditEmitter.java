package com.trustgate.guard.audit;

/**
 * The two verbs through which the guard reports what it did.
 *
 * Emission is fire-and-forget: implementations must never throw into the
 * operation being audited.
 */
public interface AuditEmitter {

    /** Single-line event: blocked-command warnings, change notifications. */
    void emit(AuditKind kind, String message);

    /**
     * Multi-line event: diffs, new-file content. {@code maxLines} limits
     * rendering only; the recorded body is never truncated.
     */
    void emitBlock(AuditKind kind, String label, String body, int maxLines);
}
