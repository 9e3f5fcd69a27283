package com.trustgate.guard.audit;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One audit record. {@code body} is always the complete payload; only
 * {@link #render()} applies {@code maxLines}.
 *
 * @param kind      event kind
 * @param label     block heading (e.g. "PATCH src/app.py"); null for single-line events
 * @param body      message (single-line events) or full block payload
 * @param maxLines  rendering limit for blocks; 0 means unlimited
 * @param sessionId owning tool session, if the event was emitted inside one
 * @param timestamp emission time
 */
public record AuditEvent(
        AuditKind kind,
        String    label,
        String    body,
        int       maxLines,
        String    sessionId,
        Instant   timestamp) {

    public AuditEvent {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public boolean isBlock() { return label != null; }

    /** Display form, truncated to {@code maxLines} with a trailing "... [N more lines]". */
    public String render() {
        if (!isBlock()) {
            return body;
        }
        List<String> lines = body.lines().toList();
        List<String> shown = new ArrayList<>();
        shown.add(label);
        if (maxLines > 0 && lines.size() > maxLines) {
            shown.addAll(lines.subList(0, maxLines));
            shown.add("... [" + (lines.size() - maxLines) + " more lines]");
        } else {
            shown.addAll(lines);
        }
        return String.join("\n", shown);
    }
}
