package com.trustgate.guard.tool.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.trustgate.guard.audit.AuditEmitter;
import com.trustgate.guard.audit.AuditKind;
import com.trustgate.guard.tool.*;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Asks the human operator a question. Only offered to interactive sessions;
 * if called anyway, or when no console is attached, the default answer (first
 * option, else "yes") is returned immediately and recorded as AUTO_ANSWER.
 */
@Component
public class AskUserTool implements Tool {

    private static final ToolManifest MANIFEST = new ToolManifest(
            "ask_user", "1.0.0",
            "Ask the user a question and wait for the answer. Offer options when the choice is closed.",
            ToolAccess.INTERACT,
            List.of(ToolParameter.required("question", "string", "The question to ask."),
                    ToolParameter.optional("options", "array", "Possible answers; the first is the default.")));

    private final HumanPrompter prompter;
    private final AuditEmitter  audit;

    public AskUserTool(HumanPrompter prompter, AuditEmitter audit) {
        this.prompter = prompter;
        this.audit    = audit;
    }

    @Override public ToolManifest manifest() { return MANIFEST; }

    @Override
    public ToolResult execute(JsonNode args, ToolSession session) {
        String       question = ToolArguments.requireString(args, "question");
        List<String> options  = ToolArguments.optionalStringList(args, "options");
        String       fallback = options.isEmpty() ? "yes" : options.get(0);

        if (!session.interactive()) {
            audit.emit(AuditKind.AUTO_ANSWER, "Auto: " + question + " -> " + fallback);
            return ToolResult.ok(fallback);
        }
        if (!prompter.available()) {
            audit.emit(AuditKind.AUTO_ANSWER, "Auto (no console): " + question + " -> " + fallback);
            return ToolResult.ok(fallback);
        }
        audit.emit(AuditKind.QUESTION, question);
        return ToolResult.ok(prompter.ask(question, options));
    }
}
