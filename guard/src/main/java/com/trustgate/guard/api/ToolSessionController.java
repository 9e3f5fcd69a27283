package com.trustgate.guard.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.trustgate.guard.api.dto.CreateSessionRequest;
import com.trustgate.guard.api.dto.SessionResponse;
import com.trustgate.guard.api.dto.ToolCallResponse;
import com.trustgate.guard.tool.ToolRegistry;
import com.trustgate.guard.tool.ToolResult;
import com.trustgate.guard.tool.ToolSession;
import com.trustgate.guard.tool.ToolSessionManager;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;

/**
 * REST API through which the orchestrator drives an agent's tool calls.
 *
 * <pre>
 * POST   /sessions                     open a session for one agent role
 * GET    /sessions/{id}/tools          JSON function definitions for that session
 * POST   /sessions/{id}/tools/{tool}   call a tool; body is its JSON arguments
 * DELETE /sessions/{id}                close the session
 * </pre>
 */
@RestController
@RequestMapping("/sessions")
public class ToolSessionController {

    private final ToolSessionManager sessionManager;
    private final ToolRegistry       toolRegistry;

    public ToolSessionController(ToolSessionManager sessionManager, ToolRegistry toolRegistry) {
        this.sessionManager = sessionManager;
        this.toolRegistry   = toolRegistry;
    }

    /**
     * Open a session.
     *
     * Example:
     *   curl -X POST http://localhost:8090/sessions \
     *     -H "Content-Type: application/json" \
     *     -d '{"workdir":"/work/app","ownedFiles":["src/app.py"],"denyTestPatterns":true}'
     *
     * Returns 400 if the working directory or a policy path cannot be resolved.
     */
    @PostMapping
    public ResponseEntity<SessionResponse> open(@RequestBody CreateSessionRequest req) {
        ToolSession session;
        try {
            session = sessionManager.open(req.toSpec());
        } catch (IllegalArgumentException | IOException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(SessionResponse.from(session, toolRegistry.availableTools(session)));
    }

    @GetMapping("/{id}/tools")
    public JsonNode tools(@PathVariable String id) {
        return toolRegistry.definitions(requireSession(id));
    }

    /**
     * Call a tool. Policy, quota and I/O failures are reported in the body
     * with HTTP 200; only an unknown session or tool is a 404.
     */
    @PostMapping("/{id}/tools/{tool}")
    public ToolCallResponse call(@PathVariable String id,
                                 @PathVariable String tool,
                                 @RequestBody(required = false) JsonNode arguments) {
        ToolSession session = requireSession(id);
        if (toolRegistry.find(tool).isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Tool not found: " + tool);
        }
        ToolResult result = toolRegistry.execute(tool, arguments, session);
        return ToolCallResponse.from(tool, result);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> close(@PathVariable String id) {
        if (!sessionManager.close(id)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found: " + id);
        }
        return ResponseEntity.noContent().build();
    }

    private ToolSession requireSession(String id) {
        return sessionManager.find(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found: " + id));
    }
}
