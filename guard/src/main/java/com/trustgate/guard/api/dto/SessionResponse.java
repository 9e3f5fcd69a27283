package com.trustgate.guard.api.dto;

import com.trustgate.guard.tool.ToolSession;

import java.time.Instant;
import java.util.List;

/** Response body for POST /sessions. {@code tools} are the tools this session may call. */
public record SessionResponse(
        String       id,
        String       workdir,
        boolean      interactive,
        boolean      unrestricted,
        List<String> tools,
        Instant      createdAt
) {
    public static SessionResponse from(ToolSession session, List<String> tools) {
        return new SessionResponse(
                session.id(),
                session.workdir().toString(),
                session.interactive(),
                session.policy().ownership().isUnrestricted(),
                tools,
                session.createdAt()
        );
    }
}
