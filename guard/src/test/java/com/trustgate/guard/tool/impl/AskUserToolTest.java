package com.trustgate.guard.tool.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trustgate.guard.audit.AuditKind;
import com.trustgate.guard.audit.RecordingAuditEmitter;
import com.trustgate.guard.policy.WritePolicy;
import com.trustgate.guard.tool.ToolResult;
import com.trustgate.guard.tool.ToolSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AskUserToolTest {

    ObjectMapper          json = new ObjectMapper();
    HumanPrompter         prompter;
    RecordingAuditEmitter audit;
    AskUserTool           tool;

    @BeforeEach
    void setUp() {
        prompter = mock(HumanPrompter.class);
        audit    = new RecordingAuditEmitter();
        tool     = new AskUserTool(prompter, audit);
    }

    private ToolSession session(boolean interactive) {
        return new ToolSession("s-1", Path.of("/work"), WritePolicy.unrestricted(), interactive, "", null, null,
                Instant.EPOCH);
    }

    @Test
    void nonInteractive_noOptions_answersYesWithoutPrompting() throws Exception {
        ToolResult result = tool.execute(json.readTree("{\"question\":\"Continue?\"}"), session(false));

        assertThat(result.output()).isEqualTo("yes");
        assertThat(audit.events().get(0).kind()).isEqualTo(AuditKind.AUTO_ANSWER);
        assertThat(audit.events().get(0).body()).isEqualTo("Auto: Continue? -> yes");
        verify(prompter, never()).ask(anyString(), anyList());
    }

    @Test
    void interactive_noConsole_answersDefault() throws Exception {
        when(prompter.available()).thenReturn(false);

        ToolResult result = tool.execute(json.readTree("{\"question\":\"Pick\",\"options\":[\"a\",\"b\"]}"), session(true));

        assertThat(result.output()).isEqualTo("a");
        assertThat(audit.events().get(0).body()).startsWith("Auto (no console):");
        verify(prompter, never()).ask(anyString(), anyList());
    }

    @Test
    void interactive_withConsole_returnsHumanAnswer() throws Exception {
        when(prompter.available()).thenReturn(true);
        when(prompter.ask(any(), any())).thenReturn("b");

        ToolResult result = tool.execute(json.readTree("{\"question\":\"Pick\",\"options\":[\"a\",\"b\"]}"), session(true));

        assertThat(result.output()).isEqualTo("b");
        assertThat(audit.kinds()).containsExactly(AuditKind.QUESTION);
        verify(prompter).ask("Pick", List.of("a", "b"));
    }
}
