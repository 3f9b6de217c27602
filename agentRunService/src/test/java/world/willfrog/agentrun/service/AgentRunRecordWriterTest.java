package world.willfrog.agentrun.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import world.willfrog.agentrun.config.AgentRunProperties;
import world.willfrog.agentrun.entity.AgentRun;
import world.willfrog.agentrun.mapper.AgentRunMapper;
import world.willfrog.agentrun.model.AgentRunStatus;
import world.willfrog.agentrun.model.event.ResponseEventCodec;
import world.willfrog.agentrun.model.event.StatusEvent;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AgentRunRecordWriterTest {

    private static final OffsetDateTime COMPLETED_AT = OffsetDateTime.parse("2026-01-01T00:05:00Z");

    @Mock
    private AgentRunMapper agentRunMapper;

    private AgentRunRecordWriter writer;

    @BeforeEach
    void setUp() {
        AgentRunProperties properties = new AgentRunProperties();
        properties.getDb().setInitialBackoff(Duration.ofMillis(1));
        writer = new AgentRunRecordWriter(agentRunMapper, new ResponseEventCodec(new ObjectMapper()), properties);
    }

    @Test
    void writeTerminal_shouldRetryAfterDatabaseError() {
        when(agentRunMapper.updateTerminal(eq("r1"), eq("completed"), eq(COMPLETED_AT), isNull(), anyString()))
                .thenThrow(new IllegalStateException("connection refused"))
                .thenReturn(1);
        when(agentRunMapper.findById("r1")).thenReturn(new AgentRun());

        boolean written = writer.writeTerminal("r1", AgentRunStatus.COMPLETED, COMPLETED_AT, null,
                List.of(StatusEvent.of("completed", null)));

        assertTrue(written);
        verify(agentRunMapper, times(2)).updateTerminal(eq("r1"), eq("completed"), eq(COMPLETED_AT), isNull(), anyString());
    }

    @Test
    void writeTerminal_shouldGiveUpAfterThreeAttempts() {
        when(agentRunMapper.updateTerminal(any(), any(), any(), any(), any()))
                .thenThrow(new IllegalStateException("down"));

        boolean written = writer.writeTerminal("r1", AgentRunStatus.FAILED, COMPLETED_AT, "boom", List.of());

        assertFalse(written);
        verify(agentRunMapper, times(3)).updateTerminal(eq("r1"), eq("failed"), eq(COMPLETED_AT), eq("boom"), isNull());
    }

    @Test
    void writeTerminal_shouldRetryWhenNoRowMatched() {
        when(agentRunMapper.updateTerminal(any(), any(), any(), any(), any())).thenReturn(0);

        assertFalse(writer.writeTerminal("missing", AgentRunStatus.STOPPED, COMPLETED_AT, null, null));
        verify(agentRunMapper, times(3)).updateTerminal(eq("missing"), eq("stopped"), eq(COMPLETED_AT), isNull(), isNull());
    }
}
