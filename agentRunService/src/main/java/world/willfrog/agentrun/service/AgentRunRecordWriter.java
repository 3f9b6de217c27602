package world.willfrog.agentrun.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import world.willfrog.agentrun.config.AgentRunProperties;
import world.willfrog.agentrun.entity.AgentRun;
import world.willfrog.agentrun.mapper.AgentRunMapper;
import world.willfrog.agentrun.model.AgentRunStatus;
import world.willfrog.agentrun.model.event.ResponseEvent;
import world.willfrog.agentrun.model.event.ResponseEventCodec;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * 把 run 终态写入 agent_runs，失败按指数退避重试。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentRunRecordWriter {

    private final AgentRunMapper agentRunMapper;
    private final ResponseEventCodec codec;
    private final AgentRunProperties properties;

    /**
     * @param error     为空时写入 NULL
     * @param responses 为空时保留库里已有的 responses
     * @return 是否写入成功
     */
    public boolean writeTerminal(String runId,
                                 AgentRunStatus status,
                                 OffsetDateTime completedAt,
                                 String error,
                                 List<ResponseEvent> responses) {
        String responsesJson;
        try {
            responsesJson = responses == null || responses.isEmpty() ? null : codec.toJsonArray(responses);
        } catch (Exception e) {
            log.error("Encode responses failed, keep stored responses: runId={}", runId, e);
            responsesJson = null;
        }

        int maxAttempts = Math.max(1, properties.getDb().getMaxAttempts());
        Duration backoff = properties.getDb().getInitialBackoff();
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            try {
                int updated = agentRunMapper.updateTerminal(runId, status.wireName(), completedAt, error, responsesJson);
                if (updated > 0) {
                    log.info("Updated agent run status: runId={}, status={}, attempt={}", runId, status.wireName(), attempt);
                    verify(runId);
                    return true;
                }
                log.warn("Agent run status update matched no row: runId={}, attempt={}", runId, attempt);
            } catch (Exception e) {
                log.error("Database error updating agent run status: runId={}, attempt={}, error={}",
                        runId, attempt, e.getMessage());
            }
            if (attempt < maxAttempts - 1 && !sleep(backoff.multipliedBy(1L << attempt))) {
                break;
            }
        }
        log.error("Failed to update agent run status after all retries: runId={}, status={}", runId, status.wireName());
        return false;
    }

    private void verify(String runId) {
        try {
            AgentRun stored = agentRunMapper.findById(runId);
            if (stored == null) {
                log.warn("Verify agent run update found no row: runId={}", runId);
                return;
            }
            log.info("Verified agent run update: runId={}, status={}, completedAt={}",
                    runId, stored.getStatus(), stored.getCompletedAt());
        } catch (Exception e) {
            log.warn("Verify agent run update failed: runId={}", runId, e);
        }
    }

    private boolean sleep(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
