package world.willfrog.agentrun.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import world.willfrog.agentrun.config.AgentRunProperties;
import world.willfrog.agentrun.entity.AgentRun;
import world.willfrog.agentrun.mapper.AgentRunMapper;
import world.willfrog.agentrun.model.ReasoningMode;

import java.util.List;

/**
 * 补录已结束但没有用量汇总的 run（例如执行实例在汇总前退出）。
 */
@Component
@ConditionalOnProperty(prefix = "agent.run.backfill", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class AgentRunBackfillJob {

    private final AgentRunMapper agentRunMapper;
    private final AgentRunFinalizer finalizer;
    private final AgentRunProperties properties;

    @Scheduled(fixedDelayString = "${agent.run.backfill.interval-ms:600000}")
    public void scheduledBackfill() {
        BackfillStats stats = backfillBatch();
        if (stats.found() > 0) {
            log.info("Agent run backfill finished: found={}, successful={}, failed={}",
                    stats.found(), stats.successful(), stats.failed());
        }
    }

    public BackfillStats backfillBatch() {
        List<AgentRun> runs;
        try {
            runs = agentRunMapper.listUnfinalized(Math.max(1, properties.getBackfill().getBatchSize()));
        } catch (Exception e) {
            log.error("Find unfinalized agent runs failed", e);
            return new BackfillStats(0, 0, 0);
        }
        int successful = 0;
        int failed = 0;
        for (AgentRun run : runs) {
            if (backfill(run)) {
                successful++;
            } else {
                failed++;
            }
        }
        return new BackfillStats(runs.size(), successful, failed);
    }

    private boolean backfill(AgentRun run) {
        if (run.getStartedAt() == null || run.getCompletedAt() == null) {
            log.warn("Agent run missing timestamps, skip backfill: runId={}", run.getId());
            return false;
        }
        try {
            ReasoningMode mode = ReasoningMode.fromWire(run.getReasoningMode());
            log.info("Backfilling agent run: runId={}, {} -> {} ({})",
                    run.getId(), run.getStartedAt(), run.getCompletedAt(), mode.wireName());
            return !finalizer.finalizeRun(run.getId(), run.getStartedAt().toInstant(),
                    run.getCompletedAt().toInstant(), mode).isDegraded();
        } catch (Exception e) {
            log.error("Backfill agent run failed: runId={}", run.getId(), e);
            return false;
        }
    }

    public record BackfillStats(int found, int successful, int failed) {
    }
}
