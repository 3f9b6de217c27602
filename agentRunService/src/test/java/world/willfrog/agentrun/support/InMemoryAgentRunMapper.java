package world.willfrog.agentrun.support;

import world.willfrog.agentrun.entity.AgentRun;
import world.willfrog.agentrun.mapper.AgentRunMapper;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 按 SQL 语义实现的内存版 agent_runs 表。
 */
public class InMemoryAgentRunMapper implements AgentRunMapper {

    private static final Set<String> TERMINAL = Set.of("completed", "failed", "stopped");

    private final Map<String, AgentRun> rows = new ConcurrentHashMap<>();
    private final AtomicInteger terminalUpdates = new AtomicInteger();
    private final AtomicInteger usageUpdates = new AtomicInteger();

    @Override
    public int insert(AgentRun run) {
        AgentRun copy = copy(run);
        if (copy.getResponses() == null) {
            copy.setResponses("[]");
        }
        return rows.putIfAbsent(run.getId(), copy) == null ? 1 : 0;
    }

    @Override
    public AgentRun findById(String id) {
        AgentRun run = rows.get(id);
        return run == null ? null : copy(run);
    }

    @Override
    public int updateTerminal(String id, String status, OffsetDateTime completedAt, String error, String responses) {
        AgentRun run = rows.get(id);
        if (run == null) {
            return 0;
        }
        terminalUpdates.incrementAndGet();
        run.setStatus(status);
        run.setCompletedAt(completedAt);
        run.setError(error);
        if (responses != null) {
            run.setResponses(responses);
        }
        return 1;
    }

    @Override
    public int updateUsageTotals(String id,
                                 double totalTimeMinutes,
                                 String reasoningMode,
                                 BigDecimal conversationCredits,
                                 BigDecimal toolCredits,
                                 BigDecimal totalCredits,
                                 OffsetDateTime finalizedAt) {
        AgentRun run = rows.get(id);
        if (run == null || run.getFinalizedAt() != null) {
            return 0;
        }
        usageUpdates.incrementAndGet();
        run.setTotalTimeMinutes(totalTimeMinutes);
        run.setReasoningMode(reasoningMode);
        run.setConversationCredits(conversationCredits);
        run.setToolCredits(toolCredits);
        run.setTotalCredits(totalCredits);
        run.setFinalizedAt(finalizedAt);
        return 1;
    }

    @Override
    public List<AgentRun> listUnfinalized(int limit) {
        return rows.values().stream()
                .filter(run -> TERMINAL.contains(run.getStatus()))
                .filter(run -> run.getCompletedAt() != null)
                .filter(run -> run.getTotalTimeMinutes() == null || run.getTotalTimeMinutes() == 0D)
                .filter(run -> run.getFinalizedAt() == null)
                .sorted(Comparator.comparing(AgentRun::getCompletedAt))
                .limit(limit)
                .map(this::copy)
                .toList();
    }

    public void put(AgentRun run) {
        rows.put(run.getId(), copy(run));
    }

    public int terminalUpdateCount() {
        return terminalUpdates.get();
    }

    public int usageUpdateCount() {
        return usageUpdates.get();
    }

    public static AgentRun runningRun(String id, OffsetDateTime startedAt) {
        AgentRun run = new AgentRun();
        run.setId(id);
        run.setThreadId("thread-" + id);
        run.setProjectId("project-1");
        run.setStatus("running");
        run.setStartedAt(startedAt);
        run.setReasoningMode("none");
        run.setResponses("[]");
        return run;
    }

    private AgentRun copy(AgentRun source) {
        AgentRun target = new AgentRun();
        target.setId(source.getId());
        target.setThreadId(source.getThreadId());
        target.setProjectId(source.getProjectId());
        target.setStatus(source.getStatus());
        target.setStartedAt(source.getStartedAt());
        target.setCompletedAt(source.getCompletedAt());
        target.setError(source.getError());
        target.setResponses(source.getResponses());
        target.setReasoningMode(source.getReasoningMode());
        target.setTotalTimeMinutes(source.getTotalTimeMinutes());
        target.setConversationCredits(source.getConversationCredits());
        target.setToolCredits(source.getToolCredits());
        target.setTotalCredits(source.getTotalCredits());
        target.setFinalizedAt(source.getFinalizedAt());
        return target;
    }
}
