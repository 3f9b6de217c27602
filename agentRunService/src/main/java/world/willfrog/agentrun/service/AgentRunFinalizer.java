package world.willfrog.agentrun.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import world.willfrog.agentrun.common.dao.credit.CreditUsageDao;
import world.willfrog.agentrun.common.pojo.credit.CreditUsage;
import world.willfrog.agentrun.entity.AgentRun;
import world.willfrog.agentrun.mapper.AgentRunMapper;
import world.willfrog.agentrun.model.CostPreview;
import world.willfrog.agentrun.model.CreditInfo;
import world.willfrog.agentrun.model.ReasoningMode;
import world.willfrog.agentrun.model.UsageSummary;
import world.willfrog.agentrun.model.event.ResponseEvent;
import world.willfrog.agentrun.model.event.ResponseEventCodec;
import world.willfrog.agentrun.model.event.ResponseEventType;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * run 结束后的用量汇总：按时长计对话额度，按工具结果上的计费注解记工具 / 数据源额度，
 * 写入 credit_usage 明细并回写 agent_runs 的汇总字段。
 * <p>
 * 明细以 (agent_run_id, usage_key) 去重，汇总字段只在 finalized_at 为空时写入，
 * 同一个 run 重复汇总不会重复记账。任何一步失败都只记日志，额度按 0 处理，不向调用方抛异常。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentRunFinalizer {

    static final String CONVERSATION_USAGE_KEY = "conversation";
    static final String TOOL_USAGE_KEY_PREFIX = "tool:";

    private final AgentRunMapper agentRunMapper;
    private final CreditUsageDao creditUsageDao;
    private final CreditCalculator creditCalculator;
    private final CreditInfoExtractor creditInfoExtractor;
    private final ResponseEventCodec codec;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * 从持久化记录读取响应列表后汇总。
     */
    public UsageSummary finalizeRun(String runId, Instant startTime, Instant endTime, ReasoningMode reasoningMode) {
        return finalizeRun(runId, startTime, endTime, reasoningMode, loadTranscript(runId));
    }

    public UsageSummary finalizeRun(String runId,
                                    Instant startTime,
                                    Instant endTime,
                                    ReasoningMode reasoningMode,
                                    List<ResponseEvent> transcript) {
        ReasoningMode mode = reasoningMode == null ? ReasoningMode.NONE : reasoningMode;
        double totalMinutes = elapsedMinutes(startTime, endTime);
        OffsetDateTime finalizedAt = OffsetDateTime.now(clock);
        try {
            CreditCalculator.CreditCharge conversation = creditCalculator.conversationCredits(totalMinutes, mode);
            saveUsage(runId, CONVERSATION_USAGE_KEY, CreditUsage.USAGE_TYPE_CONVERSATION,
                    null, null, conversation.credits(), conversation.details());

            Map<String, BigDecimal> toolCredits = new LinkedHashMap<>();
            Map<String, BigDecimal> dataProviderCredits = new LinkedHashMap<>();
            int toolUsagesSaved = 0;
            int dataProviderCalls = 0;
            List<ResponseEvent> events = transcript == null ? List.of() : transcript;
            for (int i = 0; i < events.size(); i++) {
                ResponseEvent event = events.get(i);
                if (event.type() != ResponseEventType.TOOL) {
                    continue;
                }
                CreditInfo info = creditInfoExtractor.extract(event).orElse(null);
                if (info == null || info.toolName() == null) {
                    continue;
                }
                try {
                    saveUsage(runId, TOOL_USAGE_KEY_PREFIX + i, info.usageType(), info.toolName(),
                            info.dataProviderName(), info.credits(), info.calculationDetails());
                    toolUsagesSaved++;
                    toolCredits.merge(info.toolName(), info.credits(), BigDecimal::add);
                    if (info.hasDataProvider()) {
                        dataProviderCalls++;
                        dataProviderCredits.merge(info.dataProviderName(), info.credits(), BigDecimal::add);
                    }
                } catch (Exception e) {
                    log.error("Save tool credit usage failed: runId={}, tool={}", runId, info.toolName(), e);
                }
            }

            BigDecimal toolTotal = toolCredits.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
            BigDecimal totalCredits = readTotalCredits(runId, conversation.credits().add(toolTotal));
            updateTotals(runId, totalMinutes, mode, conversation.credits(), toolTotal, totalCredits, finalizedAt);

            log.info("Agent run finalized: runId={}, minutes={}, mode={}, conversationCredits={}, toolUsages={}, dataProviderCalls={}, totalCredits={}",
                    runId, String.format("%.2f", totalMinutes), mode.wireName(), conversation.credits(),
                    toolUsagesSaved, dataProviderCalls, totalCredits);
            return new UsageSummary(runId, totalMinutes, mode, conversation.credits(), toolCredits,
                    dataProviderCredits, toolUsagesSaved, dataProviderCalls, totalCredits, finalizedAt, null);
        } catch (Exception e) {
            log.error("Finalize agent run failed, credits recorded as zero: runId={}", runId, e);
            try {
                updateTotals(runId, totalMinutes, mode, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, finalizedAt);
            } catch (Exception updateError) {
                log.error("Record zero usage failed: runId={}", runId, updateError);
            }
            return UsageSummary.degraded(runId, totalMinutes, mode, finalizedAt, e.getMessage());
        }
    }

    /**
     * 根据预估时长、工具与数据源列表给出额度预估。
     */
    public CostPreview preview(double estimatedMinutes,
                               ReasoningMode reasoningMode,
                               List<String> toolNames,
                               List<String> dataProviders) {
        ReasoningMode mode = reasoningMode == null ? ReasoningMode.NONE : reasoningMode;
        Map<String, BigDecimal> breakdown = new LinkedHashMap<>();

        BigDecimal conversation = creditCalculator.conversationCredits(estimatedMinutes, mode).credits();
        breakdown.put(CONVERSATION_USAGE_KEY, conversation);

        BigDecimal toolTotal = BigDecimal.ZERO;
        for (String toolName : toolNames == null ? List.<String>of() : toolNames) {
            CreditCalculator.CreditCharge charge = creditCalculator.toolCredits(toolName);
            breakdown.put(charge.toolName(), charge.credits());
            toolTotal = toolTotal.add(charge.credits());
        }

        BigDecimal providerTotal = BigDecimal.ZERO;
        for (String provider : dataProviders == null ? List.<String>of() : dataProviders) {
            CreditCalculator.CreditCharge charge = creditCalculator.dataProviderCredits(provider, null);
            breakdown.put(charge.toolName(), charge.credits());
            providerTotal = providerTotal.add(charge.credits());
        }

        Map<String, String> tiers = new LinkedHashMap<>();
        tiers.put("conversation", CreditCalculator.costTier(conversation, 2, 5));
        tiers.put("tools", CreditCalculator.costTier(toolTotal, 3, 10));
        tiers.put("data_providers", CreditCalculator.costTier(providerTotal, 5, 15));

        return new CostPreview(mode, estimatedMinutes, conversation, toolTotal, providerTotal,
                conversation.add(toolTotal).add(providerTotal), breakdown, tiers);
    }

    private List<ResponseEvent> loadTranscript(String runId) {
        try {
            AgentRun run = agentRunMapper.findById(runId);
            if (run == null) {
                log.warn("No agent run found for finalization: runId={}", runId);
                return List.of();
            }
            return codec.fromJsonArray(run.getResponses());
        } catch (Exception e) {
            log.error("Load responses for finalization failed: runId={}", runId, e);
            return List.of();
        }
    }

    private void saveUsage(String runId,
                           String usageKey,
                           String usageType,
                           String toolName,
                           String dataProviderName,
                           BigDecimal credits,
                           Map<String, Object> details) {
        CreditUsage usage = new CreditUsage();
        usage.setAgentRunId(runId);
        usage.setUsageKey(usageKey);
        usage.setUsageType(usageType);
        usage.setToolName(toolName);
        usage.setDataProviderName(dataProviderName);
        usage.setCreditAmount(credits);
        usage.setCalculationDetails(safeWrite(details));
        int inserted = creditUsageDao.insertIgnoreDuplicate(usage);
        if (inserted == 0) {
            log.debug("Credit usage already recorded: runId={}, usageKey={}", runId, usageKey);
        }
    }

    private BigDecimal readTotalCredits(String runId, BigDecimal fallback) {
        try {
            BigDecimal total = creditUsageDao.sumByRunId(runId);
            return total == null ? fallback : total;
        } catch (Exception e) {
            log.warn("Read credit usage total failed, use in-memory total: runId={}", runId, e);
            return fallback;
        }
    }

    private void updateTotals(String runId,
                              double totalMinutes,
                              ReasoningMode mode,
                              BigDecimal conversationCredits,
                              BigDecimal toolCredits,
                              BigDecimal totalCredits,
                              OffsetDateTime finalizedAt) {
        int updated = agentRunMapper.updateUsageTotals(runId, totalMinutes, mode.wireName(),
                conversationCredits, toolCredits, totalCredits, finalizedAt);
        if (updated == 0) {
            log.info("Agent run usage totals already recorded or run missing: runId={}", runId);
        }
    }

    private double elapsedMinutes(Instant startTime, Instant endTime) {
        if (startTime == null || endTime == null || endTime.isBefore(startTime)) {
            return 0D;
        }
        return Duration.between(startTime, endTime).toMillis() / 60000D;
    }

    private String safeWrite(Object value) {
        try {
            return objectMapper.writeValueAsString(value == null ? Map.of() : value);
        } catch (Exception e) {
            return "{}";
        }
    }
}
