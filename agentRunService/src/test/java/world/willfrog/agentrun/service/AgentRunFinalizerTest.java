package world.willfrog.agentrun.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import world.willfrog.agentrun.common.dao.credit.CreditUsageDao;
import world.willfrog.agentrun.common.pojo.credit.CreditUsage;
import world.willfrog.agentrun.entity.AgentRun;
import world.willfrog.agentrun.model.CostPreview;
import world.willfrog.agentrun.model.ReasoningMode;
import world.willfrog.agentrun.model.UsageSummary;
import world.willfrog.agentrun.model.event.AssistantEvent;
import world.willfrog.agentrun.model.event.ResponseEvent;
import world.willfrog.agentrun.model.event.ResponseEventCodec;
import world.willfrog.agentrun.model.event.StatusEvent;
import world.willfrog.agentrun.support.CreditFixtures;
import world.willfrog.agentrun.support.InMemoryAgentRunMapper;
import world.willfrog.agentrun.support.InMemoryCreditUsageDao;
import world.willfrog.agentrun.support.MutableClock;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AgentRunFinalizerTest {

    private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

    private InMemoryAgentRunMapper runMapper;
    private InMemoryCreditUsageDao creditUsageDao;
    private ResponseEventCodec codec;
    private ObjectMapper objectMapper;
    private MutableClock clock;
    private AgentRunFinalizer finalizer;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        codec = new ResponseEventCodec(objectMapper);
        runMapper = new InMemoryAgentRunMapper();
        creditUsageDao = new InMemoryCreditUsageDao();
        clock = new MutableClock(START.plus(Duration.ofMinutes(10)));
        finalizer = newFinalizer(creditUsageDao);
        runMapper.put(InMemoryAgentRunMapper.runningRun("r1", OffsetDateTime.ofInstant(START, ZoneOffset.UTC)));
    }

    @Test
    void finalizeRun_shouldChargeConversationAndAnnotatedTools() {
        List<ResponseEvent> transcript = List.of(
                AssistantEvent.ofText("thinking"),
                codec.decode("{\"type\":\"tool\",\"_credit_info\":{\"tool_name\":\"web_search\",\"credits\":2.0}}"),
                codec.decode("{\"type\":\"tool\",\"_credit_info\":{\"tool_name\":\"linkedin_data_provider\","
                        + "\"credits\":3.0,\"data_provider_name\":\"linkedin\"}}"),
                codec.decode("{\"type\":\"tool\",\"content\":\"no annotation\"}"),
                StatusEvent.of("completed", null)
        );

        UsageSummary summary = finalizer.finalizeRun("r1", START, START.plus(Duration.ofMinutes(6)),
                ReasoningMode.MEDIUM, transcript);

        assertFalse(summary.isDegraded());
        assertEquals(6.0, summary.totalTimeMinutes(), 1e-9);
        assertEquals(0, new BigDecimal("15").compareTo(summary.conversationCredits()));
        assertEquals(2, summary.toolUsagesSaved());
        assertEquals(1, summary.dataProviderCalls());
        assertEquals(0, new BigDecimal("3.0").compareTo(summary.dataProviderCredits().get("linkedin")));
        assertEquals(0, new BigDecimal("20").compareTo(summary.totalCredits()));

        AgentRun stored = runMapper.findById("r1");
        assertEquals(6.0, stored.getTotalTimeMinutes(), 1e-9);
        assertEquals("medium", stored.getReasoningMode());
        assertEquals(0, new BigDecimal("5").compareTo(stored.getToolCredits()));
        assertNotNull(stored.getFinalizedAt());
        assertEquals("running", stored.getStatus());
        assertEquals(3, creditUsageDao.listByRunId("r1").size());
    }

    @Test
    void finalizeRun_shouldNotDoubleChargeWhenInvokedTwice() {
        List<ResponseEvent> transcript = List.of(
                codec.decode("{\"type\":\"tool\",\"_credit_info\":{\"tool_name\":\"web_search\",\"credits\":2.0}}"));

        finalizer.finalizeRun("r1", START, START.plus(Duration.ofMinutes(1)), ReasoningMode.NONE, transcript);
        UsageSummary second = finalizer.finalizeRun("r1", START, START.plus(Duration.ofMinutes(1)),
                ReasoningMode.NONE, transcript);

        assertEquals(2, creditUsageDao.listByRunId("r1").size());
        assertEquals(0, new BigDecimal("3").compareTo(creditUsageDao.sumByRunId("r1")));
        assertEquals(0, new BigDecimal("3").compareTo(second.totalCredits()));
        assertEquals(1, runMapper.usageUpdateCount());
    }

    @Test
    void finalizeRun_shouldKeepTerminalStatusAndErrorAcrossRepeatedCalls() {
        OffsetDateTime completedAt = OffsetDateTime.ofInstant(START.plus(Duration.ofMinutes(4)), ZoneOffset.UTC);
        runMapper.updateTerminal("r1", "failed", completedAt, "quota exceeded", "[]");
        CreditUsageDao failingDao = mock(CreditUsageDao.class);
        when(failingDao.insertIgnoreDuplicate(any(CreditUsage.class))).thenThrow(new IllegalStateException("db down"));
        AgentRunFinalizer failing = newFinalizer(failingDao);

        finalizer.finalizeRun("r1", START, START.plus(Duration.ofMinutes(4)), ReasoningMode.NONE, List.of());
        OffsetDateTime firstFinalizedAt = runMapper.findById("r1").getFinalizedAt();
        clock.advance(Duration.ofMinutes(5));
        UsageSummary degraded = failing.finalizeRun("r1", START, START.plus(Duration.ofMinutes(4)),
                ReasoningMode.NONE, List.of());

        assertTrue(degraded.isDegraded());
        AgentRun stored = runMapper.findById("r1");
        assertEquals("failed", stored.getStatus());
        assertEquals("quota exceeded", stored.getError());
        assertEquals(completedAt, stored.getCompletedAt());
        assertEquals(firstFinalizedAt, stored.getFinalizedAt());
        assertEquals(0, new BigDecimal("4").compareTo(stored.getTotalCredits()));
        assertEquals(1, runMapper.usageUpdateCount());
    }

    @Test
    void finalizeRun_shouldReadTranscriptFromStoredRecord() {
        AgentRun run = runMapper.findById("r1");
        run.setResponses(codec.toJsonArray(List.of(
                codec.decode("{\"type\":\"tool\",\"_credit_info\":{\"tool_name\":\"scrape_webpage\",\"credits\":2.5}}"))));
        runMapper.put(run);

        UsageSummary summary = finalizer.finalizeRun("r1", START, START.plus(Duration.ofMinutes(2)), ReasoningMode.HIGH);

        assertEquals(0, new BigDecimal("8").compareTo(summary.conversationCredits()));
        assertEquals(0, new BigDecimal("2.5").compareTo(summary.toolCredits().get("scrape_webpage")));
        assertEquals(0, new BigDecimal("10.5").compareTo(summary.totalCredits()));
    }

    @Test
    void finalizeRun_shouldDegradeToZeroCreditsWhenStorageFails() {
        CreditUsageDao failingDao = mock(CreditUsageDao.class);
        when(failingDao.insertIgnoreDuplicate(any(CreditUsage.class))).thenThrow(new IllegalStateException("db down"));
        AgentRunFinalizer failing = newFinalizer(failingDao);

        UsageSummary summary = failing.finalizeRun("r1", START, START.plus(Duration.ofMinutes(3)),
                ReasoningMode.NONE, List.of());

        assertTrue(summary.isDegraded());
        assertEquals("db down", summary.error());
        assertEquals(0, BigDecimal.ZERO.compareTo(summary.totalCredits()));
        assertEquals(3.0, summary.totalTimeMinutes(), 1e-9);
        assertEquals(0, BigDecimal.ZERO.compareTo(runMapper.findById("r1").getTotalCredits()));
    }

    @Test
    void finalizeRun_shouldClampReversedTimesToZeroMinutes() {
        UsageSummary summary = finalizer.finalizeRun("r1", START, START.minusSeconds(30), ReasoningMode.NONE, List.of());

        assertEquals(0.0, summary.totalTimeMinutes(), 1e-9);
        assertEquals(0, BigDecimal.ZERO.compareTo(summary.conversationCredits()));
    }

    @Test
    void preview_shouldAggregateAndTierEstimate() {
        CostPreview preview = finalizer.preview(3, ReasoningMode.NONE,
                List.of("web_search", "scrape_webpage"), List.of("linkedin", "apollo", "twitter", "yahoo_finance", "x"));

        assertEquals(0, new BigDecimal("3").compareTo(preview.conversationCredits()));
        assertEquals(0, new BigDecimal("4.5").compareTo(preview.toolCredits()));
        assertEquals(0, new BigDecimal("10").compareTo(preview.dataProviderCredits()));
        assertEquals(0, new BigDecimal("17.5").compareTo(preview.totalEstimatedCredits()));
        assertEquals("medium", preview.tiers().get("conversation"));
        assertEquals("medium", preview.tiers().get("tools"));
        assertEquals("medium", preview.tiers().get("data_providers"));
        assertTrue(preview.breakdown().containsKey("linkedin_data_provider"));
    }

    private AgentRunFinalizer newFinalizer(CreditUsageDao dao) {
        CreditCalculator calculator = new CreditCalculator(CreditFixtures.defaultProperties());
        return new AgentRunFinalizer(runMapper, dao, calculator,
                new CreditInfoExtractor(objectMapper, calculator), codec, objectMapper, clock);
    }
}
