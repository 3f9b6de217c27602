package world.willfrog.agentrun.support;

import world.willfrog.agentrun.common.dao.credit.CreditUsageDao;
import world.willfrog.agentrun.common.pojo.credit.CreditUsage;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 内存版 credit_usage 表，(agent_run_id, usage_key) 唯一。
 */
public class InMemoryCreditUsageDao implements CreditUsageDao {

    private final List<CreditUsage> rows = new ArrayList<>();
    private final AtomicLong ids = new AtomicLong();

    @Override
    public synchronized int insertIgnoreDuplicate(CreditUsage usage) {
        boolean exists = rows.stream().anyMatch(row ->
                row.getAgentRunId().equals(usage.getAgentRunId()) && row.getUsageKey().equals(usage.getUsageKey()));
        if (exists) {
            return 0;
        }
        usage.setId(ids.incrementAndGet());
        rows.add(usage);
        return 1;
    }

    @Override
    public synchronized List<CreditUsage> listByRunId(String agentRunId) {
        return rows.stream().filter(row -> row.getAgentRunId().equals(agentRunId)).toList();
    }

    @Override
    public synchronized BigDecimal sumByRunId(String agentRunId) {
        return rows.stream()
                .filter(row -> row.getAgentRunId().equals(agentRunId))
                .map(CreditUsage::getCreditAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
