package world.willfrog.agentrun.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import world.willfrog.agentrun.cache.ActiveRunRegistry;
import world.willfrog.agentrun.cache.ControlSignalBus;
import world.willfrog.agentrun.entity.AgentRun;
import world.willfrog.agentrun.exception.AgentRunException;
import world.willfrog.agentrun.kafka.AgentRunTaskPublisher;
import world.willfrog.agentrun.mapper.AgentRunMapper;
import world.willfrog.agentrun.model.AgentRunRequest;
import world.willfrog.agentrun.model.AgentRunStatus;
import world.willfrog.agentrun.model.ControlSignal;
import world.willfrog.agentrun.model.RunKeys;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Set;
import java.util.UUID;

/**
 * run 的提交与停止入口。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentRunService {

    private final AgentRunMapper agentRunMapper;
    private final AgentRunTaskPublisher taskPublisher;
    private final AgentRunDispatcher dispatcher;
    private final ControlSignalBus controlSignalBus;
    private final ActiveRunRegistry activeRunRegistry;
    private final Clock clock;

    /**
     * 创建 running 状态的 run 记录并投递执行任务。
     * 任务投递关闭时在本实例直接异步执行。
     *
     * @return run ID
     */
    public String submit(AgentRunRequest request) {
        String runId = StringUtils.isBlank(request.runId())
                ? UUID.randomUUID().toString().replace("-", "")
                : request.runId();
        AgentRunRequest task = request.withRunId(runId);

        AgentRun run = new AgentRun();
        run.setId(runId);
        run.setThreadId(task.threadId());
        run.setProjectId(task.projectId());
        run.setStatus(AgentRunStatus.RUNNING.wireName());
        run.setStartedAt(OffsetDateTime.now(clock));
        run.setReasoningMode(task.reasoningMode().wireName());
        run.setResponses("[]");
        if (agentRunMapper.insert(run) <= 0) {
            throw new AgentRunException(runId, "Create agent run record failed");
        }

        boolean published;
        try {
            published = taskPublisher.publish(task);
        } catch (Exception e) {
            throw new AgentRunException(runId, "Publish agent run task failed: " + e.getMessage(), e);
        }
        if (!published) {
            dispatcher.dispatch(task);
        }
        log.info("Submitted agent run: runId={}, threadId={}, published={}", runId, task.threadId(), published);
        return runId;
    }

    /**
     * 请求停止 run：全局控制通道发一次 STOP，并对每个登记了活跃标记的实例通道各发一次。
     *
     * @return 收到 STOP 的实例通道数量
     */
    public int stop(String runId) {
        controlSignalBus.publish(RunKeys.globalControlChannel(runId), ControlSignal.STOP.payload());
        Set<String> instances;
        try {
            instances = activeRunRegistry.findInstances(runId);
        } catch (Exception e) {
            log.warn("Find active instances failed, only global STOP sent: runId={}", runId, e);
            return 0;
        }
        int signaled = 0;
        for (String instanceId : instances) {
            try {
                controlSignalBus.publish(RunKeys.instanceControlChannel(runId, instanceId), ControlSignal.STOP.payload());
                signaled++;
            } catch (Exception e) {
                log.warn("Publish STOP to instance failed: runId={}, instance={}", runId, instanceId, e);
            }
        }
        log.info("Stop requested: runId={}, instances={}", runId, instances);
        return signaled;
    }
}
