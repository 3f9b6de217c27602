package world.willfrog.agentrun.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import world.willfrog.agentrun.model.AgentRunRequest;

@Service
@RequiredArgsConstructor
@Slf4j
public class AgentRunDispatcher {

    private final AgentRunCoordinator coordinator;

    @Async("agentRunExecutor")
    public void dispatch(AgentRunRequest request) {
        try {
            coordinator.run(request);
        } catch (Exception e) {
            log.error("Agent run dispatch failed: runId={}", request.runId(), e);
        }
    }
}
