package world.willfrog.agentrun.trace;

import world.willfrog.agentrun.model.AgentRunRequest;

public interface RunTracer {

    RunTrace start(AgentRunRequest request);
}
