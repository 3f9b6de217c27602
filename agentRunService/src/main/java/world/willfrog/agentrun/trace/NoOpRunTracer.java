package world.willfrog.agentrun.trace;

import world.willfrog.agentrun.model.AgentRunRequest;

public class NoOpRunTracer implements RunTracer {

    public static final RunTrace NOOP_TRACE = new RunTrace() {
        @Override
        public void mark(String name, TraceLevel level, String statusMessage) {
        }

        @Override
        public void end(String status) {
        }
    };

    @Override
    public RunTrace start(AgentRunRequest request) {
        return NOOP_TRACE;
    }
}
