package world.willfrog.agentrun.cache.local;

import world.willfrog.agentrun.cache.ActiveRunRegistry;
import world.willfrog.agentrun.model.RunKeys;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public class LocalActiveRunRegistry implements ActiveRunRegistry {

    private final Map<String, Instant> markers = new ConcurrentHashMap<>();
    private final Clock clock;

    public LocalActiveRunRegistry(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void markActive(String instanceId, String runId, Duration ttl) {
        markers.put(RunKeys.activeRunKey(instanceId, runId), clock.instant().plus(ttl));
    }

    @Override
    public boolean refresh(String instanceId, String runId, Duration ttl) {
        Instant now = clock.instant();
        String key = RunKeys.activeRunKey(instanceId, runId);
        Instant updated = markers.computeIfPresent(key, (k, expiresAt) ->
                now.isBefore(expiresAt) ? now.plus(ttl) : null);
        return updated != null;
    }

    @Override
    public void clear(String instanceId, String runId) {
        markers.remove(RunKeys.activeRunKey(instanceId, runId));
    }

    @Override
    public Set<String> findInstances(String runId) {
        Instant now = clock.instant();
        Set<String> instances = new LinkedHashSet<>();
        markers.forEach((key, expiresAt) -> {
            if (now.isBefore(expiresAt)) {
                String instanceId = RunKeys.instanceIdFromActiveKey(key, runId);
                if (instanceId != null) {
                    instances.add(instanceId);
                }
            }
        });
        return instances;
    }
}
