package agentpool.dispatcher.registry;

import agentpool.dispatcher.circuit.CircuitBreaker;
import agentpool.dispatcher.model.AgentInstance;
import agentpool.dispatcher.model.HealthSnapshot;
import agentpool.dispatcher.model.PerformanceMetrics;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * In-memory pool of agent instances grouped by agent type, each paired with
 * its circuit breaker. All mutations go through this object's monitor so
 * readers always see a consistent snapshot.
 */
public class InstanceRegistry {

    private final int breakerThreshold;
    private final Duration breakerTimeout;
    private final Clock clock;

    // by instance id, registration order
    private final Map<String, AgentInstance> instances = new LinkedHashMap<>();
    // agent type -> instance ids, registration order
    private final Map<String, List<String>> pools = new LinkedHashMap<>();
    private final Map<String, CircuitBreaker> breakers = new HashMap<>();

    public InstanceRegistry(int breakerThreshold, Duration breakerTimeout, Clock clock) {
        this.breakerThreshold = breakerThreshold;
        this.breakerTimeout = breakerTimeout;
        this.clock = clock;
    }

    /**
     * Add an instance to its agent-type pool and create a closed breaker for it.
     *
     * @throws IllegalArgumentException if the id is already registered
     */
    public synchronized AgentInstance register(AgentInstance instance) {
        if (instances.containsKey(instance.id())) {
            throw new IllegalArgumentException("instance already registered: " + instance.id());
        }
        AgentInstance stored = instance.lastHealthCheck() != null ? instance
                : instance.toBuilder().lastHealthCheck(clock.instant()).build();
        instances.put(stored.id(), stored);
        pools.computeIfAbsent(stored.agentType(), k -> new ArrayList<>()).add(stored.id());
        breakers.put(stored.id(), new CircuitBreaker(breakerThreshold, breakerTimeout, clock));
        return stored;
    }

    public synchronized Optional<AgentInstance> deregister(String instanceId) {
        AgentInstance removed = instances.remove(instanceId);
        if (removed == null) {
            return Optional.empty();
        }
        List<String> pool = pools.get(removed.agentType());
        if (pool != null) {
            pool.remove(instanceId);
            if (pool.isEmpty()) {
                pools.remove(removed.agentType());
            }
        }
        breakers.remove(instanceId);
        return Optional.of(removed);
    }

    public synchronized Optional<AgentInstance> find(String instanceId) {
        return Optional.ofNullable(instances.get(instanceId));
    }

    /** Instances for one agent type in registration order */
    public synchronized List<AgentInstance> pool(String agentType) {
        List<String> ids = pools.get(agentType);
        if (ids == null) {
            return List.of();
        }
        List<AgentInstance> list = new ArrayList<>(ids.size());
        for (String id : ids) {
            list.add(instances.get(id));
        }
        return list;
    }

    public synchronized List<AgentInstance> all() {
        return new ArrayList<>(instances.values());
    }

    public synchronized Map<String, Integer> countsByAgentType() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        pools.forEach((type, ids) -> counts.put(type, ids.size()));
        return counts;
    }

    public synchronized Optional<CircuitBreaker> breaker(String instanceId) {
        return Optional.ofNullable(breakers.get(instanceId));
    }

    /**
     * Replace the health snapshot of an instance. The reported load becomes
     * the instance's current load, clamped to [0, capacity].
     */
    public synchronized Optional<AgentInstance> applyHealth(String instanceId, HealthSnapshot snapshot) {
        AgentInstance current = instances.get(instanceId);
        if (current == null) {
            return Optional.empty();
        }
        AgentInstance updated = current.toBuilder()
                .health(snapshot)
                .currentLoad(snapshot.currentLoad())
                .lastHealthCheck(snapshot.checkedAt())
                .build();
        instances.put(instanceId, updated);
        return Optional.of(updated);
    }

    public synchronized Optional<AgentInstance> updatePerformance(String instanceId,
            UnaryOperator<PerformanceMetrics> change) {
        AgentInstance current = instances.get(instanceId);
        if (current == null) {
            return Optional.empty();
        }
        AgentInstance updated = current.toBuilder().performance(change.apply(current.performance())).build();
        instances.put(instanceId, updated);
        return Optional.of(updated);
    }

    public synchronized int size() {
        return instances.size();
    }

    public synchronized int healthyCount() {
        int healthy = 0;
        for (AgentInstance instance : instances.values()) {
            if (instance.health().isHealthy()) {
                healthy++;
            }
        }
        return healthy;
    }

    public synchronized double averageLoad() {
        if (instances.isEmpty()) {
            return 0.0;
        }
        long total = 0;
        for (AgentInstance instance : instances.values()) {
            total += instance.currentLoad();
        }
        return (double) total / instances.size();
    }
}
