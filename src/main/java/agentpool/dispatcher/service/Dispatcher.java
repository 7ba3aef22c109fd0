package agentpool.dispatcher.service;

import agentpool.dispatcher.circuit.CircuitBreaker;
import agentpool.dispatcher.core.EventBus;
import agentpool.dispatcher.core.EventType;
import agentpool.dispatcher.core.LifecycleEvent;
import agentpool.dispatcher.model.AgentInstance;
import agentpool.dispatcher.model.CircuitState;
import agentpool.dispatcher.model.DispatcherStatistics;
import agentpool.dispatcher.model.PerformanceUpdate;
import agentpool.dispatcher.model.RequestHints;
import agentpool.dispatcher.model.SelectionResult;
import agentpool.dispatcher.registry.InstanceRegistry;
import agentpool.dispatcher.strategy.SelectionStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Service layer for instance selection.
 * Filters a pool down to eligible instances and delegates the pick to the
 * configured strategy. Also the entry point for circuit-breaker feedback.
 */
public class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    /** Reported success rate below which a performance update counts as a failure */
    static final double FAILING_SUCCESS_RATE = 0.5;

    private final InstanceRegistry registry;
    private final SelectionStrategy strategy;
    private final EventBus events;
    private final Clock clock;

    public Dispatcher(InstanceRegistry registry, SelectionStrategy strategy, EventBus events, Clock clock) {
        this.registry = registry;
        this.strategy = strategy;
        this.events = events;
        this.clock = clock;
    }

    /**
     * Register an instance with a fresh closed circuit breaker.
     */
    public AgentInstance register(AgentInstance instance) {
        AgentInstance stored = registry.register(instance);
        log.info("Registered {} instance {} at {} (capacity {})",
                stored.agentType(), stored.id(), stored.endpoint(), stored.capacity());
        events.publish(LifecycleEvent.of(EventType.INSTANCE_REGISTERED, clock.instant(),
                Map.of("agentType", stored.agentType(), "instanceId", stored.id())));
        return stored;
    }

    public boolean deregister(String instanceId) {
        Optional<AgentInstance> removed = registry.deregister(instanceId);
        removed.ifPresent(instance -> {
            log.info("Deregistered {} instance {}", instance.agentType(), instance.id());
            events.publish(LifecycleEvent.of(EventType.INSTANCE_DEREGISTERED, clock.instant(),
                    Map.of("agentType", instance.agentType(), "instanceId", instance.id())));
        });
        return removed.isPresent();
    }

    /**
     * Pick an instance for the agent type. Never throws for lack of capacity;
     * the result says whether anything was available.
     */
    public SelectionResult selectInstance(String agentType, RequestHints hints) {
        List<AgentInstance> pool = registry.pool(agentType);
        if (pool.isEmpty()) {
            log.debug("No instances registered for {}", agentType);
            return SelectionResult.noneRegistered(agentType);
        }

        List<AgentInstance> eligible = new ArrayList<>(pool.size());
        for (AgentInstance instance : pool) {
            if (instance.hasHeadroom() && permitsTrial(instance.id())) {
                eligible.add(instance);
            }
        }

        RequestHints effective = hints != null ? hints : RequestHints.defaults();
        while (!eligible.isEmpty()) {
            AgentInstance chosen = strategy.select(agentType, eligible, effective);
            // only the chosen instance consumes a half-open trial
            if (!isCircuitOpen(chosen.id())) {
                log.debug("Selected {} for {} via {} ({} eligible)",
                        chosen.id(), agentType, strategy.type().wireName(), eligible.size());
                return SelectionResult.selected(agentType, chosen);
            }
            log.debug("Trial for {} taken by a concurrent selection", chosen.id());
            eligible.remove(chosen);
        }

        log.warn("No available instance for {} ({} registered)", agentType, pool.size());
        return SelectionResult.noneAvailable(agentType);
    }

    public void recordSuccess(String instanceId) {
        registry.breaker(instanceId).ifPresent(CircuitBreaker::recordSuccess);
    }

    public void recordFailure(String instanceId) {
        registry.breaker(instanceId).ifPresent(breaker -> {
            CircuitState before = breaker.state();
            breaker.recordFailure();
            if (before != CircuitState.OPEN && breaker.state() == CircuitState.OPEN) {
                log.warn("Circuit opened for instance {} after {} failures", instanceId, breaker.failureCount());
            }
        });
    }

    /**
     * Merge reported performance figures into the instance. A reported success
     * rate under 0.5 counts as a breaker failure, anything else as a success.
     */
    public Optional<AgentInstance> updatePerformance(String instanceId, PerformanceUpdate update) {
        Optional<AgentInstance> updated = registry.updatePerformance(instanceId, current -> current.merge(update));
        if (updated.isPresent()) {
            if (update.successRate() != null && update.successRate() < FAILING_SUCCESS_RATE) {
                recordFailure(instanceId);
            } else {
                recordSuccess(instanceId);
            }
        }
        return updated;
    }

    /** Open-check with the breaker's half-open side effect; unknown ids count as open */
    public boolean isCircuitOpen(String instanceId) {
        return registry.breaker(instanceId).map(CircuitBreaker::isOpen).orElse(true);
    }

    private boolean permitsTrial(String instanceId) {
        return registry.breaker(instanceId).map(CircuitBreaker::permitsTrial).orElse(false);
    }

    public Optional<CircuitState> circuitState(String instanceId) {
        return registry.breaker(instanceId).map(CircuitBreaker::state);
    }

    public Optional<AgentInstance> findInstance(String instanceId) {
        return registry.find(instanceId);
    }

    public List<AgentInstance> instances() {
        return registry.all();
    }

    public DispatcherStatistics getStatistics() {
        return new DispatcherStatistics(
                registry.size(),
                registry.healthyCount(),
                registry.countsByAgentType(),
                registry.averageLoad(),
                strategy.type().wireName());
    }

    public SelectionStrategy strategy() {
        return strategy;
    }
}
