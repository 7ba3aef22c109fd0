package agentpool.dispatcher.strategy;

import agentpool.dispatcher.model.AgentInstance;
import agentpool.dispatcher.model.RequestHints;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Cycles through the eligible instances with one counter per agent type.
 */
public class RoundRobinStrategy implements SelectionStrategy {

    private final ConcurrentHashMap<String, AtomicLong> counters = new ConcurrentHashMap<>();

    @Override
    public AgentInstance select(String agentType, List<AgentInstance> eligible, RequestHints hints) {
        long counter = counters.computeIfAbsent(agentType, k -> new AtomicLong()).getAndIncrement();
        return eligible.get((int) Math.floorMod(counter, (long) eligible.size()));
    }

    @Override
    public StrategyType type() {
        return StrategyType.ROUND_ROBIN;
    }
}
