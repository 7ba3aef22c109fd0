package agentpool.dispatcher.strategy;

import agentpool.dispatcher.model.AgentInstance;
import agentpool.dispatcher.model.RequestHints;

import java.util.List;

/**
 * Picks the instance with the lowest current load; the earliest registered wins ties.
 */
public class LeastConnectionsStrategy implements SelectionStrategy {

    @Override
    public AgentInstance select(String agentType, List<AgentInstance> eligible, RequestHints hints) {
        AgentInstance best = eligible.get(0);
        for (AgentInstance candidate : eligible) {
            if (candidate.currentLoad() < best.currentLoad()) {
                best = candidate;
            }
        }
        return best;
    }

    @Override
    public StrategyType type() {
        return StrategyType.LEAST_CONNECTIONS;
    }
}
