package agentpool.dispatcher.strategy;

import agentpool.dispatcher.model.AgentInstance;
import agentpool.dispatcher.model.RequestHints;

import java.util.List;

/**
 * Picks one instance from a non-empty list of eligible instances.
 * The list is in pool (registration) order.
 */
public interface SelectionStrategy {

    /**
     * @param agentType agent type the request is for
     * @param eligible  healthy, below-capacity, circuit-closed instances; never empty
     * @param hints     request priority/complexity hints
     * @return the chosen instance, always an element of {@code eligible}
     */
    AgentInstance select(String agentType, List<AgentInstance> eligible, RequestHints hints);

    StrategyType type();

    /** Response time used for scoring, floored at 1ms */
    static double effectiveResponseTime(AgentInstance instance) {
        return Math.max(instance.performance().averageResponseTimeMs(), 1.0);
    }
}
