package agentpool.dispatcher.strategy;

import agentpool.dispatcher.model.AgentInstance;
import agentpool.dispatcher.model.Complexity;
import agentpool.dispatcher.model.Priority;
import agentpool.dispatcher.model.RequestHints;

import java.util.List;

/**
 * Multi-signal scoring: response time, free capacity, success rate and cost
 * efficiency, scaled by request priority and complexity. Highest score wins,
 * ties go to the earliest registered instance.
 */
public class AdaptiveStrategy implements SelectionStrategy {

    static final double RESPONSE_TIME_WEIGHT = 0.3;
    static final double LOAD_WEIGHT = 0.3;
    static final double SUCCESS_RATE_WEIGHT = 0.2;
    static final double COST_WEIGHT = 0.2;

    static final double URGENT_MULTIPLIER = 2.0;
    static final double COMPLEX_MULTIPLIER = 1.5;

    @Override
    public AgentInstance select(String agentType, List<AgentInstance> eligible, RequestHints hints) {
        AgentInstance best = eligible.get(0);
        double bestScore = score(best, hints);
        for (int i = 1; i < eligible.size(); i++) {
            AgentInstance candidate = eligible.get(i);
            double candidateScore = score(candidate, hints);
            if (candidateScore > bestScore) {
                best = candidate;
                bestScore = candidateScore;
            }
        }
        return best;
    }

    public double score(AgentInstance instance, RequestHints hints) {
        double responseTimeScore = 1.0 / SelectionStrategy.effectiveResponseTime(instance);
        double loadScore = (double) (instance.capacity() - instance.currentLoad()) / instance.capacity();
        double successRateScore = instance.performance().successRate();
        double costScore = instance.performance().costEfficiency();

        double priorityMultiplier = hints.priority() == Priority.URGENT ? URGENT_MULTIPLIER : 1.0;
        double complexityMultiplier = hints.complexity() == Complexity.COMPLEX ? COMPLEX_MULTIPLIER : 1.0;

        return (responseTimeScore * RESPONSE_TIME_WEIGHT
                + loadScore * LOAD_WEIGHT
                + successRateScore * SUCCESS_RATE_WEIGHT
                + costScore * COST_WEIGHT)
                * priorityMultiplier * complexityMultiplier;
    }

    @Override
    public StrategyType type() {
        return StrategyType.ADAPTIVE;
    }
}
