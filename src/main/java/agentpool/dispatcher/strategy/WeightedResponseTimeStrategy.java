package agentpool.dispatcher.strategy;

import agentpool.dispatcher.model.AgentInstance;
import agentpool.dispatcher.model.RequestHints;

import java.util.List;
import java.util.Random;

/**
 * Random pick weighted by inverse average response time, so faster
 * instances receive proportionally more requests.
 */
public class WeightedResponseTimeStrategy implements SelectionStrategy {

    private final Random random;

    public WeightedResponseTimeStrategy(Random random) {
        this.random = random;
    }

    @Override
    public AgentInstance select(String agentType, List<AgentInstance> eligible, RequestHints hints) {
        double[] weights = new double[eligible.size()];
        double totalWeight = 0;
        for (int i = 0; i < weights.length; i++) {
            weights[i] = 1.0 / SelectionStrategy.effectiveResponseTime(eligible.get(i));
            totalWeight += weights[i];
        }

        double draw;
        synchronized (random) {
            draw = random.nextDouble() * totalWeight;
        }

        double weightSum = 0;
        for (int i = 0; i < weights.length; i++) {
            weightSum += weights[i];
            if (weightSum > draw) {
                return eligible.get(i);
            }
        }
        // rounding can leave the draw a hair above the last running sum
        return eligible.get(eligible.size() - 1);
    }

    @Override
    public StrategyType type() {
        return StrategyType.WEIGHTED_RESPONSE_TIME;
    }
}
