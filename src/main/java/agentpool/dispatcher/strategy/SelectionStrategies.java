package agentpool.dispatcher.strategy;

import java.util.Random;

/**
 * Factory for the configured {@link SelectionStrategy}.
 */
public final class SelectionStrategies {

    private SelectionStrategies() {
    }

    public static SelectionStrategy create(StrategyType type, Random random) {
        return switch (type) {
            case ROUND_ROBIN -> new RoundRobinStrategy();
            case LEAST_CONNECTIONS -> new LeastConnectionsStrategy();
            case WEIGHTED_RESPONSE_TIME -> new WeightedResponseTimeStrategy(random);
            case ADAPTIVE -> new AdaptiveStrategy();
        };
    }

    public static SelectionStrategy create(StrategyType type) {
        return create(type, new Random());
    }
}
