package agentpool.dispatcher.strategy;

import agentpool.dispatcher.TestInstances;
import agentpool.dispatcher.model.AgentInstance;
import agentpool.dispatcher.model.Complexity;
import agentpool.dispatcher.model.PerformanceMetrics;
import agentpool.dispatcher.model.Priority;
import agentpool.dispatcher.model.RequestHints;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class SelectionStrategiesTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final RequestHints DEFAULTS = RequestHints.defaults();

    private static AgentInstance instance(String id, int load, int capacity) {
        return TestInstances.online(id, "nina", load, capacity, NOW);
    }

    private static AgentInstance withResponseTime(String id, double avgMs) {
        return TestInstances.online(id, "nina", 0, 10, new PerformanceMetrics(avgMs, 1, 0, 0, 1), NOW);
    }

    /** Random whose draws are fixed, so weighted picks are predictable */
    private static Random fixedDraw(double value) {
        return new Random() {
            @Override
            public double nextDouble() {
                return value;
            }
        };
    }

    @Test
    void roundRobinCyclesInPoolOrder() {
        RoundRobinStrategy strategy = new RoundRobinStrategy();
        List<AgentInstance> pool = List.of(instance("a", 0, 5), instance("b", 0, 5), instance("c", 0, 5));

        assertEquals("a", strategy.select("nina", pool, DEFAULTS).id());
        assertEquals("b", strategy.select("nina", pool, DEFAULTS).id());
        assertEquals("c", strategy.select("nina", pool, DEFAULTS).id());
        assertEquals("a", strategy.select("nina", pool, DEFAULTS).id());
    }

    @Test
    void roundRobinKeepsOneCounterPerAgentType() {
        RoundRobinStrategy strategy = new RoundRobinStrategy();
        List<AgentInstance> pool = List.of(instance("a", 0, 5), instance("b", 0, 5));

        assertEquals("a", strategy.select("nina", pool, DEFAULTS).id());
        assertEquals("a", strategy.select("mia", pool, DEFAULTS).id());
        assertEquals("b", strategy.select("nina", pool, DEFAULTS).id());
    }

    @Test
    void leastConnectionsPicksLowestLoadFirstOnTies() {
        LeastConnectionsStrategy strategy = new LeastConnectionsStrategy();
        List<AgentInstance> pool = List.of(instance("a", 3, 10), instance("b", 1, 10), instance("c", 1, 10));

        assertEquals("b", strategy.select("nina", pool, DEFAULTS).id());
    }

    @Test
    @DisplayName("Weighted pick follows the cumulative inverse response time")
    void weightedResponseTimeUsesCumulativeWeights() {
        // weights 1/100 and 1/300: the fast instance owns the first 75% of the range
        List<AgentInstance> pool = List.of(withResponseTime("fast", 100), withResponseTime("slow", 300));

        assertEquals("fast", new WeightedResponseTimeStrategy(fixedDraw(0.5)).select("nina", pool, DEFAULTS).id());
        assertEquals("fast", new WeightedResponseTimeStrategy(fixedDraw(0.74)).select("nina", pool, DEFAULTS).id());
        assertEquals("slow", new WeightedResponseTimeStrategy(fixedDraw(0.76)).select("nina", pool, DEFAULTS).id());
    }

    @Test
    void weightedResponseTimeFavoursFasterInstances() {
        WeightedResponseTimeStrategy strategy = new WeightedResponseTimeStrategy(new Random(42));
        List<AgentInstance> pool = List.of(withResponseTime("fast", 50), withResponseTime("slow", 500));

        int fast = 0;
        for (int i = 0; i < 1000; i++) {
            if (strategy.select("nina", pool, DEFAULTS).id().equals("fast")) {
                fast++;
            }
        }
        // expected share is 10/11
        assertTrue(fast > 850, "fast instance picked " + fast + " times");
    }

    @Test
    void zeroResponseTimeCountsAsOneMillisecond() {
        AgentInstance fresh = withResponseTime("fresh", 0);

        assertEquals(1.0, SelectionStrategy.effectiveResponseTime(fresh));
    }

    @Test
    void adaptiveScoreCombinesWeightedSignals() {
        AdaptiveStrategy strategy = new AdaptiveStrategy();
        AgentInstance idle = TestInstances.online("a", "nina", 0, 10, PerformanceMetrics.initial(), NOW);

        // 1/1 * 0.3 + 1.0 * 0.3 + 1.0 * 0.2 + 1.0 * 0.2
        assertEquals(1.0, strategy.score(idle, DEFAULTS), 1e-9);
        assertEquals(2.0, strategy.score(idle, RequestHints.of(Priority.URGENT, Complexity.MODERATE)), 1e-9);
        assertEquals(3.0, strategy.score(idle, RequestHints.of(Priority.URGENT, Complexity.COMPLEX)), 1e-9);
    }

    @Test
    void adaptivePrefersHigherSuccessRate() {
        AdaptiveStrategy strategy = new AdaptiveStrategy();
        AgentInstance flaky = TestInstances.online("flaky", "nina", 2, 10,
                new PerformanceMetrics(200, 0.5, 0, 0.5, 1), NOW);
        AgentInstance steady = TestInstances.online("steady", "nina", 2, 10,
                new PerformanceMetrics(200, 0.9, 0, 0.1, 1), NOW);

        assertEquals("steady", strategy.select("nina", List.of(flaky, steady), DEFAULTS).id());
    }

    @Test
    void adaptivePrefersFreeCapacity() {
        AdaptiveStrategy strategy = new AdaptiveStrategy();
        AgentInstance busy = TestInstances.online("busy", "nina", 9, 10, NOW);
        AgentInstance idle = TestInstances.online("idle", "nina", 2, 10, NOW);

        assertEquals("idle", strategy.select("nina", List.of(busy, idle), DEFAULTS).id());
    }

    @Test
    void adaptiveTieGoesToFirstInstance() {
        AdaptiveStrategy strategy = new AdaptiveStrategy();
        List<AgentInstance> pool = List.of(instance("a", 1, 4), instance("b", 1, 4));

        assertEquals("a", strategy.select("nina", pool, DEFAULTS).id());
    }

    @Test
    void factoryBuildsEveryType() {
        for (StrategyType type : StrategyType.values()) {
            assertEquals(type, SelectionStrategies.create(type).type());
        }
        assertEquals(StrategyType.LEAST_CONNECTIONS, StrategyType.fromWire("least-connections"));
        assertThrows(IllegalArgumentException.class, () -> StrategyType.fromWire("random"));
    }
}
