package agentpool.dispatcher.model;

import java.util.Map;

/**
 * Point-in-time summary of the instance pool.
 */
public record DispatcherStatistics(
        int totalInstances,
        int healthyInstances,
        Map<String, Integer> instancesByAgentType,
        double averageLoad,
        String strategy) {

    public DispatcherStatistics {
        instancesByAgentType = instancesByAgentType == null ? Map.of() : Map.copyOf(instancesByAgentType);
    }
}
