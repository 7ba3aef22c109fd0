package agentpool.dispatcher.model;

import java.util.Objects;

/**
 * Result of one task execution, reported by the caller after it used an
 * instance returned by the dispatcher.
 */
public record ExecutionOutcome(
        String agentType,
        String instanceId,
        ExecutionStatus status,
        long executionTimeMs,
        double costCents,
        String taskType,
        Complexity complexity) {

    public ExecutionOutcome {
        Objects.requireNonNull(agentType, "agentType is required");
        Objects.requireNonNull(status, "status is required");
        complexity = complexity == null ? Complexity.MODERATE : complexity;
    }

    public boolean isSuccess() {
        return status.isSuccess();
    }
}
