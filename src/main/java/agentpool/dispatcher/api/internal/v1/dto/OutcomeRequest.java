package agentpool.dispatcher.api.internal.v1.dto;

import agentpool.dispatcher.model.Complexity;
import agentpool.dispatcher.model.ExecutionOutcome;
import agentpool.dispatcher.model.ExecutionStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for execution-outcome reporting.
 * POST /internal/v1/outcomes
 */
public record OutcomeRequest(
        @JsonProperty("agentType") String agentType,
        @JsonProperty("instanceId") String instanceId,
        @JsonProperty("status") String status,
        @JsonProperty("executionTimeMs") long executionTimeMs,
        @JsonProperty("costCents") double costCents,
        @JsonProperty("taskType") String taskType,
        @JsonProperty("complexity") String complexity) {

    public void validate() {
        if (agentType == null || agentType.isBlank()) {
            throw new IllegalArgumentException("agentType is required");
        }
        ExecutionStatus.fromWire(status);
        Complexity.fromWire(complexity);
        if (executionTimeMs < 0) {
            throw new IllegalArgumentException("executionTimeMs must be non-negative");
        }
        if (costCents < 0) {
            throw new IllegalArgumentException("costCents must be non-negative");
        }
    }

    public ExecutionOutcome toOutcome() {
        return new ExecutionOutcome(
                agentType.trim(),
                instanceId == null || instanceId.isBlank() ? null : instanceId.trim(),
                ExecutionStatus.fromWire(status),
                executionTimeMs,
                costCents,
                taskType,
                Complexity.fromWire(complexity));
    }
}
