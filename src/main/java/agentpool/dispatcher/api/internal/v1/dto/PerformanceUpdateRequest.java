package agentpool.dispatcher.api.internal.v1.dto;

import agentpool.dispatcher.model.PerformanceUpdate;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for a partial performance update.
 * POST /internal/v1/instances/{id}/performance
 */
public record PerformanceUpdateRequest(
        @JsonProperty("averageResponseTimeMs") Double averageResponseTimeMs,
        @JsonProperty("successRate") Double successRate,
        @JsonProperty("throughput") Double throughput,
        @JsonProperty("errorRate") Double errorRate,
        @JsonProperty("costEfficiency") Double costEfficiency) {

    public void validate() {
        if (averageResponseTimeMs == null && successRate == null && throughput == null
                && errorRate == null && costEfficiency == null) {
            throw new IllegalArgumentException("at least one performance field is required");
        }
        requireFraction("successRate", successRate);
        requireFraction("errorRate", errorRate);
        requireFraction("costEfficiency", costEfficiency);
        if (averageResponseTimeMs != null && averageResponseTimeMs < 0) {
            throw new IllegalArgumentException("averageResponseTimeMs must be non-negative");
        }
        if (throughput != null && throughput < 0) {
            throw new IllegalArgumentException("throughput must be non-negative");
        }
    }

    private static void requireFraction(String name, Double value) {
        if (value != null && (value < 0 || value > 1)) {
            throw new IllegalArgumentException(name + " must be between 0 and 1");
        }
    }

    public PerformanceUpdate toUpdate() {
        return new PerformanceUpdate(averageResponseTimeMs, successRate, throughput, errorRate, costEfficiency);
    }
}
