package agentpool.dispatcher.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for the service health check.
 * GET /api/v1/health
 */
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("totalInstances") int totalInstances,
        @JsonProperty("healthyInstances") int healthyInstances,
        @JsonProperty("activeAlerts") int activeAlerts,
        @JsonProperty("strategy") String strategy) {
}
