package agentpool.dispatcher.health;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Body returned by an agent's health endpoint.
 * GET {endpoint}/{agentType}/health
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HealthReport(
        @JsonProperty("status") String status,
        @JsonProperty("error_rate_24h") Double errorRate24h,
        @JsonProperty("current_load") Integer currentLoad,
        @JsonProperty("available_capacity") Integer availableCapacity,
        @JsonProperty("alerts") List<ReportedAlert> alerts) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ReportedAlert(
            @JsonProperty("level") String level,
            @JsonProperty("message") String message,
            @JsonProperty("timestamp") String timestamp) {
    }

    public static HealthReport online(int currentLoad) {
        return new HealthReport("online", 0.0, currentLoad, 100, List.of());
    }

    public double errorRateOrDefault() {
        return errorRate24h != null ? errorRate24h : 0.0;
    }

    public int currentLoadOrDefault() {
        return currentLoad != null ? currentLoad : 0;
    }

    public int availableCapacityOrDefault() {
        return availableCapacity != null ? availableCapacity : 100;
    }

    public List<ReportedAlert> alertsOrEmpty() {
        return alerts != null ? alerts : List.of();
    }
}
