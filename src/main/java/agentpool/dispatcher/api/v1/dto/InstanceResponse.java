package agentpool.dispatcher.api.v1.dto;

import agentpool.dispatcher.model.AgentInstance;
import agentpool.dispatcher.model.HealthNote;
import agentpool.dispatcher.model.HealthSnapshot;
import agentpool.dispatcher.model.PerformanceMetrics;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for an agent instance.
 * GET /api/v1/instances
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InstanceResponse(
        @JsonProperty("id") String id,
        @JsonProperty("agentType") String agentType,
        @JsonProperty("endpoint") String endpoint,
        @JsonProperty("capacity") int capacity,
        @JsonProperty("currentLoad") int currentLoad,
        @JsonProperty("status") String status,
        @JsonProperty("circuitState") String circuitState,
        @JsonProperty("lastHealthCheck") Instant lastHealthCheck,
        @JsonProperty("health") Health health,
        @JsonProperty("performance") PerformanceMetrics performance) {

    public record Health(
            @JsonProperty("status") String status,
            @JsonProperty("responseTimeMs") long responseTimeMs,
            @JsonProperty("errorRate24h") double errorRate24h,
            @JsonProperty("availableCapacity") int availableCapacity,
            @JsonProperty("notes") List<Note> notes) {

        static Health from(HealthSnapshot snapshot) {
            return new Health(
                    snapshot.status().wireName(),
                    snapshot.responseTimeMs(),
                    snapshot.errorRate24h(),
                    snapshot.availableCapacity(),
                    snapshot.notes().stream().map(Note::from).toList());
        }
    }

    public record Note(
            @JsonProperty("level") String level,
            @JsonProperty("message") String message,
            @JsonProperty("timestamp") Instant timestamp) {

        static Note from(HealthNote note) {
            return new Note(note.level().wireName(), note.message(), note.timestamp());
        }
    }

    /**
     * @param circuitState wire name of the breaker state, or null when unknown
     */
    public static InstanceResponse from(AgentInstance instance, String circuitState) {
        return new InstanceResponse(
                instance.id(),
                instance.agentType(),
                instance.endpoint(),
                instance.capacity(),
                instance.currentLoad(),
                instance.status().wireName(),
                circuitState,
                instance.lastHealthCheck(),
                Health.from(instance.health()),
                instance.performance());
    }
}
