package agentpool.dispatcher.api.v1.dto;

import agentpool.dispatcher.model.AgentInstance;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.net.URI;
import java.time.Instant;
import java.util.UUID;

/**
 * Request DTO for instance registration.
 * POST /api/v1/instances
 */
public record RegisterInstanceRequest(
        @JsonProperty("id") String id,
        @JsonProperty("agentType") String agentType,
        @JsonProperty("endpoint") String endpoint,
        @JsonProperty("capacity") Integer capacity) {

    public void validate() {
        if (agentType == null || agentType.isBlank()) {
            throw new IllegalArgumentException("agentType is required");
        }
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("endpoint is required");
        }
        URI uri;
        try {
            uri = URI.create(endpoint.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("endpoint is not a valid URI");
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            throw new IllegalArgumentException("endpoint must be an absolute http(s) URL");
        }
        if (capacity != null && capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
    }

    /** Build the instance; a missing id becomes {@code <agentType>-<random>}. */
    public AgentInstance toInstance(Instant now) {
        String instanceId = id != null && !id.isBlank()
                ? id.trim()
                : agentType.trim() + "-" + UUID.randomUUID().toString().substring(0, 8);
        return AgentInstance.builder()
                .id(instanceId)
                .agentType(agentType.trim())
                .endpoint(endpoint.trim())
                .capacity(capacity != null ? capacity : 1)
                .lastHealthCheck(now)
                .build();
    }
}
