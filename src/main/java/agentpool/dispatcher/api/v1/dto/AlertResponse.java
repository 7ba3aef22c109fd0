package agentpool.dispatcher.api.v1.dto;

import agentpool.dispatcher.model.Alert;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Response DTO for an alert.
 * GET /api/v1/alerts
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AlertResponse(
        @JsonProperty("id") String id,
        @JsonProperty("ruleId") String ruleId,
        @JsonProperty("agentType") String agentType,
        @JsonProperty("severity") String severity,
        @JsonProperty("message") String message,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("acknowledged") boolean acknowledged,
        @JsonProperty("resolvedAt") Instant resolvedAt,
        @JsonProperty("metadata") Map<String, Object> metadata) {

    public static AlertResponse from(Alert alert) {
        return new AlertResponse(
                alert.id(),
                alert.ruleId(),
                alert.agentType(),
                alert.severity().wireName(),
                alert.message(),
                alert.createdAt(),
                alert.acknowledged(),
                alert.resolvedAt(),
                alert.metadata());
    }
}
