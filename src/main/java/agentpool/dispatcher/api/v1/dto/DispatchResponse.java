package agentpool.dispatcher.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for instance selection.
 * POST /api/v1/dispatch/{agentType}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DispatchResponse(
        @JsonProperty("outcome") String outcome,
        @JsonProperty("agentType") String agentType,
        @JsonProperty("instance") InstanceResponse instance) {

    public static DispatchResponse selected(String agentType, InstanceResponse instance) {
        return new DispatchResponse("SELECTED", agentType, instance);
    }

    public static DispatchResponse unavailable(String outcome, String agentType) {
        return new DispatchResponse(outcome, agentType, null);
    }
}
