package agentpool.dispatcher.api.v1.dto;

import agentpool.dispatcher.model.Complexity;
import agentpool.dispatcher.model.Priority;
import agentpool.dispatcher.model.RequestHints;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Optional body of a dispatch request.
 * POST /api/v1/dispatch/{agentType}
 */
public record DispatchRequest(
        @JsonProperty("taskType") String taskType,
        @JsonProperty("priority") String priority,
        @JsonProperty("complexity") String complexity) {

    /** Parse the hints; unknown values are rejected with 400. */
    public RequestHints toHints() {
        return new RequestHints(taskType, Priority.fromWire(priority), Complexity.fromWire(complexity));
    }
}
