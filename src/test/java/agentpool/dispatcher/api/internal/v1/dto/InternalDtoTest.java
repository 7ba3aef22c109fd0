package agentpool.dispatcher.api.internal.v1.dto;

import agentpool.dispatcher.core.Jsons;
import agentpool.dispatcher.model.Complexity;
import agentpool.dispatcher.model.ExecutionOutcome;
import agentpool.dispatcher.model.ExecutionStatus;
import agentpool.dispatcher.model.PerformanceUpdate;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InternalDtoTest {

    private final ObjectMapper mapper = Jsons.mapper();

    @Test
    void outcomeRequestDeserialization() throws Exception {
        String json = """
                {
                  "agentType": "nina",
                  "instanceId": "nina-1",
                  "status": "partial_success",
                  "executionTimeMs": 1250,
                  "costCents": 3.5,
                  "taskType": "summarize",
                  "complexity": "complex"
                }
                """;

        OutcomeRequest req = mapper.readValue(json, OutcomeRequest.class);
        assertDoesNotThrow(req::validate);

        ExecutionOutcome outcome = req.toOutcome();
        assertEquals("nina", outcome.agentType());
        assertEquals("nina-1", outcome.instanceId());
        assertEquals(ExecutionStatus.PARTIAL_SUCCESS, outcome.status());
        assertEquals(1250, outcome.executionTimeMs());
        assertEquals(3.5, outcome.costCents(), 0.001);
        assertEquals(Complexity.COMPLEX, outcome.complexity());
        assertFalse(outcome.isSuccess());
    }

    @Test
    void outcomeRequestValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> new OutcomeRequest("", null, "success", 10, 0, null, null).validate());
        assertThrows(IllegalArgumentException.class,
                () -> new OutcomeRequest("nina", null, "exploded", 10, 0, null, null).validate());
        assertThrows(IllegalArgumentException.class,
                () -> new OutcomeRequest("nina", null, "success", -1, 0, null, null).validate());
        assertThrows(IllegalArgumentException.class,
                () -> new OutcomeRequest("nina", null, "success", 10, -0.5, null, null).validate());
    }

    @Test
    void blankInstanceIdIsDropped() {
        OutcomeRequest req = new OutcomeRequest("nina", " ", "success", 10, 0, null, null);

        assertNull(req.toOutcome().instanceId());
        assertEquals(Complexity.MODERATE, req.toOutcome().complexity());
    }

    @Test
    void performanceUpdateValidation() {
        PerformanceUpdateRequest empty = new PerformanceUpdateRequest(null, null, null, null, null);
        assertThrows(IllegalArgumentException.class, empty::validate);

        PerformanceUpdateRequest badRate = new PerformanceUpdateRequest(null, 1.5, null, null, null);
        assertThrows(IllegalArgumentException.class, badRate::validate);

        PerformanceUpdateRequest negativeTime = new PerformanceUpdateRequest(-3.0, null, null, null, null);
        assertThrows(IllegalArgumentException.class, negativeTime::validate);

        PerformanceUpdateRequest partial = new PerformanceUpdateRequest(null, 0.4, null, null, 0.7);
        assertDoesNotThrow(partial::validate);
        PerformanceUpdate update = partial.toUpdate();
        assertEquals(0.4, update.successRate());
        assertNull(update.averageResponseTimeMs());
    }

    @Test
    void operationResponseSerialization() throws Exception {
        String json = mapper.writeValueAsString(OperationResponse.success());
        assertTrue(json.contains("\"ok\":true"));
        assertFalse(json.contains("error")); // null fields excluded

        json = mapper.writeValueAsString(OperationResponse.alertNotFound());
        assertTrue(json.contains("\"ok\":false"));
        assertTrue(json.contains("\"error\":\"alert_not_found\""));
    }
}
