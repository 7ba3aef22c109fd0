package agentpool.dispatcher.api.v1;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HealthControllerTest {

    private final HealthController controller = new HealthController(null, null, 0.8);

    @Test
    void degradedBelowFailoverThreshold() {
        assertEquals("healthy", controller.status(0, 0));
        assertEquals("healthy", controller.status(4, 5));
        assertEquals("degraded", controller.status(3, 5));
        assertEquals("degraded", controller.status(0, 2));
    }
}
