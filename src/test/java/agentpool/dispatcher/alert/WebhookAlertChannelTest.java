package agentpool.dispatcher.alert;

import agentpool.dispatcher.core.Jsons;
import agentpool.dispatcher.model.Alert;
import agentpool.dispatcher.model.Severity;
import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class WebhookAlertChannelTest {

    private HttpServer receiver;
    private final AtomicInteger requests = new AtomicInteger();
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private volatile int failuresBeforeSuccess;

    private final Alert alert = new Alert("a-1", "high_error_rate", "system", Severity.ERROR,
            "Alert: High Error Rate", Instant.parse("2024-05-01T10:00:00Z"), false, null,
            Map.of("observed", 0.4));

    @BeforeEach
    void setUp() throws IOException {
        receiver = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        receiver.createContext("/hooks/alerts", exchange -> {
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            int n = requests.incrementAndGet();
            exchange.sendResponseHeaders(n <= failuresBeforeSuccess ? 500 : 204, -1);
            exchange.close();
        });
        receiver.start();
    }

    @AfterEach
    void tearDown() {
        receiver.stop(0);
    }

    private WebhookAlertChannel channel(int maxAttempts) {
        URI target = URI.create("http://127.0.0.1:" + receiver.getAddress().getPort() + "/hooks/alerts");
        return new WebhookAlertChannel(target, Duration.ofSeconds(2), maxAttempts);
    }

    @Test
    void postsAlertAsJson() throws Exception {
        channel(1).send(alert);

        assertEquals(1, requests.get());
        JsonNode json = Jsons.mapper().readTree(lastBody.get());
        assertEquals("a-1", json.get("id").asText());
        assertEquals("error", json.get("severity").asText());
        assertEquals("2024-05-01T10:00:00Z", json.get("timestamp").asText());
        assertEquals(0.4, json.get("metadata").get("observed").asDouble(), 1e-9);
    }

    @Test
    void retriesUntilAccepted() throws Exception {
        failuresBeforeSuccess = 2;

        channel(3).send(alert);

        assertEquals(3, requests.get());
    }

    @Test
    void givesUpAfterMaxAttempts() {
        failuresBeforeSuccess = 10;

        IOException e = assertThrows(IOException.class, () -> channel(2).send(alert));

        assertEquals(2, requests.get());
        assertTrue(e.getMessage().contains("500"));
    }
}
