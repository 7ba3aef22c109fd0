package agentpool.dispatcher.alert;

import agentpool.dispatcher.core.Jsons;
import agentpool.dispatcher.model.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * POSTs each alert as JSON to a fixed URL, retrying on I/O errors and
 * non-2xx answers.
 */
public class WebhookAlertChannel implements AlertChannel {

    private static final Logger log = LoggerFactory.getLogger(WebhookAlertChannel.class);

    private final HttpClient httpClient;
    private final URI target;
    private final Duration timeout;
    private final int maxAttempts;

    public WebhookAlertChannel(URI target, Duration timeout, int maxAttempts) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), target, timeout, maxAttempts);
    }

    public WebhookAlertChannel(HttpClient httpClient, URI target, Duration timeout, int maxAttempts) {
        this.httpClient = httpClient;
        this.target = target;
        this.timeout = timeout;
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    @Override
    public String name() {
        return AlertChannels.WEBHOOK;
    }

    @Override
    public void send(Alert alert) throws IOException, InterruptedException {
        String body = Jsons.mapper().writeValueAsString(payload(alert));
        HttpRequest request = HttpRequest.newBuilder()
                .uri(target)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        IOException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
                if (response.statusCode() >= 200 && response.statusCode() < 300) {
                    log.debug("Alert {} delivered to {} (attempt {})", alert.id(), target, attempt);
                    return;
                }
                last = new IOException("webhook returned " + response.statusCode());
            } catch (IOException e) {
                last = e;
            }
            log.debug("Webhook attempt {}/{} for alert {} failed: {}", attempt, maxAttempts, alert.id(),
                    last.getMessage());
        }
        throw last;
    }

    static Map<String, Object> payload(Alert alert) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", alert.id());
        payload.put("ruleId", alert.ruleId());
        payload.put("agentType", alert.agentType());
        payload.put("severity", alert.severity().wireName());
        payload.put("message", alert.message());
        payload.put("timestamp", alert.createdAt().toString());
        payload.put("metadata", alert.metadata());
        return payload;
    }
}
