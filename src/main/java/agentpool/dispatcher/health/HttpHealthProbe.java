package agentpool.dispatcher.health;

import agentpool.dispatcher.core.Jsons;
import agentpool.dispatcher.model.AgentInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Probes {@code GET {endpoint}/{agentType}/health} over HTTP.
 * Non-2xx responses are failures.
 */
public class HttpHealthProbe implements HealthProbe {

    private static final Logger log = LoggerFactory.getLogger(HttpHealthProbe.class);

    private final HttpClient httpClient;
    private final Duration timeout;

    public HttpHealthProbe(Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), timeout);
    }

    public HttpHealthProbe(HttpClient httpClient, Duration timeout) {
        this.httpClient = httpClient;
        this.timeout = timeout;
    }

    @Override
    public HealthReport check(AgentInstance instance) throws IOException, InterruptedException {
        URI uri = healthUri(instance);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new IOException("health endpoint returned " + response.statusCode());
        }

        String body = response.body();
        log.debug("Health of {} from {}: {}", instance.id(), uri, body);
        if (body == null || body.isBlank()) {
            return HealthReport.online(0);
        }
        return Jsons.mapper().readValue(body, HealthReport.class);
    }

    static URI healthUri(AgentInstance instance) {
        String endpoint = instance.endpoint();
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("instance " + instance.id() + " has no endpoint");
        }
        String base = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        return URI.create(base + "/" + instance.agentType() + "/health");
    }
}
