package agentpool.dispatcher.api.internal.v1;

import agentpool.dispatcher.api.Controller;
import agentpool.dispatcher.api.internal.v1.dto.OperationResponse;
import agentpool.dispatcher.api.internal.v1.dto.PerformanceUpdateRequest;
import agentpool.dispatcher.core.Jsons;
import agentpool.dispatcher.model.AgentInstance;
import agentpool.dispatcher.service.Dispatcher;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Controller for reported performance figures (internal API).
 * POST /internal/v1/instances/{id}/performance
 *
 * A reported success rate under 0.5 counts as a circuit-breaker failure.
 */
public class PerformanceController implements Controller {

    private static final String PREFIX = "/internal/v1/instances/";
    private static final String SUFFIX = "/performance";

    private final Dispatcher dispatcher;

    public PerformanceController(Dispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && instanceId(path) != null;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        PerformanceUpdateRequest request = Jsons.mapper().readValue(body, PerformanceUpdateRequest.class);

        request.validate();

        Optional<AgentInstance> updated = dispatcher.updatePerformance(instanceId(path), request.toUpdate());
        if (updated.isEmpty()) {
            return ControllerResponse.of(HttpResponseStatus.NOT_FOUND, OperationResponse.error("instance_not_found"));
        }
        return ControllerResponse.ok(OperationResponse.success());
    }

    private static String instanceId(String path) {
        if (!path.startsWith(PREFIX) || !path.endsWith(SUFFIX)) {
            return null;
        }
        String id = path.substring(PREFIX.length(), path.length() - SUFFIX.length());
        return id.isEmpty() || id.contains("/") ? null : id;
    }
}
