package agentpool.dispatcher.api.v1;

import agentpool.dispatcher.api.Controller;
import agentpool.dispatcher.api.Paths;
import agentpool.dispatcher.api.internal.v1.dto.OperationResponse;
import agentpool.dispatcher.api.v1.dto.InstanceResponse;
import agentpool.dispatcher.api.v1.dto.RegisterInstanceRequest;
import agentpool.dispatcher.core.Jsons;
import agentpool.dispatcher.model.AgentInstance;
import agentpool.dispatcher.model.CircuitState;
import agentpool.dispatcher.service.Dispatcher;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Controller for the instance pool.
 * GET /api/v1/instances - List all instances
 * POST /api/v1/instances - Register an instance
 * DELETE /api/v1/instances/{id} - Deregister an instance
 */
public class InstanceController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(InstanceController.class);

    private static final String COLLECTION = "/api/v1/instances";
    private static final String ITEM_PREFIX = COLLECTION + "/";

    private final Dispatcher dispatcher;
    private final Clock clock;

    public InstanceController(Dispatcher dispatcher, Clock clock) {
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (COLLECTION.equals(path)) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.POST);
        }
        return method.equals(HttpMethod.DELETE) && Paths.segmentAfter(path, ITEM_PREFIX) != null;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        if (req.method().equals(HttpMethod.GET)) {
            return handleList();
        }
        if (req.method().equals(HttpMethod.POST)) {
            return handleRegister(req);
        }
        return handleDeregister(Paths.segmentAfter(path, ITEM_PREFIX));
    }

    private ControllerResponse handleList() throws Exception {
        List<InstanceResponse> instances = dispatcher.instances().stream()
                .map(this::toResponse)
                .toList();
        return ControllerResponse.ok(Map.of("instances", instances));
    }

    private ControllerResponse handleRegister(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        RegisterInstanceRequest request = Jsons.mapper().readValue(body, RegisterInstanceRequest.class);

        request.validate();

        AgentInstance instance = request.toInstance(clock.instant());
        if (dispatcher.findInstance(instance.id()).isPresent()) {
            log.warn("Rejected duplicate registration of instance {}", instance.id());
            return ControllerResponse.conflict("instance already registered: " + instance.id());
        }

        AgentInstance stored = dispatcher.register(instance);
        return ControllerResponse.of(HttpResponseStatus.CREATED, toResponse(stored));
    }

    private ControllerResponse handleDeregister(String instanceId) throws Exception {
        if (!dispatcher.deregister(instanceId)) {
            return ControllerResponse.notFound("instance not found: " + instanceId);
        }
        return ControllerResponse.ok(OperationResponse.success());
    }

    private InstanceResponse toResponse(AgentInstance instance) {
        String state = dispatcher.circuitState(instance.id())
                .map(CircuitState::name)
                .map(name -> name.toLowerCase(Locale.ROOT))
                .orElse(null);
        return InstanceResponse.from(instance, state);
    }
}
