package agentpool.dispatcher.api.v1;

import agentpool.dispatcher.api.Controller;
import agentpool.dispatcher.api.Paths;
import agentpool.dispatcher.api.v1.dto.DispatchRequest;
import agentpool.dispatcher.api.v1.dto.DispatchResponse;
import agentpool.dispatcher.api.v1.dto.InstanceResponse;
import agentpool.dispatcher.core.Jsons;
import agentpool.dispatcher.model.AgentInstance;
import agentpool.dispatcher.model.RequestHints;
import agentpool.dispatcher.model.SelectionResult;
import agentpool.dispatcher.service.Dispatcher;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.nio.charset.StandardCharsets;

/**
 * Controller for instance selection.
 * POST /api/v1/dispatch/{agentType} - 200 with the chosen instance, 503 when
 * nothing is available
 */
public class DispatchController implements Controller {

    private static final String PREFIX = "/api/v1/dispatch/";

    private final Dispatcher dispatcher;

    public DispatchController(Dispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && Paths.segmentAfter(path, PREFIX) != null;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        String agentType = Paths.segmentAfter(path, PREFIX);

        RequestHints hints = RequestHints.defaults();
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (!body.isBlank()) {
            hints = Jsons.mapper().readValue(body, DispatchRequest.class).toHints();
        }

        SelectionResult result = dispatcher.selectInstance(agentType, hints);
        if (!result.isSelected()) {
            DispatchResponse response = DispatchResponse.unavailable(result.outcome().name(), agentType);
            return ControllerResponse.of(HttpResponseStatus.SERVICE_UNAVAILABLE, response);
        }

        AgentInstance chosen = result.selected();
        InstanceResponse instance = InstanceResponse.from(chosen, null);
        return ControllerResponse.ok(DispatchResponse.selected(agentType, instance));
    }
}
