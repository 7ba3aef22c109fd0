package agentpool.dispatcher.api.internal.v1;

import agentpool.dispatcher.api.Controller;
import agentpool.dispatcher.api.internal.v1.dto.OperationResponse;
import agentpool.dispatcher.api.internal.v1.dto.OutcomeRequest;
import agentpool.dispatcher.core.Jsons;
import agentpool.dispatcher.service.MonitoringService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

import java.nio.charset.StandardCharsets;

/**
 * Controller for execution-outcome reporting (internal API).
 * POST /internal/v1/outcomes
 */
public class OutcomeController implements Controller {

    private final MonitoringService monitoring;

    public OutcomeController(MonitoringService monitoring) {
        this.monitoring = monitoring;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && "/internal/v1/outcomes".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        OutcomeRequest request = Jsons.mapper().readValue(body, OutcomeRequest.class);

        // Validate
        request.validate();

        monitoring.recordExecution(request.toOutcome());

        return ControllerResponse.ok(OperationResponse.success());
    }
}
