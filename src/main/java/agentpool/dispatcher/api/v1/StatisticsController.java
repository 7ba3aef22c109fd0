package agentpool.dispatcher.api.v1;

import agentpool.dispatcher.api.Controller;
import agentpool.dispatcher.service.Dispatcher;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

/**
 * GET /api/v1/statistics
 */
public class StatisticsController implements Controller {

    private final Dispatcher dispatcher;

    public StatisticsController(Dispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/statistics".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        return ControllerResponse.ok(dispatcher.getStatistics());
    }
}
