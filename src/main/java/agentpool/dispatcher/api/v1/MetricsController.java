package agentpool.dispatcher.api.v1;

import agentpool.dispatcher.api.Controller;
import agentpool.dispatcher.api.Paths;
import agentpool.dispatcher.model.TimeRange;
import agentpool.dispatcher.service.MonitoringService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Controller for aggregated metrics.
 * GET /api/v1/metrics/agents/{agentType}?from=&to=
 * GET /api/v1/metrics/system?from=&to=
 *
 * from/to are ISO-8601 instants; the default range is the last hour.
 */
public class MetricsController implements Controller {

    private static final String AGENT_PREFIX = "/api/v1/metrics/agents/";
    private static final String SYSTEM_PATH = "/api/v1/metrics/system";
    private static final Duration DEFAULT_RANGE = Duration.ofHours(1);

    private final MonitoringService monitoring;
    private final Clock clock;

    public MetricsController(MonitoringService monitoring, Clock clock) {
        this.monitoring = monitoring;
        this.clock = clock;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (!method.equals(HttpMethod.GET)) {
            return false;
        }
        return SYSTEM_PATH.equals(path) || Paths.segmentAfter(path, AGENT_PREFIX) != null;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        TimeRange range = range(req.uri());
        Object body = SYSTEM_PATH.equals(path)
                ? monitoring.getSystemMetrics(range)
                : monitoring.getAgentMetrics(Paths.segmentAfter(path, AGENT_PREFIX), range);
        return ControllerResponse.ok(body);
    }

    TimeRange range(String uri) {
        Instant now = clock.instant();
        Instant to = Paths.instantParam(uri, "to", now);
        Instant from = Paths.instantParam(uri, "from", to.minus(DEFAULT_RANGE));
        return new TimeRange(from, to);
    }
}
