package agentpool.dispatcher.api.v1;

import agentpool.dispatcher.api.Controller;
import agentpool.dispatcher.api.v1.dto.HealthResponse;
import agentpool.dispatcher.model.DispatcherStatistics;
import agentpool.dispatcher.service.Dispatcher;
import agentpool.dispatcher.service.MonitoringService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 *
 * Reports "degraded" when the healthy share of instances is below the
 * failover threshold.
 */
public class HealthController implements Controller {

    private static final String VERSION = "1.0.0";

    private final Dispatcher dispatcher;
    private final MonitoringService monitoring;
    private final double failoverThreshold;

    public HealthController(Dispatcher dispatcher, MonitoringService monitoring, double failoverThreshold) {
        this.dispatcher = dispatcher;
        this.monitoring = monitoring;
        this.failoverThreshold = failoverThreshold;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        DispatcherStatistics stats = dispatcher.getStatistics();

        HealthResponse response = new HealthResponse(
                status(stats.healthyInstances(), stats.totalInstances()),
                formatUptime(),
                VERSION,
                stats.totalInstances(),
                stats.healthyInstances(),
                monitoring.getActiveAlerts().size(),
                stats.strategy());

        return ControllerResponse.ok(response);
    }

    String status(int healthy, int total) {
        if (total == 0) {
            return "healthy";
        }
        return (double) healthy / total < failoverThreshold ? "degraded" : "healthy";
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
