package agentpool.dispatcher.api.v1;

import agentpool.dispatcher.alert.AlertRules;
import agentpool.dispatcher.api.Controller;
import agentpool.dispatcher.api.Paths;
import agentpool.dispatcher.api.internal.v1.dto.OperationResponse;
import agentpool.dispatcher.api.v1.dto.AlertResponse;
import agentpool.dispatcher.api.v1.dto.AlertRuleResponse;
import agentpool.dispatcher.api.v1.dto.CreateAlertRuleRequest;
import agentpool.dispatcher.config.DispatcherConfig;
import agentpool.dispatcher.core.Jsons;
import agentpool.dispatcher.model.Alert;
import agentpool.dispatcher.model.AlertCondition;
import agentpool.dispatcher.model.AlertRule;
import agentpool.dispatcher.service.MonitoringService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Controller for alerts and alert rules.
 * GET /api/v1/alerts - Active alerts, most severe first (?all=true for every alert)
 * POST /api/v1/alerts/{id}/acknowledge
 * POST /api/v1/alerts/{id}/resolve
 * POST /api/v1/alert-rules - Add or replace a rule; a missing threshold takes the configured one
 */
public class AlertController implements Controller {

    private static final String ALERTS = "/api/v1/alerts";
    private static final String ALERT_PREFIX = ALERTS + "/";
    private static final String RULES = "/api/v1/alert-rules";
    private static final String ACKNOWLEDGE = "/acknowledge";
    private static final String RESOLVE = "/resolve";

    private final MonitoringService monitoring;
    private final DispatcherConfig config;

    public AlertController(MonitoringService monitoring, DispatcherConfig config) {
        this.monitoring = monitoring;
        this.config = config;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.GET)) {
            return ALERTS.equals(path);
        }
        if (!method.equals(HttpMethod.POST)) {
            return false;
        }
        return RULES.equals(path) || alertIdFor(path, ACKNOWLEDGE) != null || alertIdFor(path, RESOLVE) != null;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        if (req.method().equals(HttpMethod.GET)) {
            boolean all = "true".equalsIgnoreCase(Paths.queryParam(req.uri(), "all"));
            List<Alert> alerts = all ? monitoring.getAlerts() : monitoring.getActiveAlerts();
            List<AlertResponse> body = alerts.stream().map(AlertResponse::from).toList();
            return ControllerResponse.ok(Map.of("alerts", body));
        }
        if (RULES.equals(path)) {
            return handleAddRule(req);
        }

        String acknowledgeId = alertIdFor(path, ACKNOWLEDGE);
        boolean found = acknowledgeId != null
                ? monitoring.acknowledgeAlert(acknowledgeId)
                : monitoring.resolveAlert(alertIdFor(path, RESOLVE));
        if (!found) {
            return ControllerResponse.of(HttpResponseStatus.NOT_FOUND, OperationResponse.alertNotFound());
        }
        return ControllerResponse.ok(OperationResponse.success());
    }

    private ControllerResponse handleAddRule(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        CreateAlertRuleRequest request = Jsons.mapper().readValue(body, CreateAlertRuleRequest.class);

        request.validate();

        double fallback = AlertRules.defaultThreshold(AlertCondition.fromWire(request.condition()), config);
        AlertRule rule = request.toRule(fallback);
        monitoring.addAlertRule(rule);
        return ControllerResponse.of(HttpResponseStatus.CREATED, AlertRuleResponse.from(rule));
    }

    /** Alert id from {@code /api/v1/alerts/{id}<suffix>}, or null */
    private static String alertIdFor(String path, String suffix) {
        if (!path.startsWith(ALERT_PREFIX) || !path.endsWith(suffix)) {
            return null;
        }
        String id = path.substring(ALERT_PREFIX.length(), path.length() - suffix.length());
        return id.isEmpty() || id.contains("/") ? null : id;
    }
}
