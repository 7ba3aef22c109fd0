package agentpool.dispatcher.alert;

import agentpool.dispatcher.model.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Writes alerts to the application log under a dedicated logger name so
 * they can be routed separately.
 */
public class LoggingAlertChannel implements AlertChannel {

    private static final Logger log = LoggerFactory.getLogger("agentpool.alerts");

    @Override
    public String name() {
        return AlertChannels.CONSOLE;
    }

    @Override
    public void send(Alert alert) {
        log.warn("[ALERT] {}: {} (rule={}, id={})",
                alert.severity().name().toUpperCase(Locale.ROOT), alert.message(), alert.ruleId(), alert.id());
    }
}
