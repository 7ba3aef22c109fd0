package agentpool.dispatcher.alert;

import agentpool.dispatcher.config.DispatcherConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the notification channels named in the configuration.
 */
public final class AlertChannels {

    private static final Logger log = LoggerFactory.getLogger(AlertChannels.class);

    public static final String CONSOLE = "console";
    public static final String WEBHOOK = "webhook";
    public static final String EMAIL = "email";

    private AlertChannels() {
    }

    public static List<AlertChannel> fromConfig(DispatcherConfig config) {
        List<AlertChannel> channels = new ArrayList<>();
        for (String raw : config.alertChannels()) {
            String name = raw.trim().toLowerCase(Locale.ROOT);
            switch (name) {
                case CONSOLE -> channels.add(new LoggingAlertChannel());
                case WEBHOOK -> {
                    if (config.alertWebhookUrl() == null) {
                        log.warn("Alert channel 'webhook' configured without AGENTPOOL_ALERT_WEBHOOK_URL, skipping");
                    } else {
                        channels.add(new WebhookAlertChannel(URI.create(config.alertWebhookUrl()),
                                config.probeTimeout(), config.maxRetries()));
                    }
                }
                case EMAIL -> log.warn("Alert channel 'email' has no mail transport, skipping");
                default -> log.warn("Unknown alert channel '{}', skipping", raw);
            }
        }
        return channels;
    }
}
