package agentpool.dispatcher.alert;

import agentpool.dispatcher.model.Alert;

/**
 * A notification target for newly created alerts.
 */
public interface AlertChannel {

    /** Name used in configuration, e.g. "console" or "webhook" */
    String name();

    /**
     * Deliver the alert. Exceptions are caught by the engine and only affect
     * this channel.
     */
    void send(Alert alert) throws Exception;
}
