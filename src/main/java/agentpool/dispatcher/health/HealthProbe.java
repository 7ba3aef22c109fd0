package agentpool.dispatcher.health;

import agentpool.dispatcher.model.AgentInstance;

/**
 * One health call against one instance. Any exception counts as a failed probe.
 * A call still running at the prober's timeout is interrupted, so blocking
 * implementations should respond to interruption.
 */
@FunctionalInterface
public interface HealthProbe {

    HealthReport check(AgentInstance instance) throws Exception;
}
