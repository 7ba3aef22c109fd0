package agentpool.dispatcher.core;

@FunctionalInterface
public interface LifecycleListener {

    void onEvent(LifecycleEvent event);
}
