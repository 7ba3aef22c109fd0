package agentpool.dispatcher.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Synchronous fan-out of lifecycle events to subscribed listeners.
 * Listeners are invoked on the publishing thread in subscription order;
 * a failing listener is logged and does not stop delivery to the rest.
 */
public final class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<LifecycleListener> listeners = new CopyOnWriteArrayList<>();

    public void subscribe(LifecycleListener listener) {
        listeners.add(listener);
    }

    public void unsubscribe(LifecycleListener listener) {
        listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    public void publish(LifecycleEvent event) {
        for (var listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (Exception e) {
                log.warn("Listener {} failed on {}: {}", listener, event.type(), e.getMessage(), e);
            }
        }
    }
}
