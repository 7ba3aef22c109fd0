package agentpool;

import agentpool.dispatcher.config.Dependencies;
import agentpool.dispatcher.config.DispatcherConfig;
import agentpool.dispatcher.server.DispatcherNettyServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Entry point: HTTP API plus the background monitoring tick.
 *
 * Configuration comes from AGENTPOOL_* environment variables.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws InterruptedException {
        DispatcherConfig config = DispatcherConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        DispatcherNettyServer server = new DispatcherNettyServer(deps.routerHandler());
        CountDownLatch shutdown = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            server.stop();
            deps.close();
            shutdown.countDown();
        }, "agentpool-shutdown"));

        try {
            server.start(config.serverPort());
        } catch (RuntimeException e) {
            log.error("Dispatcher failed to start", e);
            deps.close();
            System.exit(1);
        }
        deps.startScheduler();
        log.info("Agent pool dispatcher ready (strategy {}, probe interval {}ms)",
                config.strategy().wireName(), config.healthCheckInterval().toMillis());

        shutdown.await();
    }
}
