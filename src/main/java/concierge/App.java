package concierge;

import concierge.orchestrator.config.Dependencies;
import concierge.orchestrator.config.OrchestratorConfig;
import concierge.orchestrator.server.OrchestratorServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Headless entry point: wires dependencies, serves HTTP and push, runs the
 * barrier reaper until the JVM is asked to stop.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws InterruptedException {
        OrchestratorConfig config = OrchestratorConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        OrchestratorServer server = deps.newServer();
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            server.stop();
            deps.close();
            stopped.countDown();
        }, "concierge-shutdown"));

        server.start(config.serverHost(), config.serverPort());
        deps.startScheduler();

        stopped.await();
    }
}
