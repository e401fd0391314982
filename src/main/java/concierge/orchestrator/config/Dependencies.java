package concierge.orchestrator.config;

import concierge.orchestrator.api.internal.v1.CommisController;
import concierge.orchestrator.api.v1.HealthController;
import concierge.orchestrator.api.v1.RunController;
import concierge.orchestrator.repository.EventLog;
import concierge.orchestrator.repository.RunStore;
import concierge.orchestrator.scheduler.BarrierReaper;
import concierge.orchestrator.scheduler.Scheduler;
import concierge.orchestrator.server.OrchestratorServer;
import concierge.orchestrator.server.RouterHandler;
import concierge.orchestrator.service.BarrierController;
import concierge.orchestrator.service.CommisDispatcher;
import concierge.orchestrator.service.CommisWorker;
import concierge.orchestrator.service.ConciergeStep;
import concierge.orchestrator.service.EventBroker;
import concierge.orchestrator.service.RunOrchestrator;
import concierge.orchestrator.service.RunService;
import concierge.orchestrator.service.RunStateMachine;
import concierge.orchestrator.simulation.ScriptedConcierge;
import concierge.orchestrator.simulation.SimulatedCommisWorker;
import concierge.orchestrator.store.Database;
import concierge.orchestrator.store.JdbcEventLog;
import concierge.orchestrator.store.JdbcRunStore;
import concierge.orchestrator.util.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(OrchestratorConfig.fromEnv());
 * deps.startScheduler(); // start background tasks
 * RunService runService = deps.runService();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final OrchestratorConfig config;
    private final Database database;
    private final EventLog eventLog;
    private final RunStore runStore;
    private final EventBroker eventBroker;
    private final RetryPolicy retryPolicy;
    private final ExecutorService commisPool;
    private final ExecutorService orchestratorExecutor;
    private final RunStateMachine stateMachine;
    private final BarrierController barrierController;
    private final CommisDispatcher dispatcher;
    private final RunOrchestrator orchestrator;
    private final RunService runService;

    // Controllers
    private final HealthController healthController;
    private final RunController runController;
    private final CommisController commisController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    // Scheduler (lazy-initialized)
    private Scheduler scheduler;

    private Dependencies(OrchestratorConfig config, ConciergeStep concierge, CommisWorker worker) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.eventBroker = new EventBroker();
        this.retryPolicy = new RetryPolicy(config.appendMaxAttempts(), config.appendBaseDelay(),
                config.appendMaxDelay());
        this.commisPool = Executors.newFixedThreadPool(config.commisThreads(), named("commis"));
        this.orchestratorExecutor = Executors.newFixedThreadPool(
                Math.max(2, config.commisThreads() / 2), named("concierge"));

        // Repositories
        this.eventLog = new JdbcEventLog(database);
        this.runStore = new JdbcRunStore(database);

        // Services
        this.stateMachine = new RunStateMachine(runStore, eventBroker, retryPolicy);
        this.barrierController = new BarrierController(runStore, stateMachine);
        this.dispatcher = new CommisDispatcher(runStore, stateMachine, barrierController, worker, commisPool);
        this.orchestrator = new RunOrchestrator(stateMachine, dispatcher, concierge, orchestratorExecutor);
        this.runService = new RunService(runStore, eventLog, orchestrator, dispatcher);

        // Controllers (public API)
        this.healthController = new HealthController(database, runService);
        this.runController = new RunController(runService);

        // Controllers (internal API)
        this.commisController = new CommisController(runService);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config and custom concierge logic.
     */
    public static Dependencies create(OrchestratorConfig config, ConciergeStep concierge, CommisWorker worker) {
        return new Dependencies(config, concierge, worker);
    }

    /**
     * Create dependencies with the given config, the scripted concierge and
     * in-process simulated commis.
     */
    public static Dependencies create(OrchestratorConfig config) {
        return create(config, new ScriptedConcierge(), new SimulatedCommisWorker(50, 250));
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(OrchestratorConfig.fromEnv());
    }

    // Getters
    public OrchestratorConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public EventLog eventLog() {
        return eventLog;
    }

    public RunStore runStore() {
        return runStore;
    }

    public EventBroker eventBroker() {
        return eventBroker;
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    public RunStateMachine stateMachine() {
        return stateMachine;
    }

    public BarrierController barrierController() {
        return barrierController;
    }

    public CommisDispatcher dispatcher() {
        return dispatcher;
    }

    public RunOrchestrator orchestrator() {
        return orchestrator;
    }

    public RunService runService() {
        return runService;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(healthController)
                    .registerController(runController)
                    .registerController(commisController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    /**
     * Build a server over the router, the run service and the broker.
     */
    public OrchestratorServer newServer() {
        return new OrchestratorServer(routerHandler(), runService, eventBroker);
    }

    /**
     * Get the scheduler (creates it if not yet created).
     */
    public Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(new BarrierReaper(runStore, dispatcher, config), config);
        }
        return scheduler;
    }

    /**
     * Start the background scheduler for barrier reaping.
     * Should be called after server startup.
     */
    public void startScheduler() {
        scheduler().start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop scheduler first
        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        shutdown("commis pool", commisPool);
        shutdown("concierge executor", orchestratorExecutor);

        // Close database
        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }

    private static void shutdown(String name, ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("{} forcefully stopped", name);
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
