package agenthub.orchestrator.config;

import agenthub.orchestrator.api.v1.DeadLetterController;
import agenthub.orchestrator.api.v1.HealthController;
import agenthub.orchestrator.api.v1.StatsController;
import agenthub.orchestrator.api.v1.TaskController;
import agenthub.orchestrator.api.v1.TaskStreamController;
import agenthub.orchestrator.events.EventBus;
import agenthub.orchestrator.events.ProgressStreamer;
import agenthub.orchestrator.idempotency.IdempotencyIndex;
import agenthub.orchestrator.repository.DeadLetterRepository;
import agenthub.orchestrator.repository.TaskRepository;
import agenthub.orchestrator.retry.ErrorClassifier;
import agenthub.orchestrator.retry.ExponentialBackoffRetryPolicy;
import agenthub.orchestrator.retry.RetryPolicy;
import agenthub.orchestrator.scheduler.Dispatcher;
import agenthub.orchestrator.scheduler.ReadyQueue;
import agenthub.orchestrator.scheduler.RetentionSweeper;
import agenthub.orchestrator.scheduler.RetryScheduler;
import agenthub.orchestrator.scheduler.Scheduler;
import agenthub.orchestrator.scheduler.TaskReaper;
import agenthub.orchestrator.server.OrchestratorServer;
import agenthub.orchestrator.server.RouterHandler;
import agenthub.orchestrator.service.ConflictRetry;
import agenthub.orchestrator.service.DeadLetterService;
import agenthub.orchestrator.service.StatsService;
import agenthub.orchestrator.service.TaskExecutionService;
import agenthub.orchestrator.service.TaskService;
import agenthub.orchestrator.store.Database;
import agenthub.orchestrator.store.JdbcDeadLetterRepository;
import agenthub.orchestrator.store.JdbcTaskRepository;
import agenthub.orchestrator.webhook.WebhookNotifier;
import agenthub.orchestrator.webhook.WebhookUrlValidator;
import agenthub.orchestrator.worker.WorkRegistry;
import agenthub.orchestrator.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(OrchestratorConfig.fromEnv());
 * deps.start();        // recovery, dispatcher, maintenance
 * deps.startServer();  // HTTP
 * // ...
 * deps.close();
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final OrchestratorConfig config;
    private final Database database;
    private final TaskRepository taskRepository;
    private final DeadLetterRepository deadLetterRepository;
    private final WorkRegistry workRegistry;

    // Engine
    private final EventBus eventBus;
    private final IdempotencyIndex idempotencyIndex;
    private final ReadyQueue readyQueue;
    private final ConflictRetry conflictRetry;
    private final RetryScheduler retryScheduler;
    private final WebhookNotifier webhookNotifier;
    private final TaskExecutionService executionService;
    private final WorkerPool workerPool;
    private final Dispatcher dispatcher;
    private final ProgressStreamer progressStreamer;

    // Services
    private final TaskService taskService;
    private final DeadLetterService deadLetterService;
    private final StatsService statsService;

    // Maintenance
    private final TaskReaper taskReaper;
    private final RetentionSweeper retentionSweeper;
    private final Scheduler scheduler;

    // Router and server (lazy-initialized)
    private RouterHandler routerHandler;
    private OrchestratorServer server;

    private Dependencies(OrchestratorConfig config, WorkRegistry workRegistry) {
        this.config = config;
        this.workRegistry = workRegistry;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.taskRepository = new JdbcTaskRepository(database);
        this.deadLetterRepository = new JdbcDeadLetterRepository(database);

        // Engine
        this.eventBus = new EventBus();
        this.idempotencyIndex = new IdempotencyIndex(config.idempotencyTtl());
        this.readyQueue = new ReadyQueue(config.queueCapacity());
        this.conflictRetry = new ConflictRetry(config.conflictRetries());
        this.retryScheduler = new RetryScheduler(taskRepository, readyQueue, conflictRetry);
        this.webhookNotifier = new WebhookNotifier(config);
        RetryPolicy retryPolicy = new ExponentialBackoffRetryPolicy(
                config.retryBaseDelay(), config.retryMaxDelay(), config.retryJitter());
        this.executionService = new TaskExecutionService(taskRepository, deadLetterRepository, eventBus,
                retryPolicy, new ErrorClassifier(), retryScheduler, webhookNotifier, conflictRetry);
        this.workerPool = new WorkerPool(
                workRegistry, executionService, config.workerCount());
        this.dispatcher = new Dispatcher(readyQueue, workerPool);
        this.progressStreamer = new ProgressStreamer(taskRepository, eventBus,
                config.streamHeartbeat(), config.streamThreads());

        // Services
        this.taskService = new TaskService(taskRepository, deadLetterRepository, idempotencyIndex, readyQueue,
                workRegistry, workerPool, executionService, retryScheduler, eventBus,
                new WebhookUrlValidator(config.webhookAllowPrivateHosts()), conflictRetry, config);
        this.deadLetterService = new DeadLetterService(deadLetterRepository, taskService);
        this.statsService = new StatsService(taskRepository, deadLetterRepository, readyQueue, workerPool);

        // Maintenance
        this.taskReaper = new TaskReaper(taskRepository, executionService, workerPool, readyQueue,
                retryScheduler, config);
        this.retentionSweeper = new RetentionSweeper(taskRepository, eventBus, idempotencyIndex, config);
        this.scheduler = new Scheduler(taskReaper, retentionSweeper, idempotencyIndex, config);

        log.info("Dependencies initialized successfully ({} agent types: {})",
                workRegistry.agentTypes().size(), workRegistry.agentTypes());
    }

    /**
     * Create dependencies with the given config and the built-in work functions.
     */
    public static Dependencies create(OrchestratorConfig config) {
        return create(config, WorkRegistry.withDefaults());
    }

    public static Dependencies create(OrchestratorConfig config, WorkRegistry workRegistry) {
        return new Dependencies(config, workRegistry);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(OrchestratorConfig.fromEnv());
    }

    /**
     * Recover state left by a previous process, then start the dispatcher and the
     * maintenance scheduler.
     */
    public void start() {
        int restored = idempotencyIndex.restore(
                taskRepository.findWithIdempotencyKeySince(Instant.now().minus(config.idempotencyTtl())));
        int recovered = taskReaper.recoverOnStartup();
        log.debug("Start-up: {} idempotency keys restored, {} tasks recovered", restored, recovered);
        dispatcher.start();
        scheduler.start();
    }

    /**
     * Start the HTTP server. Call after {@link #start()}.
     */
    public OrchestratorServer startServer() {
        if (server == null) {
            server = new OrchestratorServer(routerHandler(), config.serverHost(), config.serverPort(),
                    config.handlerThreads());
        }
        server.start();
        return server;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config.apiKey())
                    .registerController(new HealthController(database, statsService))
                    .registerController(new StatsController(statsService))
                    .registerController(new TaskStreamController(taskService, progressStreamer))
                    .registerController(new TaskController(taskService, config.defaultSyncTimeout()))
                    .registerController(new DeadLetterController(deadLetterService));
            log.info("RouterHandler created with {} controllers", 5);
        }
        return routerHandler;
    }

    // Getters
    public OrchestratorConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public TaskRepository taskRepository() {
        return taskRepository;
    }

    public DeadLetterRepository deadLetterRepository() {
        return deadLetterRepository;
    }

    public WorkRegistry workRegistry() {
        return workRegistry;
    }

    public EventBus eventBus() {
        return eventBus;
    }

    public IdempotencyIndex idempotencyIndex() {
        return idempotencyIndex;
    }

    public ReadyQueue readyQueue() {
        return readyQueue;
    }

    public RetryScheduler retryScheduler() {
        return retryScheduler;
    }

    public TaskExecutionService executionService() {
        return executionService;
    }

    public WorkerPool workerPool() {
        return workerPool;
    }

    public ProgressStreamer progressStreamer() {
        return progressStreamer;
    }

    public TaskService taskService() {
        return taskService;
    }

    public DeadLetterService deadLetterService() {
        return deadLetterService;
    }

    public StatsService statsService() {
        return statsService;
    }

    public TaskReaper taskReaper() {
        return taskReaper;
    }

    public RetentionSweeper retentionSweeper() {
        return retentionSweeper;
    }

    public Scheduler scheduler() {
        return scheduler;
    }

    public OrchestratorServer server() {
        return server;
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        closeQuietly("HTTP server", server);
        closeQuietly("scheduler", scheduler);
        closeQuietly("dispatcher", dispatcher);
        closeQuietly("progress streamer", progressStreamer);
        closeQuietly("worker pool", workerPool);
        closeQuietly("retry scheduler", retryScheduler);
        closeQuietly("webhook notifier", webhookNotifier);
        closeQuietly("database", database);

        log.info("Dependencies closed");
    }

    private static void closeQuietly(String name, AutoCloseable closeable) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (Exception e) {
            log.warn("Error closing {}: {}", name, e.getMessage());
        }
    }
}
