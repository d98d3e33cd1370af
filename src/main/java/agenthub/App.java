package agenthub;

import agenthub.orchestrator.config.Dependencies;
import agenthub.orchestrator.config.OrchestratorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.concurrent.CountDownLatch;

/**
 * Application entry point.
 * <p>
 * Usage: {@code java -jar agenthub-orchestrator.jar [config.ini]}. Without an argument
 * the configuration comes from the environment ({@code AGENTHUB_*}).
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws InterruptedException {
        OrchestratorConfig config = args.length > 0
                ? OrchestratorConfig.fromIni(new File(args[0]))
                : OrchestratorConfig.fromEnv();

        Dependencies deps = Dependencies.create(config);
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            deps.close();
            stopped.countDown();
        }, "agenthub-shutdown"));

        try {
            deps.start();
            deps.startServer();
        } catch (RuntimeException e) {
            log.error("Failed to start orchestrator", e);
            System.exit(1);
        }

        log.info("AgentHub orchestrator started on port {}", deps.server().port());
        stopped.await();
    }
}
