package io.atelier.bootstrap;

import io.atelier.application.service.AgentOrchestrator;
import io.atelier.config.OrchestratorConfig;
import io.atelier.domain.event.DomainEvent;
import io.atelier.domain.event.EventKind;
import io.atelier.infrastructure.catalog.StaticPersonaCatalog;
import io.atelier.infrastructure.persistence.FilePreferencesStore;
import io.atelier.infrastructure.scheduling.ExecutorTaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Clock;

/**
 * Standalone entry point (NO framework).
 *
 * Reads one event kind per line from stdin (e.g. {@code generation_completed}) and feeds it
 * to the orchestrator. Messages the agents produce are logged.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== Atelier agent orchestrator starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        OrchestratorConfig config = OrchestratorConfig.fromEnv();
        log.info("Preferences directory: {}", config.preferencesDir().toAbsolutePath());

        Clock clock = Clock.systemUTC();
        ExecutorTaskScheduler scheduler = new ExecutorTaskScheduler("scheduler");
        AgentOrchestrator orchestrator = new AgentOrchestrator(
            new StaticPersonaCatalog(),
            new FilePreferencesStore(config.preferencesDir()),
            scheduler,
            clock,
            config);

        orchestrator.subscribeToMessages(message ->
            log.info("[{}] {} - {}", message.persona().id(), message.title(), message.body()));

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            orchestrator.shutdown();
            scheduler.shutdown();
        }, "atelier-shutdown"));

        try (BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = in.readLine()) != null) {
                String kind = line.trim();
                if (kind.isEmpty()) {
                    continue;
                }
                try {
                    orchestrator.handleEvent(DomainEvent.of(EventKind.fromWireName(kind), clock.instant()));
                } catch (IllegalArgumentException e) {
                    log.warn("Ignoring input line: {}", e.getMessage());
                }
            }
        } catch (IOException e) {
            log.error("Failed to read events from stdin", e);
        }

        log.info("Input closed, stopping");
        orchestrator.shutdown();
        scheduler.shutdown();
    }

    private App() {}
}
