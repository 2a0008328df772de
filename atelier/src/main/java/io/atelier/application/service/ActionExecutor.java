package io.atelier.application.service;

import io.atelier.application.port.output.TaskScheduler;
import io.atelier.domain.agent.Persona;
import io.atelier.domain.message.AgentAction;
import io.atelier.domain.message.AgentMessage;
import io.atelier.domain.message.Suggestion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Interprets a response to a message.
 *
 * ACTIONS:
 * - APPLY: staged analysis (progress 0..100 in fixed steps on the scheduler), then one new
 *   suggestion and the message marked read
 * - PREVIEW: read-only, returns {preview: true}
 * - MODIFY: opens the panel for the message's persona
 * - DISMISS / SNOOZE / NEVER: dismiss the message. Snooze does not resurface and never does
 *   not mute the trigger type.
 * - CUSTOM: {switchTo: persona} or {action: retry|export}
 *
 * The returned future never completes exceptionally; errors become failed results.
 *
 * ANALYSIS:
 * One global analyzing flag lives in the state. Overlapping APPLY runs interleave their
 * progress updates and each completes the shared flag.
 */
public final class ActionExecutor {
    private static final Logger log = LoggerFactory.getLogger(ActionExecutor.class);

    static final String UNKNOWN_ACTION = "Unknown action";

    private final AgentStateStore stateStore;
    private final SuggestionFactory suggestionFactory;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final Duration stepDelay;
    private final int stepPercent;

    public ActionExecutor(AgentStateStore stateStore, SuggestionFactory suggestionFactory,
                          TaskScheduler scheduler, Clock clock,
                          Duration stepDelay, int stepPercent) {
        if (stepPercent <= 0 || stepPercent > 100) {
            throw new IllegalArgumentException("Analysis step must be within (0, 100]: " + stepPercent);
        }
        this.stateStore = stateStore;
        this.suggestionFactory = suggestionFactory;
        this.scheduler = scheduler;
        this.clock = clock;
        this.stepDelay = stepDelay;
        this.stepPercent = stepPercent;
    }

    public CompletableFuture<ActionResult> execute(AgentMessage message, AgentAction action) {
        try {
            if (action == null || action.kind() == null) {
                return CompletableFuture.completedFuture(ActionResult.failure(UNKNOWN_ACTION));
            }

            log.debug("Executing action {} ({}) on message {}", action.id(), action.kind(), message.id());

            switch (action.kind()) {
                case APPLY:
                    return startAnalysis(message);

                case PREVIEW:
                    return done(ActionResult.ok(Map.of("preview", true)));

                case MODIFY:
                    stateStore.openPanel(message.persona());
                    return done(ActionResult.ok());

                case DISMISS:
                case SNOOZE:
                case NEVER:
                    stateStore.dismiss(message.id());
                    return done(ActionResult.ok());

                case CUSTOM:
                    return done(handleCustom(action));

                default:
                    return done(ActionResult.failure(UNKNOWN_ACTION));
            }
        } catch (RuntimeException e) {
            log.warn("Action {} failed: {}", action != null ? action.id() : null, e.toString());
            return done(ActionResult.failure(String.valueOf(e)));
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // ANALYSIS PIPELINE
    // ═══════════════════════════════════════════════════════════════

    private CompletableFuture<ActionResult> startAnalysis(AgentMessage message) {
        CompletableFuture<ActionResult> result = new CompletableFuture<>();
        stateStore.startAnalysis(message.persona());
        log.info("Analysis started for message {} ({})", message.id(), message.persona().id());
        try {
            scheduleTick(message, 0, result);
        } catch (RuntimeException e) {
            stateStore.abortAnalysis();
            throw e;
        }
        return result;
    }

    private void scheduleTick(AgentMessage message, int progress, CompletableFuture<ActionResult> result) {
        scheduler.schedule(() -> {
            try {
                stateStore.updateAnalysisProgress(progress);
                if (progress >= 100) {
                    result.complete(finishAnalysis(message));
                } else {
                    scheduleTick(message, Math.min(100, progress + stepPercent), result);
                }
            } catch (RuntimeException e) {
                log.error("Analysis for message {} failed at {}%", message.id(), progress, e);
                stateStore.abortAnalysis();
                result.complete(ActionResult.failure(String.valueOf(e)));
            }
        }, stepDelay);
    }

    private ActionResult finishAnalysis(AgentMessage message) {
        synchronized (stateStore) {
            stateStore.completeAnalysis();
            Suggestion.Draft draft = suggestionFactory.create(message.persona());
            Suggestion suggestion = stateStore.addSuggestion(
                draft.toSuggestion(UUID.randomUUID().toString(), clock.instant()));
            stateStore.markRead(message.id());

            log.info("Analysis complete for message {}: suggestion {}", message.id(), suggestion.id());
            return ActionResult.ok(suggestion);
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // CUSTOM
    // ═══════════════════════════════════════════════════════════════

    /**
     * Retry and export are acknowledged only; the host performs them.
     */
    private ActionResult handleCustom(AgentAction action) {
        Map<String, Object> payload = action.payload();

        Object switchTo = payload.get(AgentAction.SWITCH_TO);
        if (switchTo != null) {
            Persona persona = Persona.fromId(String.valueOf(switchTo));
            synchronized (stateStore) {
                stateStore.setActivePersona(persona);
                stateStore.openPanel(null);
            }
            return ActionResult.ok();
        }

        Object hostAction = payload.get(AgentAction.ACTION);
        if ("retry".equals(hostAction) || "export".equals(hostAction)) {
            return ActionResult.ok(Map.of(AgentAction.ACTION, hostAction));
        }

        return ActionResult.ok();
    }

    private static CompletableFuture<ActionResult> done(ActionResult result) {
        return CompletableFuture.completedFuture(result);
    }
}
