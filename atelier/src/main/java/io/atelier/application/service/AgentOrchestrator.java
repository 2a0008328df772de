package io.atelier.application.service;

import io.atelier.application.port.input.AgentOrchestration;
import io.atelier.application.port.input.Subscription;
import io.atelier.application.port.output.PersonaCatalog;
import io.atelier.application.port.output.PreferencesStore;
import io.atelier.application.port.output.TaskScheduler;
import io.atelier.config.OrchestratorConfig;
import io.atelier.domain.agent.Persona;
import io.atelier.domain.agent.PersonaProfile;
import io.atelier.domain.event.DomainEvent;
import io.atelier.domain.message.AgentAction;
import io.atelier.domain.message.AgentMessage;
import io.atelier.domain.message.MessageContext;
import io.atelier.domain.message.MessageKind;
import io.atelier.domain.message.Suggestion;
import io.atelier.domain.state.AgentPreferences;
import io.atelier.domain.state.OrchestratorState;
import io.atelier.domain.state.PreferencesUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Agent Orchestrator - proactive creative-collaborator engine.
 *
 * FLOW:
 * host event → handleEvent → idle watchdog reset → trigger evaluator → message factory
 * → state store (message added) → listeners → UI executeAction → action executor → state store
 *
 * COLLABORATORS (injected):
 * - PersonaCatalog: display names, icons, prompts
 * - PreferencesStore: key-value persistence for preferences
 * - TaskScheduler + Clock: idle timer and analysis ticks (virtual time in tests)
 *
 * THREAD-SAFETY:
 * Every state transition, trigger cooldown write and idle-timer (re)schedule is serialized on
 * the state store's monitor. Listeners run while it is held.
 */
public final class AgentOrchestrator implements AgentOrchestration {
    private static final Logger log = LoggerFactory.getLogger(AgentOrchestrator.class);

    private final PersonaCatalog catalog;
    private final Clock clock;
    private final PreferencesGateway preferencesGateway;
    private final AgentStateStore stateStore;
    private final TriggerEvaluator triggerEvaluator;
    private final ActionExecutor actionExecutor;
    private final IdleWatchdog idleWatchdog;

    public AgentOrchestrator(PersonaCatalog catalog, PreferencesStore preferencesStore,
                             TaskScheduler scheduler, Clock clock, OrchestratorConfig config) {
        this(catalog, preferencesStore, scheduler, clock, config, TriggerRegistry.defaults(), new MessageFactory());
    }

    public AgentOrchestrator(PersonaCatalog catalog, PreferencesStore preferencesStore,
                             TaskScheduler scheduler, Clock clock, OrchestratorConfig config,
                             TriggerRegistry registry, MessageFactory messageFactory) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.clock = Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(scheduler, "scheduler");
        Objects.requireNonNull(config, "config");

        this.preferencesGateway = new PreferencesGateway(Objects.requireNonNull(preferencesStore, "preferencesStore"));
        this.stateStore = new AgentStateStore(preferencesGateway.loadOrDefaults());
        this.triggerEvaluator = new TriggerEvaluator(registry, messageFactory, catalog, stateStore, clock);
        this.actionExecutor = new ActionExecutor(stateStore, new SuggestionFactory(catalog), scheduler, clock,
                                                 config.analysisStepDelay(), config.analysisStepPercent());
        this.idleWatchdog = new IdleWatchdog(scheduler, clock, stateStore, this::handleEvent);

        log.info("Agent orchestrator ready: {} triggers, {} personas enabled, idle delay {}ms",
            registry.size(),
            stateStore.getState().preferences().enabledPersonas().size(),
            stateStore.getState().preferences().autoSuggestDelayMs());
    }

    // ═══════════════════════════════════════════════════════════════
    // STATE
    // ═══════════════════════════════════════════════════════════════

    @Override
    public OrchestratorState getState() {
        return stateStore.getState();
    }

    @Override
    public Subscription subscribe(Consumer<OrchestratorState> listener) {
        return stateStore.subscribe(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public Subscription subscribeToMessages(Consumer<AgentMessage> listener) {
        return stateStore.subscribeToMessages(Objects.requireNonNull(listener, "listener"));
    }

    // ═══════════════════════════════════════════════════════════════
    // PANEL
    // ═══════════════════════════════════════════════════════════════

    @Override
    public void openPanel(Persona persona) {
        stateStore.openPanel(persona);
    }

    @Override
    public void closePanel() {
        stateStore.closePanel();
    }

    @Override
    public void setActivePersona(Persona persona) {
        stateStore.setActivePersona(Objects.requireNonNull(persona, "persona"));
    }

    @Override
    public void setPresenceVisible(boolean visible) {
        stateStore.setPresenceVisible(visible);
    }

    // ═══════════════════════════════════════════════════════════════
    // MESSAGES & SUGGESTIONS
    // ═══════════════════════════════════════════════════════════════

    @Override
    public AgentMessage createMessage(Persona persona, MessageKind kind, String title, String body,
                                      List<AgentAction> actions, MessageContext context) {
        AgentMessage message = new AgentMessage(
            UUID.randomUUID().toString(), persona, kind, title, body, clock.instant(),
            false, false, actions, context);
        stateStore.addMessage(message);
        return message;
    }

    @Override
    public void markRead(String messageId) {
        stateStore.markRead(Objects.requireNonNull(messageId, "messageId"));
    }

    @Override
    public void dismiss(String messageId) {
        stateStore.dismiss(Objects.requireNonNull(messageId, "messageId"));
    }

    @Override
    public void clearMessages() {
        stateStore.clearMessages();
    }

    @Override
    public Suggestion addSuggestion(Suggestion.Draft draft) {
        Objects.requireNonNull(draft, "draft");
        return stateStore.addSuggestion(draft.toSuggestion(UUID.randomUUID().toString(), clock.instant()));
    }

    @Override
    public void removeSuggestion(String suggestionId) {
        stateStore.removeSuggestion(Objects.requireNonNull(suggestionId, "suggestionId"));
    }

    @Override
    public void clearSuggestions() {
        stateStore.clearSuggestions();
    }

    // ═══════════════════════════════════════════════════════════════
    // ANALYSIS
    // ═══════════════════════════════════════════════════════════════

    @Override
    public void startAnalysis(Persona persona) {
        stateStore.startAnalysis(Objects.requireNonNull(persona, "persona"));
    }

    @Override
    public void updateAnalysisProgress(int percent) {
        stateStore.updateAnalysisProgress(percent);
    }

    @Override
    public void completeAnalysis() {
        stateStore.completeAnalysis();
    }

    // ═══════════════════════════════════════════════════════════════
    // PREFERENCES
    // ═══════════════════════════════════════════════════════════════

    /**
     * Merge, publish, then persist. A failed save leaves the merged preferences in effect.
     * An update whose merge is invalid (non-positive idle delay) is ignored.
     */
    @Override
    public void savePreferences(PreferencesUpdate update) {
        AgentPreferences merged;
        synchronized (stateStore) {
            merged = stateStore.getState().preferences().merge(update);
            if (!merged.isValid()) {
                log.warn("Ignoring invalid preferences update: autoSuggestDelayMs={}", merged.autoSuggestDelayMs());
                return;
            }
            stateStore.replacePreferences(merged);
        }
        preferencesGateway.save(merged);
    }

    // ═══════════════════════════════════════════════════════════════
    // ACTIONS & EVENTS
    // ═══════════════════════════════════════════════════════════════

    @Override
    public CompletableFuture<ActionResult> executeAction(AgentMessage message, AgentAction action) {
        return actionExecutor.execute(message, action);
    }

    @Override
    public void handleEvent(DomainEvent event) {
        Objects.requireNonNull(event, "event");
        synchronized (stateStore) {
            AgentPreferences preferences = stateStore.getState().preferences();
            log.debug("Event received: {}", event.kind().wireName());

            idleWatchdog.reset(event.timestamp(), Duration.ofMillis(preferences.autoSuggestDelayMs()));
            triggerEvaluator.evaluate(event, preferences);
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // PERSONAS
    // ═══════════════════════════════════════════════════════════════

    @Override
    public PersonaProfile getPersonaProfile(Persona persona) {
        return catalog.profile(persona);
    }

    @Override
    public String getSystemPrompt(Persona persona) {
        return catalog.profile(persona).systemPrompt();
    }

    @Override
    public List<PersonaProfile> getAllPersonas() {
        return catalog.all();
    }

    @Override
    public List<PersonaProfile> getEnabledPersonas() {
        AgentPreferences preferences = stateStore.getState().preferences();
        return catalog.all().stream()
            .filter(p -> preferences.isEnabled(p.persona()))
            .collect(Collectors.toList());
    }

    @Override
    public void shutdown() {
        idleWatchdog.stop();
        log.info("Agent orchestrator shut down");
    }

    /**
     * @return true while an idle timer is scheduled
     */
    public boolean isIdleTimerPending() {
        return idleWatchdog.hasPendingTimer();
    }
}
