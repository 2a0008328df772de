package io.atelier.application.port.input;

import io.atelier.application.service.ActionResult;
import io.atelier.domain.agent.Persona;
import io.atelier.domain.agent.PersonaProfile;
import io.atelier.domain.event.DomainEvent;
import io.atelier.domain.message.AgentAction;
import io.atelier.domain.message.AgentMessage;
import io.atelier.domain.message.MessageContext;
import io.atelier.domain.message.MessageKind;
import io.atelier.domain.message.Suggestion;
import io.atelier.domain.state.OrchestratorState;
import io.atelier.domain.state.PreferencesUpdate;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Operations the UI layer and the host event source call on the agent orchestrator.
 */
public interface AgentOrchestration {

    // ═══════════════════════════════════════════════════════════════
    // STATE
    // ═══════════════════════════════════════════════════════════════

    OrchestratorState getState();

    Subscription subscribe(Consumer<OrchestratorState> listener);

    Subscription subscribeToMessages(Consumer<AgentMessage> listener);

    // ═══════════════════════════════════════════════════════════════
    // PANEL
    // ═══════════════════════════════════════════════════════════════

    /**
     * Open the agent panel. A null persona keeps the active one (or the Muse if none).
     */
    void openPanel(Persona persona);

    void closePanel();

    void setActivePersona(Persona persona);

    void setPresenceVisible(boolean visible);

    // ═══════════════════════════════════════════════════════════════
    // MESSAGES & SUGGESTIONS
    // ═══════════════════════════════════════════════════════════════

    AgentMessage createMessage(Persona persona, MessageKind kind, String title, String body,
                               List<AgentAction> actions, MessageContext context);

    void markRead(String messageId);

    void dismiss(String messageId);

    void clearMessages();

    Suggestion addSuggestion(Suggestion.Draft draft);

    void removeSuggestion(String suggestionId);

    void clearSuggestions();

    // ═══════════════════════════════════════════════════════════════
    // ANALYSIS
    // ═══════════════════════════════════════════════════════════════

    void startAnalysis(Persona persona);

    void updateAnalysisProgress(int percent);

    void completeAnalysis();

    // ═══════════════════════════════════════════════════════════════
    // PREFERENCES, ACTIONS, EVENTS
    // ═══════════════════════════════════════════════════════════════

    void savePreferences(PreferencesUpdate update);

    /**
     * Execute an action attached to a message. Never completes exceptionally:
     * failures are reported through {@link ActionResult#success()}.
     */
    CompletableFuture<ActionResult> executeAction(AgentMessage message, AgentAction action);

    void handleEvent(DomainEvent event);

    // ═══════════════════════════════════════════════════════════════
    // PERSONAS
    // ═══════════════════════════════════════════════════════════════

    PersonaProfile getPersonaProfile(Persona persona);

    String getSystemPrompt(Persona persona);

    List<PersonaProfile> getAllPersonas();

    List<PersonaProfile> getEnabledPersonas();

    /**
     * Stop the idle watchdog. Pending analysis runs still complete if their scheduler lives.
     */
    void shutdown();
}
