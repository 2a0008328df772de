package io.atelier.application.service;

import io.atelier.application.port.input.Subscription;
import io.atelier.domain.agent.Persona;
import io.atelier.domain.message.AgentMessage;
import io.atelier.domain.message.Suggestion;
import io.atelier.domain.state.AgentPreferences;
import io.atelier.domain.state.OrchestratorState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * AgentStateStore - single owner of the orchestrator snapshot.
 *
 * PURPOSE:
 * Every mutation computes a new immutable {@link OrchestratorState}, swaps it in and
 * synchronously notifies state listeners. Adding a message also notifies message listeners
 * with just that message.
 *
 * CAPACITY:
 * - messages: 50, oldest evicted first regardless of read/dismissed state
 * - suggestions: 10, oldest evicted first
 *
 * THREAD-SAFETY:
 * All mutators are synchronized on this store. The orchestrator, idle watchdog and action
 * executor use the same monitor for multi-step transitions, so the store's monitor is the
 * one lock guarding orchestrator state.
 *
 * LISTENERS:
 * Called in subscription order. A listener that throws is logged and skipped; the rest
 * are still notified.
 */
public final class AgentStateStore {
    private static final Logger log = LoggerFactory.getLogger(AgentStateStore.class);

    public static final int MAX_MESSAGES = 50;
    public static final int MAX_SUGGESTIONS = 10;

    private final Set<Consumer<OrchestratorState>> stateListeners = new CopyOnWriteArraySet<>();
    private final Set<Consumer<AgentMessage>> messageListeners = new CopyOnWriteArraySet<>();

    private volatile OrchestratorState state;

    public AgentStateStore(AgentPreferences preferences) {
        this.state = OrchestratorState.initial(preferences);
    }

    public OrchestratorState getState() {
        return state;
    }

    public Subscription subscribe(Consumer<OrchestratorState> listener) {
        stateListeners.add(listener);
        return () -> stateListeners.remove(listener);
    }

    public Subscription subscribeToMessages(Consumer<AgentMessage> listener) {
        messageListeners.add(listener);
        return () -> messageListeners.remove(listener);
    }

    // ═══════════════════════════════════════════════════════════════
    // PANEL & PRESENCE
    // ═══════════════════════════════════════════════════════════════

    /**
     * Open the panel for {@code persona}; null keeps the active persona, falling back to the Muse.
     */
    public synchronized void openPanel(Persona persona) {
        Persona target = persona != null ? persona
            : state.activePersona() != null ? state.activePersona() : Persona.MUSE;
        update(s -> s.withPanel(true, target));
    }

    public synchronized void closePanel() {
        update(s -> s.withPanel(false, s.activePersona()));
    }

    public synchronized void setActivePersona(Persona persona) {
        update(s -> s.withActivePersona(persona));
    }

    public synchronized void setPresenceVisible(boolean visible) {
        update(s -> s.withPresenceVisible(visible));
    }

    // ═══════════════════════════════════════════════════════════════
    // MESSAGES
    // ═══════════════════════════════════════════════════════════════

    /**
     * Append a message, evicting the oldest beyond capacity, then notify both channels.
     */
    public synchronized void addMessage(AgentMessage message) {
        List<AgentMessage> messages = new ArrayList<>(state.messages());
        messages.add(message);
        while (messages.size() > MAX_MESSAGES) {
            AgentMessage evicted = messages.remove(0);
            log.debug("Message evicted at capacity: {}", evicted.id());
        }
        update(s -> s.withMessages(messages));
        notifyMessageListeners(message);
    }

    public synchronized void markRead(String messageId) {
        update(s -> s.withMessages(replace(s.messages(), messageId, AgentMessage::markedRead)));
    }

    public synchronized void dismiss(String messageId) {
        update(s -> s.withMessages(replace(s.messages(), messageId, AgentMessage::markedDismissed)));
    }

    public synchronized void clearMessages() {
        update(s -> s.withMessages(List.of()));
    }

    // ═══════════════════════════════════════════════════════════════
    // SUGGESTIONS
    // ═══════════════════════════════════════════════════════════════

    public synchronized Suggestion addSuggestion(Suggestion suggestion) {
        List<Suggestion> suggestions = new ArrayList<>(state.suggestions());
        suggestions.add(suggestion);
        while (suggestions.size() > MAX_SUGGESTIONS) {
            suggestions.remove(0);
        }
        update(s -> s.withSuggestions(suggestions));
        return suggestion;
    }

    public synchronized void removeSuggestion(String suggestionId) {
        List<Suggestion> suggestions = new ArrayList<>(state.suggestions());
        suggestions.removeIf(s -> s.id().equals(suggestionId));
        update(s -> s.withSuggestions(suggestions));
    }

    public synchronized void clearSuggestions() {
        update(s -> s.withSuggestions(List.of()));
    }

    // ═══════════════════════════════════════════════════════════════
    // ANALYSIS
    // ═══════════════════════════════════════════════════════════════

    public synchronized void startAnalysis(Persona persona) {
        update(s -> s.withAnalysis(true, 0).withActivePersona(persona));
    }

    /**
     * Set analysis progress, clamped to [0, 100].
     */
    public synchronized void updateAnalysisProgress(int percent) {
        int clamped = Math.min(100, Math.max(0, percent));
        update(s -> s.withAnalysis(s.analyzing(), clamped));
    }

    public synchronized void completeAnalysis() {
        update(s -> s.withAnalysis(false, 100));
    }

    /**
     * Clear the analyzing flag without claiming completion; progress stays where it stopped.
     */
    public synchronized void abortAnalysis() {
        update(s -> s.withAnalysis(false, s.analysisProgress()));
    }

    // ═══════════════════════════════════════════════════════════════
    // PREFERENCES
    // ═══════════════════════════════════════════════════════════════

    public synchronized void replacePreferences(AgentPreferences preferences) {
        update(s -> s.withPreferences(preferences));
    }

    // ═══════════════════════════════════════════════════════════════
    // INTERNAL
    // ═══════════════════════════════════════════════════════════════

    private void update(UnaryOperator<OrchestratorState> transition) {
        OrchestratorState next = transition.apply(state);
        state = next;
        notifyStateListeners(next);
    }

    private static List<AgentMessage> replace(List<AgentMessage> messages, String messageId,
                                              UnaryOperator<AgentMessage> change) {
        List<AgentMessage> result = new ArrayList<>(messages.size());
        for (AgentMessage m : messages) {
            result.add(m.id().equals(messageId) ? change.apply(m) : m);
        }
        return result;
    }

    /**
     * @return number of listeners that threw
     */
    int notifyStateListeners(OrchestratorState snapshot) {
        int failures = 0;
        for (Consumer<OrchestratorState> listener : stateListeners) {
            try {
                listener.accept(snapshot);
            } catch (RuntimeException e) {
                failures++;
                log.error("State listener {} threw exception", listener, e);
            }
        }
        return failures;
    }

    /**
     * @return number of listeners that threw
     */
    int notifyMessageListeners(AgentMessage message) {
        int failures = 0;
        for (Consumer<AgentMessage> listener : messageListeners) {
            try {
                listener.accept(message);
            } catch (RuntimeException e) {
                failures++;
                log.error("Message listener {} threw exception for message {}", listener, message.id(), e);
            }
        }
        return failures;
    }
}
