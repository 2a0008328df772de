package io.atelier.domain.state;

import io.atelier.domain.agent.Persona;
import io.atelier.domain.message.AgentMessage;
import io.atelier.domain.message.Suggestion;

import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of the orchestrator.
 *
 * <p>{@code unreadCount} always equals the number of messages that are neither read nor
 * dismissed; {@link #withMessages(List)} is the only way to change the message list and
 * recomputes it.
 */
public record OrchestratorState(
    Persona activePersona,           // null until a panel has been opened
    boolean panelOpen,
    boolean presenceVisible,
    List<AgentMessage> messages,     // oldest first
    int unreadCount,
    boolean analyzing,
    int analysisProgress,            // 0 - 100
    List<Suggestion> suggestions,    // oldest first
    AgentPreferences preferences
) {
    public OrchestratorState {
        messages = messages == null ? List.of() : List.copyOf(messages);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        Objects.requireNonNull(preferences, "preferences");
    }

    public static OrchestratorState initial(AgentPreferences preferences) {
        return new OrchestratorState(null, false, true, List.of(), 0, false, 0, List.of(), preferences);
    }

    public OrchestratorState withPanel(boolean open, Persona persona) {
        return new OrchestratorState(persona, open, presenceVisible, messages, unreadCount,
                                     analyzing, analysisProgress, suggestions, preferences);
    }

    public OrchestratorState withActivePersona(Persona persona) {
        return new OrchestratorState(persona, panelOpen, presenceVisible, messages, unreadCount,
                                     analyzing, analysisProgress, suggestions, preferences);
    }

    public OrchestratorState withPresenceVisible(boolean visible) {
        return new OrchestratorState(activePersona, panelOpen, visible, messages, unreadCount,
                                     analyzing, analysisProgress, suggestions, preferences);
    }

    public OrchestratorState withMessages(List<AgentMessage> newMessages) {
        int unread = (int) newMessages.stream().filter(AgentMessage::isUnread).count();
        return new OrchestratorState(activePersona, panelOpen, presenceVisible, newMessages, unread,
                                     analyzing, analysisProgress, suggestions, preferences);
    }

    public OrchestratorState withAnalysis(boolean isAnalyzing, int progress) {
        return new OrchestratorState(activePersona, panelOpen, presenceVisible, messages, unreadCount,
                                     isAnalyzing, progress, suggestions, preferences);
    }

    public OrchestratorState withSuggestions(List<Suggestion> newSuggestions) {
        return new OrchestratorState(activePersona, panelOpen, presenceVisible, messages, unreadCount,
                                     analyzing, analysisProgress, newSuggestions, preferences);
    }

    public OrchestratorState withPreferences(AgentPreferences newPreferences) {
        return new OrchestratorState(activePersona, panelOpen, presenceVisible, messages, unreadCount,
                                     analyzing, analysisProgress, suggestions, newPreferences);
    }
}
