package io.atelier.application.service;

import io.atelier.application.port.input.Subscription;
import io.atelier.domain.agent.Persona;
import io.atelier.domain.message.AgentMessage;
import io.atelier.domain.message.MessageKind;
import io.atelier.domain.message.Suggestion;
import io.atelier.domain.state.AgentPreferences;
import io.atelier.domain.state.OrchestratorState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for AgentStateStore.
 *
 * Tests:
 * - Unread count tracks read/dismissed transitions
 * - Message and suggestion capacity with oldest-first eviction
 * - Listener notification, isolation and unsubscribe
 * - Panel, presence and analysis transitions
 */
class AgentStateStoreTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private AgentStateStore store;

    @BeforeEach
    void setUp() {
        store = new AgentStateStore(AgentPreferences.defaults());
    }

    private static AgentMessage message(String id) {
        return new AgentMessage(id, Persona.MUSE, MessageKind.SUGGESTION, "title " + id, "body",
            T0, false, false, List.of(), null);
    }

    private static Suggestion suggestion(String id) {
        return new Suggestion(id, Persona.CURATOR, "t", "d", null, 0.5, List.of(), T0);
    }

    @Test
    void testInitialState() {
        OrchestratorState state = store.getState();

        assertNull(state.activePersona(), "No persona active initially");
        assertFalse(state.panelOpen());
        assertTrue(state.presenceVisible(), "Presence visible by default");
        assertTrue(state.messages().isEmpty());
        assertEquals(0, state.unreadCount());
        assertFalse(state.analyzing());
        assertEquals(AgentPreferences.defaults(), state.preferences());
    }

    @Test
    void testUnreadCountFollowsReadAndDismiss() {
        store.addMessage(message("a"));
        store.addMessage(message("b"));
        store.addMessage(message("c"));
        assertEquals(3, store.getState().unreadCount());

        store.markRead("a");
        assertEquals(2, store.getState().unreadCount());

        store.dismiss("b");
        assertEquals(1, store.getState().unreadCount(), "Dismissed messages are not unread");

        store.markRead("a");
        assertEquals(1, store.getState().unreadCount(), "markRead is idempotent");

        store.markRead("unknown");
        assertEquals(1, store.getState().unreadCount(), "Unknown id is a no-op");
    }

    @Test
    void testDismissIsMonotone() {
        store.addMessage(message("a"));
        store.dismiss("a");
        store.markRead("a");

        AgentMessage a = store.getState().messages().get(0);
        assertTrue(a.dismissed(), "Dismissed stays true");
        assertTrue(a.read());
    }

    @Test
    void testMessageCapacityEvictsOldest() {
        for (int i = 1; i <= 55; i++) {
            store.addMessage(message("m" + i));
        }

        List<AgentMessage> messages = store.getState().messages();
        assertEquals(AgentStateStore.MAX_MESSAGES, messages.size());
        assertEquals("m6", messages.get(0).id(), "Five oldest messages evicted");
        assertEquals("m55", messages.get(messages.size() - 1).id(), "Newest message kept last");
        assertEquals(50, store.getState().unreadCount());
    }

    @Test
    void testEvictionIgnoresReadState() {
        store.addMessage(message("first"));
        store.markRead("first");
        for (int i = 0; i < AgentStateStore.MAX_MESSAGES; i++) {
            store.addMessage(message("m" + i));
        }

        assertTrue(store.getState().messages().stream().noneMatch(m -> m.id().equals("first")));
        assertEquals(50, store.getState().unreadCount());
    }

    @Test
    void testSuggestionCapacityEvictsOldest() {
        for (int i = 1; i <= 12; i++) {
            store.addSuggestion(suggestion("s" + i));
        }

        List<Suggestion> suggestions = store.getState().suggestions();
        assertEquals(AgentStateStore.MAX_SUGGESTIONS, suggestions.size());
        assertEquals("s3", suggestions.get(0).id());

        store.removeSuggestion("s3");
        assertEquals(9, store.getState().suggestions().size());

        store.clearSuggestions();
        assertTrue(store.getState().suggestions().isEmpty());
    }

    @Test
    void testClearMessagesResetsUnread() {
        store.addMessage(message("a"));
        store.addMessage(message("b"));

        store.clearMessages();

        assertTrue(store.getState().messages().isEmpty());
        assertEquals(0, store.getState().unreadCount());
    }

    @Test
    void testListenersNotifiedInOrderAndIsolated() {
        List<String> calls = new ArrayList<>();
        store.subscribe(s -> calls.add("first"));
        store.subscribe(s -> {
            throw new IllegalStateException("boom");
        });
        store.subscribe(s -> calls.add("third"));

        store.setPresenceVisible(false);

        assertEquals(List.of("first", "third"), calls, "Failing listener does not stop the others");
        assertFalse(store.getState().presenceVisible(), "State change applied despite listener failure");
        assertEquals(1, store.notifyStateListeners(store.getState()), "One listener failure reported");
    }

    @Test
    void testMessageListenerReceivesOnlyNewMessage() {
        List<AgentMessage> received = new ArrayList<>();
        store.subscribeToMessages(received::add);

        store.addMessage(message("a"));
        store.markRead("a");
        store.addMessage(message("b"));

        assertEquals(2, received.size(), "Only additions reach message listeners");
        assertEquals("b", received.get(1).id());
    }

    @Test
    void testUnsubscribeStopsNotifications() {
        AtomicInteger count = new AtomicInteger();
        Subscription subscription = store.subscribe(s -> count.incrementAndGet());

        store.closePanel();
        subscription.unsubscribe();
        store.closePanel();

        assertEquals(1, count.get());
    }

    @Test
    void testOpenPanelFallsBackToActivePersonaThenMuse() {
        store.openPanel(null);
        assertEquals(Persona.MUSE, store.getState().activePersona());
        assertTrue(store.getState().panelOpen());

        store.setActivePersona(Persona.HERITAGE);
        store.closePanel();
        store.openPanel(null);
        assertEquals(Persona.HERITAGE, store.getState().activePersona());

        store.openPanel(Persona.PACKAGER);
        assertEquals(Persona.PACKAGER, store.getState().activePersona());
    }

    @Test
    void testAnalysisTransitions() {
        store.startAnalysis(Persona.ARCHITECT);
        assertTrue(store.getState().analyzing());
        assertEquals(0, store.getState().analysisProgress());
        assertEquals(Persona.ARCHITECT, store.getState().activePersona());

        store.updateAnalysisProgress(150);
        assertEquals(100, store.getState().analysisProgress(), "Progress clamped to 100");
        store.updateAnalysisProgress(-5);
        assertEquals(0, store.getState().analysisProgress(), "Progress clamped to 0");

        store.completeAnalysis();
        assertFalse(store.getState().analyzing());
        assertEquals(100, store.getState().analysisProgress());
    }

    @Test
    void testAbortAnalysisKeepsProgress() {
        store.startAnalysis(Persona.MUSE);
        store.updateAnalysisProgress(40);

        store.abortAnalysis();

        assertFalse(store.getState().analyzing());
        assertEquals(40, store.getState().analysisProgress());
    }
}
