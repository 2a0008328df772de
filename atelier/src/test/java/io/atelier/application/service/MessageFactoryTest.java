package io.atelier.application.service;

import io.atelier.domain.agent.Persona;
import io.atelier.domain.event.DomainEvent;
import io.atelier.domain.event.EventKind;
import io.atelier.domain.message.ActionKind;
import io.atelier.domain.message.AgentAction;
import io.atelier.domain.message.AgentMessage;
import io.atelier.domain.message.MessageKind;
import io.atelier.domain.trigger.Trigger;
import io.atelier.domain.trigger.TriggerCondition;
import io.atelier.domain.trigger.TriggerPriority;
import io.atelier.domain.trigger.TriggerType;
import io.atelier.infrastructure.catalog.StaticPersonaCatalog;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MessageFactory.
 *
 * Tests:
 * - Title rendering with persona icon and name
 * - Template coverage of the built-in trigger types
 * - Fresh ids and unread state
 */
class MessageFactoryTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private final MessageFactory factory = new MessageFactory();
    private final StaticPersonaCatalog catalog = new StaticPersonaCatalog();

    private static Trigger trigger(TriggerType type, Persona persona) {
        return new Trigger("t-" + type.wireName(), type, persona,
            TriggerCondition.onEvent(EventKind.CARD_CREATED), Duration.ZERO, TriggerPriority.LOW);
    }

    private AgentMessage create(TriggerType type, Persona persona) {
        return factory.create(trigger(type, persona), DomainEvent.of(EventKind.CARD_CREATED, NOW),
            catalog.profile(persona), NOW).orElseThrow();
    }

    @Test
    void testTemplatedTypes() {
        for (TriggerType type : new TriggerType[] {
            TriggerType.EMPTY_CANVAS, TriggerType.LONG_PAUSE, TriggerType.POST_GENERATION,
            TriggerType.ERROR_OCCURRED, TriggerType.WORKFLOW_COMPLETE, TriggerType.AFRICAN_TEXTILE_USED}) {
            assertTrue(factory.hasTemplate(type), type + " has a template");
        }
        assertFalse(factory.hasTemplate(TriggerType.STYLE_DRIFT));
    }

    @Test
    void testTitleUsesIconAndName() {
        AgentMessage message = create(TriggerType.EMPTY_CANVAS, Persona.MUSE);

        assertEquals("🪄 The Muse noticed something...", message.title());
        assertEquals(MessageKind.SUGGESTION, message.kind());
        assertTrue(message.isUnread());
        assertEquals(NOW, message.timestamp());
        assertNull(message.context());
    }

    @Test
    void testEachMessageGetsFreshId() {
        AgentMessage first = create(TriggerType.WORKFLOW_COMPLETE, Persona.PACKAGER);
        AgentMessage second = create(TriggerType.WORKFLOW_COMPLETE, Persona.PACKAGER);

        assertNotEquals(first.id(), second.id());
        assertEquals("📦 Your workflow is complete!", first.title());
    }

    @Test
    void testHeritageTemplateOffersNeverAction() {
        AgentMessage message = create(TriggerType.AFRICAN_TEXTILE_USED, Persona.HERITAGE);

        assertEquals(MessageKind.EDUCATION, message.kind());
        assertEquals("🌍 Cultural Context", message.title());
        assertTrue(message.actions().stream().anyMatch(a -> a.kind() == ActionKind.NEVER));
        assertTrue(message.actions().get(0).primary());
    }

    @Test
    void testUntemplatedTypeYieldsNothing() {
        Optional<AgentMessage> message = factory.create(trigger(TriggerType.BEST_PICK, Persona.CURATOR),
            DomainEvent.of(EventKind.CARD_CREATED, NOW), catalog.profile(Persona.CURATOR), NOW);

        assertTrue(message.isEmpty());
    }

    @Test
    void testCustomTemplates() {
        MessageFactory custom = new MessageFactory(Map.of(TriggerType.BEST_PICK, new MessageFactory.MessageTemplate(
            MessageKind.CELEBRATION, "%1$s %2$s picked a winner", "This one shines.",
            List.of(AgentAction.primary("feature", "Feature it", ActionKind.APPLY)))));

        AgentMessage message = custom.create(trigger(TriggerType.BEST_PICK, Persona.CURATOR),
            DomainEvent.of(EventKind.QUALITY_ASSESSED, NOW), catalog.profile(Persona.CURATOR), NOW).orElseThrow();

        assertEquals("🎯 The Curator picked a winner", message.title());
        assertFalse(custom.hasTemplate(TriggerType.EMPTY_CANVAS));
    }
}
