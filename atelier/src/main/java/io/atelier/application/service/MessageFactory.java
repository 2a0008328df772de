package io.atelier.application.service;

import io.atelier.domain.agent.Persona;
import io.atelier.domain.agent.PersonaProfile;
import io.atelier.domain.event.DomainEvent;
import io.atelier.domain.message.ActionKind;
import io.atelier.domain.message.AgentAction;
import io.atelier.domain.message.AgentMessage;
import io.atelier.domain.message.MessageKind;
import io.atelier.domain.trigger.Trigger;
import io.atelier.domain.trigger.TriggerType;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Builds the message a fired trigger shows, from a fixed template per trigger type.
 *
 * <p>Titles are format patterns: {@code %1$s} is the persona icon, {@code %2$s} its display
 * name. Types without a template produce no message.
 */
public final class MessageFactory {

    /**
     * Static part of a trigger message.
     */
    public record MessageTemplate(
        MessageKind kind,
        String titlePattern,
        String body,
        List<AgentAction> actions
    ) {
        public MessageTemplate {
            actions = List.copyOf(actions);
        }

        String title(PersonaProfile profile) {
            return String.format(titlePattern, profile.icon(), profile.displayName());
        }
    }

    private final Map<TriggerType, MessageTemplate> templates;

    public MessageFactory() {
        this(defaultTemplates());
    }

    public MessageFactory(Map<TriggerType, MessageTemplate> templates) {
        Map<TriggerType, MessageTemplate> copy = new EnumMap<>(TriggerType.class);
        copy.putAll(templates);
        this.templates = Collections.unmodifiableMap(copy);
    }

    public boolean hasTemplate(TriggerType type) {
        return templates.containsKey(type);
    }

    /**
     * @return the message for this firing, or empty if the trigger type has no template
     */
    public Optional<AgentMessage> create(Trigger trigger, DomainEvent event, PersonaProfile profile, Instant now) {
        MessageTemplate template = templates.get(trigger.type());
        if (template == null) {
            return Optional.empty();
        }
        return Optional.of(new AgentMessage(
            UUID.randomUUID().toString(),
            trigger.persona(),
            template.kind(),
            template.title(profile),
            template.body(),
            now,
            false,
            false,
            template.actions(),
            null
        ));
    }

    public static Map<TriggerType, MessageTemplate> defaultTemplates() {
        Map<TriggerType, MessageTemplate> t = new EnumMap<>(TriggerType.class);

        t.put(TriggerType.EMPTY_CANVAS, new MessageTemplate(
            MessageKind.SUGGESTION,
            "%1$s %2$s noticed something...",
            "Your canvas is looking a bit empty! Want me to suggest some starting points for your next creative project?",
            List.of(
                AgentAction.primary("show", "Show Me Ideas ✨", ActionKind.APPLY),
                AgentAction.secondary("later", "Maybe Later", ActionKind.DISMISS))));

        t.put(TriggerType.LONG_PAUSE, new MessageTemplate(
            MessageKind.SUGGESTION,
            "%1$s Need a creative spark?",
            "I noticed you've been thinking for a while. Would you like me to suggest some variations or new directions?",
            List.of(
                AgentAction.primary("suggest", "Surprise Me", ActionKind.APPLY),
                AgentAction.secondary("not-now", "Not Now", ActionKind.SNOOZE))));

        t.put(TriggerType.POST_GENERATION, new MessageTemplate(
            MessageKind.RECOMMENDATION,
            "%1$s Nice work! Here's what I noticed...",
            "That generation turned out well! I have some ideas for variations that could make it even more striking.",
            List.of(
                AgentAction.primary("show-variations", "Show Variations", ActionKind.APPLY),
                AgentAction.custom("curate", "Help Me Curate", Map.of(AgentAction.SWITCH_TO, Persona.CURATOR.id())),
                AgentAction.secondary("skip", "Skip", ActionKind.DISMISS))));

        t.put(TriggerType.ERROR_OCCURRED, new MessageTemplate(
            MessageKind.SUGGESTION,
            "%1$s I can help with that error",
            "Something went wrong, but don't worry - I've seen this before. Let me analyze what happened and suggest a fix.",
            List.of(
                AgentAction.primary("diagnose", "Diagnose Issue", ActionKind.APPLY),
                AgentAction.custom("retry", "Just Retry", Map.of(AgentAction.ACTION, "retry")))));

        t.put(TriggerType.WORKFLOW_COMPLETE, new MessageTemplate(
            MessageKind.SUGGESTION,
            "%1$s Your workflow is complete!",
            "Great work! This looks ready to share or sell. Want me to help you package it for your favorite marketplace?",
            List.of(
                AgentAction.primary("package", "Package for Sale", ActionKind.APPLY),
                AgentAction.custom("export", "Quick Export", Map.of(AgentAction.ACTION, "export")),
                AgentAction.secondary("later", "Later", ActionKind.DISMISS))));

        t.put(TriggerType.AFRICAN_TEXTILE_USED, new MessageTemplate(
            MessageKind.EDUCATION,
            "%1$s Cultural Context",
            "I see you're using a traditional African textile! Would you like to learn about its cultural significance and how to use it respectfully?",
            List.of(
                AgentAction.primary("learn", "Tell Me More", ActionKind.APPLY),
                AgentAction.secondary("skip", "Skip", ActionKind.DISMISS),
                AgentAction.secondary("never", "Don't show again", ActionKind.NEVER))));

        return t;
    }
}
