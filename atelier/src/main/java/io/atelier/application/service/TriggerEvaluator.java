package io.atelier.application.service;

import io.atelier.application.port.output.PersonaCatalog;
import io.atelier.domain.event.DomainEvent;
import io.atelier.domain.event.EventKind;
import io.atelier.domain.message.AgentMessage;
import io.atelier.domain.state.AgentPreferences;
import io.atelier.domain.trigger.Trigger;
import io.atelier.domain.trigger.TriggerCondition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Evaluates every registered trigger against an incoming event.
 *
 * RULES (per trigger, in registry order):
 * 1. Skip if the owning persona is disabled
 * 2. Skip if the trigger type is muted
 * 3. Skip while cooling down
 * 4. Evaluate the condition; on match record the firing and add the templated message
 *
 * Every eligible trigger fires independently; priority is not consulted. The cooldown is
 * recorded even when no template exists for the trigger type.
 *
 * Callers must hold the state store's monitor.
 */
public final class TriggerEvaluator {
    private static final Logger log = LoggerFactory.getLogger(TriggerEvaluator.class);

    private final TriggerRegistry registry;
    private final MessageFactory messageFactory;
    private final PersonaCatalog catalog;
    private final AgentStateStore stateStore;
    private final Clock clock;

    public TriggerEvaluator(TriggerRegistry registry, MessageFactory messageFactory,
                            PersonaCatalog catalog, AgentStateStore stateStore, Clock clock) {
        this.registry = registry;
        this.messageFactory = messageFactory;
        this.catalog = catalog;
        this.stateStore = stateStore;
        this.clock = clock;
    }

    /**
     * @return messages created for this event, in registry order
     */
    public List<AgentMessage> evaluate(DomainEvent event, AgentPreferences preferences) {
        List<AgentMessage> created = new ArrayList<>();

        for (Trigger trigger : registry.triggers()) {
            if (!preferences.isEnabled(trigger.persona())) {
                continue;
            }
            if (preferences.isMuted(trigger.type())) {
                continue;
            }

            Instant now = clock.instant();
            if (trigger.isCoolingDown(now)) {
                log.debug("Trigger {} cooling down (last fired {})", trigger.id(), trigger.lastFiredAt());
                continue;
            }

            try {
                if (matches(trigger.condition(), event)) {
                    fire(trigger, event, now).ifPresent(created::add);
                }
            } catch (RuntimeException e) {
                log.error("Trigger {} failed on event {}", trigger.id(), event.kind().wireName(), e);
            }
        }

        return created;
    }

    /**
     * State- and content-based conditions need host data this core does not own and never match.
     */
    static boolean matches(TriggerCondition condition, DomainEvent event) {
        switch (condition.type()) {
            case EVENT:
                return event.kind() == condition.event();
            case IDLE_TIME:
                return event.kind() == EventKind.USER_IDLE
                    && event.longPayload(DomainEvent.IDLE_TIME_MS, 0L) >= condition.idleThreshold().toMillis();
            case STATE_BASED:
            case CONTENT_BASED:
            default:
                return false;
        }
    }

    private Optional<AgentMessage> fire(Trigger trigger, DomainEvent event, Instant now) {
        trigger.recordFired(now);

        Optional<AgentMessage> message = messageFactory.create(
            trigger, event, catalog.profile(trigger.persona()), now);

        if (message.isEmpty()) {
            log.warn("Trigger {} fired but no template exists for type {}", trigger.id(), trigger.type().wireName());
            return Optional.empty();
        }

        log.info("Trigger fired: {} -> message {} ({})",
            trigger.id(), message.get().id(), message.get().title());
        stateStore.addMessage(message.get());
        return message;
    }
}
