package io.atelier.application.service;

import io.atelier.domain.agent.Persona;
import io.atelier.domain.event.EventKind;
import io.atelier.domain.trigger.Trigger;
import io.atelier.domain.trigger.TriggerCondition;
import io.atelier.domain.trigger.TriggerPriority;
import io.atelier.domain.trigger.TriggerType;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Ordered catalog of proactive triggers. Registry order is the evaluation order.
 *
 * <p>Each orchestrator gets its own instances (see {@link #defaults()}), so cooldown
 * timestamps are never shared between orchestrators.
 */
public final class TriggerRegistry {
    private final List<Trigger> triggers;

    public TriggerRegistry(List<Trigger> triggers) {
        this.triggers = List.copyOf(triggers);
    }

    public List<Trigger> triggers() {
        return triggers;
    }

    public int size() {
        return triggers.size();
    }

    /**
     * The built-in trigger set, freshly instantiated.
     */
    public static TriggerRegistry defaults() {
        return new TriggerRegistry(List.of(
            // Muse
            new Trigger("muse-empty-canvas", TriggerType.EMPTY_CANVAS, Persona.MUSE,
                TriggerCondition.stateBased(Map.of("cardCount", 0, "idleTimeMs", 5000)),
                Duration.ofMinutes(5), TriggerPriority.MEDIUM),
            new Trigger("muse-long-pause", TriggerType.LONG_PAUSE, Persona.MUSE,
                TriggerCondition.idleFor(Duration.ofSeconds(60)),
                Duration.ofMinutes(3), TriggerPriority.LOW),
            new Trigger("muse-post-generation", TriggerType.POST_GENERATION, Persona.MUSE,
                TriggerCondition.onEvent(EventKind.GENERATION_COMPLETED),
                Duration.ofSeconds(30), TriggerPriority.MEDIUM),

            // Curator
            new Trigger("curator-style-drift", TriggerType.STYLE_DRIFT, Persona.CURATOR,
                TriggerCondition.contentBased(Map.of("styleVariance", 0.3)),
                Duration.ofMinutes(2), TriggerPriority.MEDIUM),
            new Trigger("curator-collection-ready", TriggerType.COLLECTION_READY, Persona.CURATOR,
                TriggerCondition.stateBased(Map.of("completedCards", 5)),
                Duration.ofMinutes(10), TriggerPriority.HIGH),

            // Architect
            new Trigger("architect-inefficient", TriggerType.INEFFICIENT_FLOW, Persona.ARCHITECT,
                TriggerCondition.stateBased(Map.of("redundantNodes", 2)),
                Duration.ofMinutes(5), TriggerPriority.MEDIUM),
            new Trigger("architect-error", TriggerType.ERROR_OCCURRED, Persona.ARCHITECT,
                TriggerCondition.onEvent(EventKind.GENERATION_FAILED),
                Duration.ZERO, TriggerPriority.HIGH),      // errors always surface

            // Packager
            new Trigger("packager-workflow-complete", TriggerType.WORKFLOW_COMPLETE, Persona.PACKAGER,
                TriggerCondition.onEvent(EventKind.WORKFLOW_COMPLETED),
                Duration.ofMinutes(1), TriggerPriority.MEDIUM),
            new Trigger("packager-bundle-opportunity", TriggerType.BUNDLE_OPPORTUNITY, Persona.PACKAGER,
                TriggerCondition.stateBased(Map.of("completedCards", 3)),
                Duration.ofMinutes(10), TriggerPriority.LOW),

            // Heritage
            new Trigger("heritage-textile", TriggerType.AFRICAN_TEXTILE_USED, Persona.HERITAGE,
                TriggerCondition.onEvent(EventKind.TEXTILE_DROPPED),
                Duration.ZERO, TriggerPriority.HIGH),      // always show for textiles
            new Trigger("heritage-cultural", TriggerType.CULTURAL_ELEMENT, Persona.HERITAGE,
                TriggerCondition.contentBased(Map.of("hasCulturalElement", true)),
                Duration.ofMinutes(2), TriggerPriority.MEDIUM)
        ));
    }
}
