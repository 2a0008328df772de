package io.atelier.domain.trigger;

import io.atelier.domain.agent.Persona;
import io.atelier.domain.event.EventKind;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TriggerTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private static Trigger trigger(Duration cooldown) {
        return new Trigger("t", TriggerType.POST_GENERATION, Persona.MUSE,
            TriggerCondition.onEvent(EventKind.GENERATION_COMPLETED), cooldown, TriggerPriority.MEDIUM);
    }

    @Test
    void testCooldownWindow() {
        Trigger trigger = trigger(Duration.ofSeconds(30));
        assertFalse(trigger.isCoolingDown(T0), "Never fired");

        trigger.recordFired(T0);

        assertTrue(trigger.isCoolingDown(T0.plusSeconds(29)));
        assertFalse(trigger.isCoolingDown(T0.plusSeconds(30)), "Window is half-open");
    }

    @Test
    void testLastFiredNeverMovesBackwards() {
        Trigger trigger = trigger(Duration.ofSeconds(30));

        trigger.recordFired(T0.plusSeconds(10));
        trigger.recordFired(T0);

        assertEquals(T0.plusSeconds(10), trigger.lastFiredAt());
    }

    @Test
    void testConditionValidation() {
        assertThrows(IllegalArgumentException.class,
            () -> new TriggerCondition(ConditionType.EVENT, null, null, null));
        assertThrows(IllegalArgumentException.class,
            () -> new TriggerCondition(ConditionType.IDLE_TIME, null, null, null));
        assertEquals(TriggerType.AFRICAN_TEXTILE_USED, TriggerType.fromWireName("african_textile_used"));
    }
}
