package com.comparchitect.core.model;

import java.util.Objects;

/**
 * A named unit of work executed by a component.
 *
 * <p>Event-driven units never carry a period. Periodic units are expected to carry a positive
 * period in milliseconds; a periodic unit without one can still be constructed and is reported
 * by structural validation rather than rejected here.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * BehavioralUnit sample = BehavioralUnit.periodic("SampleSensor", 10);
 * BehavioralUnit onFrame = BehavioralUnit.eventDriven("OnFrameReceived");
 * }</pre>
 *
 * @param name unit name, unique within its component
 * @param trigger trigger kind
 * @param periodMillis period in milliseconds, or null
 */
public record BehavioralUnit(
    String name,
    TriggerKind trigger,
    Integer periodMillis
) {
    /**
     * Compact constructor with validation.
     */
    public BehavioralUnit {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(trigger, "trigger must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Behavioral unit name must not be blank");
        }
        if (trigger == TriggerKind.EVENT_DRIVEN && periodMillis != null) {
            throw new IllegalArgumentException(
                "Event-driven unit '" + name + "' must not define a period");
        }
        if (periodMillis != null && periodMillis <= 0) {
            throw new IllegalArgumentException(
                "Period of unit '" + name + "' must be positive, got " + periodMillis);
        }
    }

    public static BehavioralUnit eventDriven(String name) {
        return new BehavioralUnit(name, TriggerKind.EVENT_DRIVEN, null);
    }

    public static BehavioralUnit periodic(String name, int periodMillis) {
        return new BehavioralUnit(name, TriggerKind.PERIODIC, periodMillis);
    }

    /**
     * Returns whether this unit is periodic but has no period.
     *
     * @return true if a period is required but absent
     */
    public boolean isMissingPeriod() {
        return trigger == TriggerKind.PERIODIC && periodMillis == null;
    }
}
