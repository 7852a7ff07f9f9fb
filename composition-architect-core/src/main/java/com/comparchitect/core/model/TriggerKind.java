package com.comparchitect.core.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * How a {@link BehavioralUnit} is activated.
 */
public enum TriggerKind {
    /** Runs when an event arrives; never has a period */
    EVENT_DRIVEN("event-based"),

    /** Runs on a fixed period in milliseconds */
    PERIODIC("periodic");

    private final String externalName;

    TriggerKind(String externalName) {
        this.externalName = externalName;
    }

    /**
     * Returns the name used in exported documents.
     *
     * @return external name
     */
    public String externalName() {
        return externalName;
    }

    /**
     * Resolves a trigger kind from its external name, ignoring case.
     *
     * <p>"event-driven" is accepted as an alias of "event-based".
     *
     * @param value external name
     * @return matching trigger kind
     * @throws IllegalArgumentException if no trigger kind matches
     */
    public static TriggerKind fromExternalName(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        if ("event-driven".equals(normalized)) {
            return EVENT_DRIVEN;
        }
        return Arrays.stream(values())
            .filter(t -> t.externalName.equals(normalized))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException(
                "Unknown trigger kind: '" + value + "' (expected periodic or event-based)"));
    }
}
