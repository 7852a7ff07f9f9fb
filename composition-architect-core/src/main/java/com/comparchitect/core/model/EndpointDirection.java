package com.comparchitect.core.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * Direction of an {@link Endpoint}.
 *
 * <p>The external name is the value written to and read from exported composition documents.
 */
public enum EndpointDirection {
    /** Sends data; must be matched by an inbound endpoint of the same name */
    OUTBOUND("sender"),

    /** Receives data; must be matched by an outbound endpoint of the same name */
    INBOUND("receiver");

    private final String externalName;

    EndpointDirection(String externalName) {
        this.externalName = externalName;
    }

    /**
     * Returns the name used in exported documents.
     *
     * @return external name ("sender" or "receiver")
     */
    public String externalName() {
        return externalName;
    }

    /**
     * Resolves a direction from its external name or its constant name, ignoring case.
     *
     * @param value external or constant name
     * @return matching direction
     * @throws IllegalArgumentException if no direction matches
     */
    public static EndpointDirection fromExternalName(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(d -> d.externalName.equals(normalized) || d.name().toLowerCase(Locale.ROOT).equals(normalized))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException(
                "Unknown endpoint direction: '" + value + "' (expected sender or receiver)"));
    }
}
