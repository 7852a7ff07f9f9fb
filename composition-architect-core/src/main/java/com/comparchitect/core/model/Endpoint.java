package com.comparchitect.core.model;

import java.util.Objects;

/**
 * A named, directional communication point owned by exactly one component.
 *
 * <p>The name is unique within the owning component and is the matching key across components:
 * two components exposing endpoints of the same name are connected.
 *
 * @param name endpoint name
 * @param direction outbound (sender) or inbound (receiver)
 */
public record Endpoint(
    String name,
    EndpointDirection direction
) {
    /**
     * Compact constructor with validation.
     */
    public Endpoint {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(direction, "direction must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Endpoint name must not be blank");
        }
    }

    public static Endpoint outbound(String name) {
        return new Endpoint(name, EndpointDirection.OUTBOUND);
    }

    public static Endpoint inbound(String name) {
        return new Endpoint(name, EndpointDirection.INBOUND);
    }

    public boolean isOutbound() {
        return direction == EndpointDirection.OUTBOUND;
    }
}
