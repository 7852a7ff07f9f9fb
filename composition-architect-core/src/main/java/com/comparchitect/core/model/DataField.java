package com.comparchitect.core.model;

import java.util.Objects;

/**
 * A data element carried by a {@link Contract}.
 *
 * <p>The type tag is free-form; no type system is enforced.
 *
 * @param name field name
 * @param type type tag (e.g. "int", "float", "string")
 */
public record DataField(
    String name,
    String type
) {
    public DataField {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }
}
