package com.comparchitect.core.composition;

/**
 * Raised when an entity is registered under a name that is already taken in its scope.
 */
public class DuplicateNameException extends CompositionException {

    private final String entityKind;
    private final String name;

    /**
     * Creates the exception.
     *
     * @param entityKind kind of entity, e.g. "SoftwareComponent", "Port", "Runnable"
     * @param name the duplicated name
     * @param scope where the name is already taken, e.g. "component 'Sensor'"
     */
    public DuplicateNameException(String entityKind, String name, String scope) {
        super(entityKind + " with the name '" + name + "' already exists in " + scope + ".");
        this.entityKind = entityKind;
        this.name = name;
    }

    public String getEntityKind() {
        return entityKind;
    }

    public String getName() {
        return name;
    }
}
