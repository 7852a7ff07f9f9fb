package com.comparchitect.core.composition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Top-level named collection of {@link Component}s under validation.
 *
 * <p>Components are kept in insertion order, which is the order used by validation reports and by
 * the JSON export. Component names are unique (case-sensitive).
 *
 * <p>A composition is not thread-safe. It is built first and then handed to
 * {@link com.comparchitect.core.validation.CompositionValidator} as a whole.
 */
public class Composition {

    private final String name;
    private final List<Component> components = new ArrayList<>();

    public Composition(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    public String getName() {
        return name;
    }

    /**
     * Appends a component.
     *
     * @param component component to add
     * @throws DuplicateNameException if a component of that name already exists
     */
    public void addComponent(Component component) {
        Objects.requireNonNull(component, "component must not be null");
        if (getComponent(component.getName()).isPresent()) {
            throw new DuplicateNameException("SoftwareComponent", component.getName(), "composition '" + name + "'");
        }
        components.add(component);
    }

    /**
     * Returns component names in insertion order.
     *
     * @return component names
     */
    public List<String> componentNames() {
        return components.stream().map(Component::getName).toList();
    }

    public Optional<Component> getComponent(String componentName) {
        return components.stream().filter(c -> c.getName().equals(componentName)).findFirst();
    }

    public boolean hasComponent(String componentName) {
        return getComponent(componentName).isPresent();
    }

    public List<Component> getComponents() {
        return Collections.unmodifiableList(components);
    }

    public int size() {
        return components.size();
    }

    public boolean isEmpty() {
        return components.isEmpty();
    }
}
