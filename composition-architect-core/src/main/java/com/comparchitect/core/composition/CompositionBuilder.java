package com.comparchitect.core.composition;

import com.comparchitect.core.model.BehavioralUnit;
import com.comparchitect.core.model.ContractKind;
import com.comparchitect.core.model.DataField;
import com.comparchitect.core.model.EndpointDirection;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Fluent builder that assembles a {@link Composition} through the registration methods of
 * {@link Composition} and {@link Component}.
 *
 * <p>Construction errors surface immediately from the call that caused them.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * Composition composition = CompositionBuilder.named("Powertrain")
 *     .component("Sensor", "Sensor")
 *         .outbound("Speed")
 *         .periodic("Sample", 10)
 *     .component("Controller", "Controller")
 *         .inbound("Speed")
 *         .eventDriven("OnSpeed")
 *     .build();
 * }</pre>
 */
public final class CompositionBuilder {

    private final Composition composition;
    private Component current;

    private CompositionBuilder(String name) {
        this.composition = new Composition(name);
    }

    public static CompositionBuilder named(String name) {
        return new CompositionBuilder(name);
    }

    /**
     * Adds a component and makes it the target of the following calls.
     *
     * @param name component name
     * @param type component type label
     * @return this builder
     * @throws DuplicateNameException if the component name is taken
     */
    public CompositionBuilder component(String name, String type) {
        Component component = new Component(name, type);
        composition.addComponent(component);
        current = component;
        return this;
    }

    public CompositionBuilder outbound(String endpointName) {
        requireCurrent().addEndpoint(endpointName, EndpointDirection.OUTBOUND);
        return this;
    }

    public CompositionBuilder inbound(String endpointName) {
        requireCurrent().addEndpoint(endpointName, EndpointDirection.INBOUND);
        return this;
    }

    public CompositionBuilder eventDriven(String unitName) {
        requireCurrent().addBehavioralUnit(BehavioralUnit.eventDriven(unitName));
        return this;
    }

    public CompositionBuilder periodic(String unitName, int periodMillis) {
        requireCurrent().addBehavioralUnit(BehavioralUnit.periodic(unitName, periodMillis));
        return this;
    }

    public CompositionBuilder behavioralUnit(BehavioralUnit unit) {
        requireCurrent().addBehavioralUnit(unit);
        return this;
    }

    /**
     * Adds a contract over endpoints of the current component.
     *
     * @param name contract name
     * @param kind contract kind
     * @param endpointNames endpoints to associate
     * @param dataFields data fields
     * @return this builder
     * @throws UnknownEndpointException if an endpoint name is not on the current component
     */
    public CompositionBuilder contract(String name, ContractKind kind, List<String> endpointNames, DataField... dataFields) {
        requireCurrent().addContract(name, kind, endpointNames, new ArrayList<>(Arrays.asList(dataFields)));
        return this;
    }

    public Composition build() {
        return composition;
    }

    private Component requireCurrent() {
        return Objects.requireNonNull(current, "component(...) must be called before adding members");
    }
}
