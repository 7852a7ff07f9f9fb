package com.comparchitect.core.composition;

import com.comparchitect.core.model.BehavioralUnit;
import com.comparchitect.core.model.Contract;
import com.comparchitect.core.model.ContractKind;
import com.comparchitect.core.model.DataField;
import com.comparchitect.core.model.Endpoint;
import com.comparchitect.core.model.EndpointDirection;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A named unit of a composition exposing endpoints, behavioral units and contracts.
 *
 * <p>A component owns its entities exclusively; they can only be added through the registration
 * methods below, which enforce name uniqueness within the component. Endpoints are kept in a single
 * insertion-ordered map that is both the storage and the uniqueness index.
 *
 * <p>A component does not know about other components. Connectivity is derived from shared
 * endpoint names by {@link com.comparchitect.core.graph.ComponentGraph}.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * Component sensor = new Component("WheelSensor", "Sensor");
 * sensor.addEndpoint("WheelSpeed", EndpointDirection.OUTBOUND);
 * sensor.addBehavioralUnit(BehavioralUnit.periodic("Sample", 10));
 * sensor.addContract("SpeedInterface", ContractKind.PUBLISH_SUBSCRIBE,
 *     List.of("WheelSpeed"), List.of(new DataField("speed", "float")));
 * }</pre>
 */
public class Component {

    private final String name;
    private final String type;
    private final Map<String, Endpoint> endpoints = new LinkedHashMap<>();
    private final List<BehavioralUnit> behavioralUnits = new ArrayList<>();
    private final List<Contract> contracts = new ArrayList<>();

    /**
     * Creates an empty component.
     *
     * @param name component name, unique within its composition
     * @param type free-form classification (e.g. "Sensor", "Controller"), may be empty
     */
    public Component(String name, String type) {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Component name must not be blank");
        }
        this.name = name;
        this.type = type == null ? "" : type;
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    /**
     * Registers an endpoint.
     *
     * @param endpoint endpoint to add
     * @return the registered endpoint
     * @throws DuplicateNameException if an endpoint of that name already exists on this component
     */
    public Endpoint addEndpoint(Endpoint endpoint) {
        Objects.requireNonNull(endpoint, "endpoint must not be null");
        if (endpoints.containsKey(endpoint.name())) {
            throw new DuplicateNameException("Port", endpoint.name(), scope());
        }
        endpoints.put(endpoint.name(), endpoint);
        return endpoint;
    }

    /**
     * Creates and registers an endpoint.
     *
     * @param endpointName endpoint name
     * @param direction endpoint direction
     * @return the registered endpoint
     * @throws DuplicateNameException if an endpoint of that name already exists on this component
     */
    public Endpoint addEndpoint(String endpointName, EndpointDirection direction) {
        return addEndpoint(new Endpoint(endpointName, direction));
    }

    /**
     * Registers a behavioral unit.
     *
     * @param unit unit to add
     * @throws DuplicateNameException if a unit of that name already exists on this component
     */
    public void addBehavioralUnit(BehavioralUnit unit) {
        Objects.requireNonNull(unit, "unit must not be null");
        boolean exists = behavioralUnits.stream().anyMatch(u -> u.name().equals(unit.name()));
        if (exists) {
            throw new DuplicateNameException("Runnable", unit.name(), scope());
        }
        behavioralUnits.add(unit);
    }

    /**
     * Creates a contract over endpoints of this component and registers it.
     *
     * <p>Every endpoint name must already be registered on this component. Nothing is registered
     * when any name is unknown.
     *
     * @param contractName contract name, unique within this component
     * @param kind contract kind
     * @param endpointNames names of endpoints to associate, in order
     * @param dataFields data fields carried by the contract
     * @return the registered contract
     * @throws UnknownEndpointException if an endpoint name is not registered on this component
     * @throws DuplicateNameException if a contract of that name already exists on this component
     */
    public Contract addContract(String contractName, ContractKind kind,
                                List<String> endpointNames, List<DataField> dataFields) {
        Objects.requireNonNull(contractName, "contractName must not be null");
        if (findContract(contractName).isPresent()) {
            throw new DuplicateNameException("Interface", contractName, scope());
        }

        List<Endpoint> associated = new ArrayList<>();
        for (String endpointName : endpointNames == null ? List.<String>of() : endpointNames) {
            Endpoint endpoint = endpoints.get(endpointName);
            if (endpoint == null) {
                throw new UnknownEndpointException(name, endpointName);
            }
            associated.add(endpoint);
        }

        Contract contract = new Contract(contractName, kind, associated, dataFields);
        contracts.add(contract);
        return contract;
    }

    public Optional<Endpoint> findEndpoint(String endpointName) {
        return Optional.ofNullable(endpoints.get(endpointName));
    }

    public boolean hasEndpoint(String endpointName) {
        return endpoints.containsKey(endpointName);
    }

    public Optional<Contract> findContract(String contractName) {
        return contracts.stream().filter(c -> c.name().equals(contractName)).findFirst();
    }

    /**
     * Returns the endpoints in registration order.
     *
     * @return unmodifiable view of the endpoints
     */
    public Collection<Endpoint> getEndpoints() {
        return Collections.unmodifiableCollection(endpoints.values());
    }

    public List<BehavioralUnit> getBehavioralUnits() {
        return Collections.unmodifiableList(behavioralUnits);
    }

    public List<Contract> getContracts() {
        return Collections.unmodifiableList(contracts);
    }

    private String scope() {
        return "component '" + name + "'";
    }

    @Override
    public String toString() {
        return "Component{name='" + name + "', type='" + type + "', endpoints=" + endpoints.size()
            + ", behavioralUnits=" + behavioralUnits.size() + ", contracts=" + contracts.size() + "}";
    }
}
