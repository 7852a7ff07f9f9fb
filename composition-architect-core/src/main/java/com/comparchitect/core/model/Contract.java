package com.comparchitect.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A named communication agreement grouping endpoints of one component with the data they carry.
 *
 * <p>Contracts are created through
 * {@link com.comparchitect.core.composition.Component#addContract(String, ContractKind, List, List)},
 * which resolves endpoint names against the owning component.
 *
 * @param name contract name
 * @param kind client-server or publish-subscribe
 * @param endpoints associated endpoints, in association order
 * @param dataFields data fields, in declaration order
 */
public record Contract(
    String name,
    ContractKind kind,
    List<Endpoint> endpoints,
    List<DataField> dataFields
) {
    /**
     * Compact constructor with validation.
     */
    public Contract {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        endpoints = endpoints == null ? List.of() : List.copyOf(endpoints);
        dataFields = dataFields == null ? List.of() : List.copyOf(dataFields);
    }

    /**
     * Returns the names of the associated endpoints, in association order.
     *
     * @return endpoint names
     */
    public List<String> endpointNames() {
        return endpoints.stream().map(Endpoint::name).toList();
    }
}
