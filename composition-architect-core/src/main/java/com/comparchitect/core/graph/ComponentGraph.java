package com.comparchitect.core.graph;

import com.comparchitect.core.composition.Component;
import com.comparchitect.core.composition.Composition;
import com.comparchitect.core.model.Endpoint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Undirected connectivity between the components of a composition.
 *
 * <p>Two distinct components are adjacent when they expose at least one endpoint with the same
 * name. Direction is ignored: two outbound endpoints of the same name also connect their
 * components. Several shared names between the same pair yield a single edge.
 *
 * <p>The graph is a snapshot built once per validation pass from a single sweep over all
 * endpoints, grouped by name. Nodes and neighbor sets are ordered by composition order.
 */
public final class ComponentGraph {

    private final Map<String, Set<String>> adjacency;

    private ComponentGraph(Map<String, Set<String>> adjacency) {
        this.adjacency = adjacency;
    }

    /**
     * Builds the connectivity graph of a composition.
     *
     * @param composition composition to snapshot
     * @return the graph
     */
    public static ComponentGraph of(Composition composition) {
        Objects.requireNonNull(composition, "composition must not be null");

        Map<String, Integer> order = new HashMap<>();
        Map<String, List<String>> componentsByEndpoint = new LinkedHashMap<>();
        for (Component component : composition.getComponents()) {
            order.put(component.getName(), order.size());
            for (Endpoint endpoint : component.getEndpoints()) {
                componentsByEndpoint.computeIfAbsent(endpoint.name(), k -> new ArrayList<>())
                    .add(component.getName());
            }
        }

        Map<String, Set<String>> unordered = new HashMap<>();
        for (List<String> sharing : componentsByEndpoint.values()) {
            for (String a : sharing) {
                for (String b : sharing) {
                    if (!a.equals(b)) {
                        unordered.computeIfAbsent(a, k -> new LinkedHashSet<>()).add(b);
                    }
                }
            }
        }

        Map<String, Set<String>> adjacency = new LinkedHashMap<>();
        for (String name : composition.componentNames()) {
            List<String> neighbors = new ArrayList<>(unordered.getOrDefault(name, Set.of()));
            neighbors.sort((x, y) -> Integer.compare(order.get(x), order.get(y)));
            adjacency.put(name, Collections.unmodifiableSet(new LinkedHashSet<>(neighbors)));
        }
        return new ComponentGraph(Collections.unmodifiableMap(adjacency));
    }

    /**
     * Returns node names in composition order.
     *
     * @return component names
     */
    public Set<String> nodes() {
        return adjacency.keySet();
    }

    /**
     * Returns the neighbors of a component in composition order.
     *
     * @param componentName component name
     * @return neighbor names, empty for unknown or isolated components
     */
    public Set<String> neighbors(String componentName) {
        return adjacency.getOrDefault(componentName, Set.of());
    }

    public boolean areConnected(String a, String b) {
        return neighbors(a).contains(b);
    }

    /**
     * Returns the number of undirected edges.
     *
     * @return edge count
     */
    public int edgeCount() {
        int degreeSum = adjacency.values().stream().mapToInt(Set::size).sum();
        return degreeSum / 2;
    }
}
