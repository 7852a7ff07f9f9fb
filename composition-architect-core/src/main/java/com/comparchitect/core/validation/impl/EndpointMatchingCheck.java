package com.comparchitect.core.validation.impl;

import com.comparchitect.core.composition.Component;
import com.comparchitect.core.composition.Composition;
import com.comparchitect.core.graph.ComponentGraph;
import com.comparchitect.core.model.Endpoint;
import com.comparchitect.core.model.EndpointDirection;
import com.comparchitect.core.model.Finding;
import com.comparchitect.core.model.FindingCategory;
import com.comparchitect.core.validation.CompositionCheck;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reports outbound endpoints without an inbound endpoint of the same name, and vice versa.
 *
 * <p>Matching is by name only. A counterpart on the same component counts. Every offending
 * endpoint instance is reported, so a name that recurs on several components yields one finding
 * per component. All outbound findings come first, then all inbound findings, each in
 * composition and registration order.
 */
public class EndpointMatchingCheck implements CompositionCheck {

    @Override
    public String getId() {
        return "endpoint-matching";
    }

    @Override
    public String getDisplayName() {
        return "Endpoint Matching Check";
    }

    @Override
    public List<Finding> check(Composition composition, ComponentGraph graph) {
        Set<String> outboundNames = new HashSet<>();
        Set<String> inboundNames = new HashSet<>();
        for (Component component : composition.getComponents()) {
            for (Endpoint endpoint : component.getEndpoints()) {
                (endpoint.isOutbound() ? outboundNames : inboundNames).add(endpoint.name());
            }
        }

        List<Finding> findings = new ArrayList<>();
        collectUnmatched(composition, EndpointDirection.OUTBOUND, inboundNames, findings);
        collectUnmatched(composition, EndpointDirection.INBOUND, outboundNames, findings);
        return findings;
    }

    private void collectUnmatched(Composition composition, EndpointDirection direction,
                                  Set<String> counterpartNames, List<Finding> findings) {
        for (Component component : composition.getComponents()) {
            for (Endpoint endpoint : component.getEndpoints()) {
                if (endpoint.direction() == direction && !counterpartNames.contains(endpoint.name())) {
                    findings.add(Finding.error(FindingCategory.ENDPOINT_MATCHING, component.getName(),
                        endpoint.name(), message(endpoint, component)));
                }
            }
        }
    }

    private static String message(Endpoint endpoint, Component component) {
        if (endpoint.isOutbound()) {
            return "Sender port '" + endpoint.name() + "' in component '" + component.getName()
                + "' has no matching receiver.";
        }
        return "Receiver port '" + endpoint.name() + "' in component '" + component.getName()
            + "' has no matching sender.";
    }
}
