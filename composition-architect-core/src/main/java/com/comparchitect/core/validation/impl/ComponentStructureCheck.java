package com.comparchitect.core.validation.impl;

import com.comparchitect.core.composition.Component;
import com.comparchitect.core.composition.Composition;
import com.comparchitect.core.graph.ComponentGraph;
import com.comparchitect.core.model.BehavioralUnit;
import com.comparchitect.core.model.Contract;
import com.comparchitect.core.model.Finding;
import com.comparchitect.core.model.FindingCategory;
import com.comparchitect.core.validation.CompositionCheck;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Per-component structural checks.
 *
 * <p>For each component, in composition order:
 * <ul>
 *   <li>the component has no endpoints</li>
 *   <li>duplicate behavioral unit or contract names (only reachable when the component was populated
 *       around the registration methods)</li>
 *   <li>each periodic behavioral unit without a period</li>
 * </ul>
 */
public class ComponentStructureCheck implements CompositionCheck {

    @Override
    public String getId() {
        return "component-structure";
    }

    @Override
    public String getDisplayName() {
        return "Component Structure Check";
    }

    @Override
    public List<Finding> check(Composition composition, ComponentGraph graph) {
        List<Finding> findings = new ArrayList<>();
        for (Component component : composition.getComponents()) {
            checkComponent(component, findings);
        }
        return findings;
    }

    private void checkComponent(Component component, List<Finding> findings) {
        String name = component.getName();

        if (component.getEndpoints().isEmpty()) {
            findings.add(Finding.error(FindingCategory.STRUCTURE, name, null,
                "Component '" + name + "' has no ports defined."));
        }

        List<String> unitNames = component.getBehavioralUnits().stream().map(BehavioralUnit::name).toList();
        for (String duplicate : duplicates(unitNames)) {
            findings.add(Finding.error(FindingCategory.STRUCTURE, name, duplicate,
                "Duplicate runnable name '" + duplicate + "' found in component '" + name + "'."));
        }

        List<String> contractNames = component.getContracts().stream().map(Contract::name).toList();
        for (String duplicate : duplicates(contractNames)) {
            findings.add(Finding.error(FindingCategory.STRUCTURE, name, duplicate,
                "Duplicate interface name '" + duplicate + "' found in component '" + name + "'."));
        }

        for (BehavioralUnit unit : component.getBehavioralUnits()) {
            if (unit.isMissingPeriod()) {
                findings.add(Finding.error(FindingCategory.STRUCTURE, name, unit.name(),
                    "Runnable '" + unit.name() + "' in component '" + name + "' is periodic but has no period defined."));
            }
        }
    }

    private static Set<String> duplicates(List<String> names) {
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (String n : names) {
            if (!seen.add(n)) {
                duplicates.add(n);
            }
        }
        return duplicates;
    }
}
