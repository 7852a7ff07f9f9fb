package com.comparchitect.core.validation;

import com.comparchitect.core.composition.Composition;
import com.comparchitect.core.graph.ComponentGraph;
import com.comparchitect.core.model.Finding;
import com.comparchitect.core.validation.impl.ComponentStructureCheck;
import com.comparchitect.core.validation.impl.EndpointMatchingCheck;
import com.comparchitect.core.validation.impl.TopologyCheck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Runs all validation stages over a composition and aggregates their findings.
 *
 * <p>A validation pass:
 * <ol>
 *   <li>builds one {@link ComponentGraph} snapshot shared by every check</li>
 *   <li>runs per-component structure checks</li>
 *   <li>runs endpoint matching</li>
 *   <li>runs topology (cycle) detection</li>
 *   <li>concatenates the findings, keeping each check's own order</li>
 * </ol>
 *
 * <p>An empty report means the composition is valid.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ValidationReport report = CompositionValidator.defaults().validate(composition);
 * if (!report.isValid()) {
 *     report.messages().forEach(System.out::println);
 * }
 * }</pre>
 */
public class CompositionValidator {

    private static final Logger log = LoggerFactory.getLogger(CompositionValidator.class);

    private final List<CompositionCheck> checks;

    /**
     * Creates a validator running the given checks in order.
     *
     * @param checks checks to run
     */
    public CompositionValidator(List<CompositionCheck> checks) {
        Objects.requireNonNull(checks, "checks must not be null");
        this.checks = List.copyOf(checks);
    }

    /**
     * Creates a validator with the built-in checks: structure, endpoint matching, topology.
     *
     * @return default validator
     */
    public static CompositionValidator defaults() {
        return new CompositionValidator(List.of(
            new ComponentStructureCheck(),
            new EndpointMatchingCheck(),
            new TopologyCheck()
        ));
    }

    /**
     * Returns a validator restricted to the given check IDs, keeping the built-in order.
     *
     * <p>An empty or null collection enables every check. Unknown IDs are logged and ignored.
     *
     * @param enabledIds check IDs to keep
     * @return filtered validator
     */
    public CompositionValidator withEnabledChecks(Collection<String> enabledIds) {
        if (enabledIds == null || enabledIds.isEmpty()) {
            return this;
        }
        List<String> knownIds = checkIds();
        enabledIds.stream()
            .filter(id -> !knownIds.contains(id))
            .forEach(id -> log.warn("Unknown check ID in configuration: {}. Known checks: {}", id, knownIds));

        List<CompositionCheck> selected = checks.stream()
            .filter(check -> enabledIds.contains(check.getId()))
            .toList();
        return new CompositionValidator(selected);
    }

    public List<String> checkIds() {
        return checks.stream().map(CompositionCheck::getId).toList();
    }

    /**
     * Validates a composition in one pass.
     *
     * @param composition composition to validate
     * @return ordered report
     */
    public ValidationReport validate(Composition composition) {
        Objects.requireNonNull(composition, "composition must not be null");
        log.debug("Validating composition '{}' with {} components", composition.getName(), composition.size());

        ComponentGraph graph = ComponentGraph.of(composition);
        log.debug("Component graph: {} nodes, {} edges", graph.nodes().size(), graph.edgeCount());

        List<Finding> findings = new ArrayList<>();
        for (CompositionCheck check : checks) {
            List<Finding> checkFindings = check.check(composition, graph);
            log.debug("  - {}: {} finding(s)", check.getDisplayName(), checkFindings.size());
            findings.addAll(checkFindings);
        }

        ValidationReport report = new ValidationReport(composition.getName(), findings);
        if (report.isValid()) {
            log.info("Composition '{}' is valid", composition.getName());
        } else {
            log.info("Composition '{}' has {} finding(s)", composition.getName(), findings.size());
        }
        return report;
    }
}
