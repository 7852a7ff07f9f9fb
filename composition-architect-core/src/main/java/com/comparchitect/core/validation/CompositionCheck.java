package com.comparchitect.core.validation;

import com.comparchitect.core.composition.Composition;
import com.comparchitect.core.graph.ComponentGraph;
import com.comparchitect.core.model.Finding;

import java.util.List;

/**
 * A single validation stage run by {@link CompositionValidator}.
 *
 * <p>Checks report problems as {@link Finding}s and never throw for an invalid composition; a
 * composition may have many issues at once and all of them are reported. The order of the returned
 * list is part of the contract and must be deterministic for a given composition.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class NoIsolatedComponentsCheck implements CompositionCheck {
 *     @Override
 *     public String getId() {
 *         return "isolated-components";
 *     }
 *
 *     @Override
 *     public String getDisplayName() {
 *         return "Isolated Component Check";
 *     }
 *
 *     @Override
 *     public List<Finding> check(Composition composition, ComponentGraph graph) {
 *         return graph.nodes().stream()
 *             .filter(name -> graph.neighbors(name).isEmpty())
 *             .map(name -> Finding.error(FindingCategory.TOPOLOGY, name, null, "isolated: " + name))
 *             .toList();
 *     }
 * }
 * }</pre>
 */
public interface CompositionCheck {

    /**
     * Returns unique identifier for this check.
     *
     * <p>Used to enable or disable the check in configuration. Kebab-case, e.g. "endpoint-matching".
     *
     * @return unique check identifier
     */
    String getId();

    /**
     * Returns human-readable name used in logs.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Validates the composition.
     *
     * @param composition composition under validation
     * @param graph connectivity snapshot of the same composition, built once for the whole pass
     * @return findings in a stable order, empty if this check found nothing
     */
    List<Finding> check(Composition composition, ComponentGraph graph);
}
