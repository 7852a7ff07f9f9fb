package com.comparchitect.core.validation;

import com.comparchitect.core.model.Finding;
import com.comparchitect.core.model.FindingCategory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered result of one validation pass.
 *
 * @param compositionName name of the validated composition
 * @param findings findings in report order: structure, endpoint matching, topology
 */
public record ValidationReport(
    String compositionName,
    List<Finding> findings
) {
    /**
     * Compact constructor with validation.
     */
    public ValidationReport {
        Objects.requireNonNull(compositionName, "compositionName must not be null");
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    /**
     * Returns whether the composition passed validation.
     *
     * @return true if there are no findings
     */
    public boolean isValid() {
        return findings.isEmpty();
    }

    /**
     * Returns the finding messages in report order.
     *
     * @return messages
     */
    public List<String> messages() {
        return findings.stream().map(Finding::message).toList();
    }

    public List<Finding> findingsOf(FindingCategory category) {
        return findings.stream().filter(f -> f.category() == category).toList();
    }

    /**
     * Counts findings per category; categories without findings map to zero.
     *
     * @return counts by category
     */
    public Map<FindingCategory, Integer> countByCategory() {
        Map<FindingCategory, Integer> counts = new EnumMap<>(FindingCategory.class);
        for (FindingCategory category : FindingCategory.values()) {
            counts.put(category, 0);
        }
        findings.forEach(f -> counts.merge(f.category(), 1, Integer::sum));
        return counts;
    }
}
