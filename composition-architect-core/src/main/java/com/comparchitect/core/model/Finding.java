package com.comparchitect.core.model;

import java.util.Objects;

/**
 * One issue reported by composition validation.
 *
 * <p>Findings are data, never exceptions: a validation pass collects every finding and returns them
 * in a stable order.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * Finding finding = Finding.error(
 *     FindingCategory.ENDPOINT_MATCHING,
 *     "Controller",
 *     "SpeedOut",
 *     "Sender port 'SpeedOut' in component 'Controller' has no matching receiver."
 * );
 * }</pre>
 *
 * @param severity severity level
 * @param category validation stage that produced the finding
 * @param component name of the component concerned
 * @param subject name of the endpoint or unit concerned, or null when the component itself is meant
 * @param message human-readable description
 */
public record Finding(
    Severity severity,
    FindingCategory category,
    String component,
    String subject,
    String message
) {
    /**
     * Compact constructor with validation.
     */
    public Finding {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(component, "component must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    /**
     * Create an error finding.
     *
     * @param category validation stage
     * @param component component name
     * @param subject endpoint or unit name, may be null
     * @param message description
     * @return a new Finding with ERROR severity
     */
    public static Finding error(FindingCategory category, String component, String subject, String message) {
        return new Finding(Severity.ERROR, category, component, subject, message);
    }
}
