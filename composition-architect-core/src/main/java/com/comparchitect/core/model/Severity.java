package com.comparchitect.core.model;

/**
 * Severity of a validation {@link Finding}.
 *
 * <p>Every finding produced by the built-in checks makes the composition invalid.
 */
public enum Severity {
    /** The composition is structurally incorrect */
    ERROR
}
