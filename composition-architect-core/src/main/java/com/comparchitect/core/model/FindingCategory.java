package com.comparchitect.core.model;

/**
 * Which validation stage produced a {@link Finding}.
 */
public enum FindingCategory {
    /** Per-component structure (missing endpoints, periodic units without a period, duplicates) */
    STRUCTURE,

    /** Outbound or inbound endpoint without a counterpart of the same name */
    ENDPOINT_MATCHING,

    /** Cyclic dependency through shared endpoint names */
    TOPOLOGY
}
