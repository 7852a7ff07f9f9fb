package com.comparchitect.core.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * Communication pattern described by a {@link Contract}.
 */
public enum ContractKind {
    /** Request/response between a client and a server */
    CLIENT_SERVER("clientServer"),

    /** One-way data distribution from publishers to subscribers */
    PUBLISH_SUBSCRIBE("senderReceiver");

    private final String externalName;

    ContractKind(String externalName) {
        this.externalName = externalName;
    }

    /**
     * Returns the name used in exported documents.
     *
     * @return external name
     */
    public String externalName() {
        return externalName;
    }

    /**
     * Resolves a contract kind from its external name, ignoring case.
     *
     * @param value external name
     * @return matching contract kind
     * @throws IllegalArgumentException if no contract kind matches
     */
    public static ContractKind fromExternalName(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(k -> k.externalName.toLowerCase(Locale.ROOT).equals(normalized))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException(
                "Unknown contract kind: '" + value + "' (expected clientServer or senderReceiver)"));
    }
}
