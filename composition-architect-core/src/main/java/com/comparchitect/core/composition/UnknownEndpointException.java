package com.comparchitect.core.composition;

/**
 * Raised when a contract is associated with an endpoint name the component does not own.
 */
public class UnknownEndpointException extends CompositionException {

    private final String componentName;
    private final String endpointName;

    public UnknownEndpointException(String componentName, String endpointName) {
        super("No port named '" + endpointName + "' found for component '" + componentName + "'.");
        this.componentName = componentName;
        this.endpointName = endpointName;
    }

    public String getComponentName() {
        return componentName;
    }

    public String getEndpointName() {
        return endpointName;
    }
}
