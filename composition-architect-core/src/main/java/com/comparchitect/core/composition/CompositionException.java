package com.comparchitect.core.composition;

/**
 * Base class for construction errors raised while building a composition.
 *
 * <p>Construction errors are fatal to the single registration call that raised them; the
 * composition is left exactly as it was before the call.
 */
public class CompositionException extends RuntimeException {

    public CompositionException(String message) {
        super(message);
    }

    public CompositionException(String message, Throwable cause) {
        super(message, cause);
    }
}
