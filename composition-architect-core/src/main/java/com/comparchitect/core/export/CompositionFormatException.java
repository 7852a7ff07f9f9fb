package com.comparchitect.core.export;

import com.comparchitect.core.composition.CompositionException;

/**
 * Raised when a composition document cannot be parsed or is missing required values.
 */
public class CompositionFormatException extends CompositionException {

    public CompositionFormatException(String message) {
        super(message);
    }

    public CompositionFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
