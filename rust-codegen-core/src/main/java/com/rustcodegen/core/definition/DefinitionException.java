package com.rustcodegen.core.definition;

/**
 * Exception thrown when a definition document cannot be read or does not describe
 * valid Rust items.
 */
public class DefinitionException extends Exception {

    public DefinitionException(String message) {
        super(message);
    }

    public DefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
