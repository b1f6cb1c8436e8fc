package com.refraction.core.module;

/**
 * Raised when a module catalogue cannot be read or contains invalid data.
 */
public final class CatalogueLoadException extends RuntimeException {

    public CatalogueLoadException(String message) {
        super(message);
    }

    public CatalogueLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
