package org.civicroute.engine.exception;

/**
 * Thrown when the unit store cannot be read during a registry refresh.
 * The registry recovers from it by keeping its previous snapshot.
 */
public class RegistryLoadException extends RoutingException {

    public RegistryLoadException(String message) {
        super(message);
    }

    public RegistryLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
