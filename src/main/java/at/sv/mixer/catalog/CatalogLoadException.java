package at.sv.mixer.catalog;

/**
 * Exception to signal that a pigment catalog or preset file could not be read or contains invalid entries.
 */
public final class CatalogLoadException extends RuntimeException {

    public CatalogLoadException(String message) {
        super(message);
    }

    public CatalogLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
