package at.sv.mixer.optimizer;

/**
 * Exception to signal that no pigment is left to mix from, after applying the category, code and manufacturer filters.
 */
public final class EmptyCatalogException extends RuntimeException {

    public EmptyCatalogException(String message) {
        super(message);
    }
}
