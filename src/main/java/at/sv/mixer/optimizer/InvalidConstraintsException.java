package at.sv.mixer.optimizer;

public final class InvalidConstraintsException extends RuntimeException {

    public InvalidConstraintsException(String message) {
        super(message);
    }
}
