package at.sv.edo;

public final class InvalidLocation extends RuntimeException {
    public InvalidLocation(String message) {
        super(message);
    }
}
