package dev.menuwizard.backend;

/**
 * Transport or server-side rejection reported by an {@link ApiGateway}.
 */
public class GatewayException extends RuntimeException {

    private final int status;

    public GatewayException(String message, int status) {
        super(message);
        this.status = status;
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
    }

    /** HTTP status, or 0 when the request never got a response. */
    public int status() {
        return status;
    }
}
