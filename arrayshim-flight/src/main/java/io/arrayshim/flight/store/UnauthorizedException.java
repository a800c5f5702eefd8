package io.arrayshim.flight.store;

/**
 * Raised when a session token cannot be used to authorize a call.
 */
public class UnauthorizedException extends Exception {

    public enum Reason {
        NO_TOKEN("no session token provided"),
        INVALID_TOKEN("invalid session token"),
        EXPIRED("expired session token");

        private final String message;

        Reason(String message) {
            this.message = message;
        }
    }

    private final Reason reason;

    public UnauthorizedException(Reason reason) {
        super(reason.message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
