package io.arrayshim.flight.context;

/**
 * A query failed to compile or execute. The message is the engine's own and is passed to
 * clients unchanged.
 */
public class EngineException extends Exception {

    public EngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
