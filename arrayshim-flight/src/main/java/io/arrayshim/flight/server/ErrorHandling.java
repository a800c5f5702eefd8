package io.arrayshim.flight.server;

import io.arrayshim.flight.context.EngineException;
import io.arrayshim.flight.store.UnauthorizedException;
import org.apache.arrow.flight.CallStatus;
import org.apache.arrow.flight.FlightProducer;
import org.apache.arrow.flight.FlightRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts failures into Flight call statuses, either thrown or delivered to a listener.
 * <ul>
 *     <li>{@link FlightRuntimeException}: passed through</li>
 *     <li>{@link UnauthorizedException}: {@code UNAUTHENTICATED}</li>
 *     <li>{@link EngineException}: {@code UNKNOWN} with the engine's message</li>
 *     <li>anything else: {@code INTERNAL}, logged</li>
 * </ul>
 */
public class ErrorHandling {

    private static final Logger logger = LoggerFactory.getLogger(ErrorHandling.class);

    private ErrorHandling() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static FlightRuntimeException toFlightException(Throwable t) {
        if (t instanceof FlightRuntimeException e) {
            return e;
        } else if (t instanceof UnauthorizedException e) {
            return CallStatus.UNAUTHENTICATED.withDescription(e.getMessage()).toRuntimeException();
        } else if (t instanceof EngineException e) {
            return CallStatus.UNKNOWN.withDescription(e.getMessage()).withCause(e).toRuntimeException();
        } else {
            logger.atError().setCause(t).log("Error processing");
            return CallStatus.INTERNAL.withDescription(t.getMessage()).withCause(t).toRuntimeException();
        }
    }

    public static void handleThrowable(Throwable t) {
        throw toFlightException(t);
    }

    public static void handleThrowable(FlightProducer.ServerStreamListener listener, Throwable t) {
        listener.error(toFlightException(t));
    }

    public static <T> void handleThrowable(FlightProducer.StreamListener<T> listener, Throwable t) {
        listener.onError(toFlightException(t));
    }

    public static void throwUnimplemented(FlightProducer.ServerStreamListener listener, String method) {
        logger.info("Unimplemented method called {}", method);
        listener.error(CallStatus.UNIMPLEMENTED.withDescription(method + " is not supported").toRuntimeException());
    }

    static FlightRuntimeException permissionDenied() {
        return CallStatus.UNAUTHORIZED.withDescription("permission to perform admin action denied").toRuntimeException();
    }

    static FlightRuntimeException invalidArgument(String message) {
        return CallStatus.INVALID_ARGUMENT.withDescription(message).toRuntimeException();
    }
}
