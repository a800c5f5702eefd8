package io.arrayshim.flight.server;

import io.arrayshim.flight.context.EngineException;
import io.arrayshim.flight.store.UnauthorizedException;
import org.apache.arrow.flight.CallStatus;
import org.apache.arrow.flight.FlightProducer;
import org.apache.arrow.flight.FlightRuntimeException;
import org.apache.arrow.flight.FlightStatusCode;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

public class ErrorHandlingTest {

    @Test
    public void testStatusMapping() {
        var engine = ErrorHandling.toFlightException(
                new EngineException("Parser Error: syntax error at or near \"SELEC\"", new SQLException()));
        assertEquals(FlightStatusCode.UNKNOWN, engine.status().code());
        assertEquals("Parser Error: syntax error at or near \"SELEC\"", engine.status().description());

        var unauthorized = ErrorHandling.toFlightException(
                new UnauthorizedException(UnauthorizedException.Reason.EXPIRED));
        assertEquals(FlightStatusCode.UNAUTHENTICATED, unauthorized.status().code());
        assertEquals("expired session token", unauthorized.status().description());

        var flight = CallStatus.NOT_FOUND.withDescription("ticket not found").toRuntimeException();
        assertSame(flight, ErrorHandling.toFlightException(flight));

        var internal = ErrorHandling.toFlightException(new IllegalStateException("boom"));
        assertEquals(FlightStatusCode.INTERNAL, internal.status().code());
    }

    @Test
    public void testThrowingVariant() {
        var e = assertThrows(FlightRuntimeException.class,
                () -> ErrorHandling.handleThrowable(new UnauthorizedException(UnauthorizedException.Reason.NO_TOKEN)));
        assertEquals("no session token provided", e.status().description());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testListenerVariants() {
        var serverListener = mock(FlightProducer.ServerStreamListener.class);
        ErrorHandling.handleThrowable(serverListener, new EngineException("Binder Error", null));
        verify(serverListener).error(argThat(t ->
                ((FlightRuntimeException) t).status().code() == FlightStatusCode.UNKNOWN));

        FlightProducer.StreamListener<Object> listener = mock(FlightProducer.StreamListener.class);
        ErrorHandling.handleThrowable(listener, new RuntimeException("unexpected"));
        verify(listener).onError(argThat(t ->
                ((FlightRuntimeException) t).status().code() == FlightStatusCode.INTERNAL));
    }
}
