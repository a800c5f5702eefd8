package io.arrayshim.flight.server.auth;

import io.arrayshim.flight.BrokerRecorder;
import io.arrayshim.flight.server.ErrorHandling;
import io.arrayshim.flight.store.Role;
import io.arrayshim.flight.store.SessionTokenStore;
import org.apache.arrow.flight.CallStatus;
import org.apache.arrow.flight.FlightRuntimeException;
import org.apache.arrow.flight.auth.ServerAuthHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Opens sessions through the Flight handshake.
 * <p>
 * The client sends three messages: identity, credential and an admin flag ({@code "0"} or
 * {@code "1"}). On success the server answers with a single message carrying the session
 * token, which the client then presents in the {@code authorization} header of every call.
 */
public class HandshakeAuthHandler implements ServerAuthHandler {

    private static final Logger logger = LoggerFactory.getLogger(HandshakeAuthHandler.class);

    private final Authenticator authenticator;
    private final SessionTokenStore sessionTokenStore;
    private final BrokerRecorder recorder;

    public HandshakeAuthHandler(Authenticator authenticator, SessionTokenStore sessionTokenStore, BrokerRecorder recorder) {
        this.authenticator = authenticator;
        this.sessionTokenStore = sessionTokenStore;
        this.recorder = recorder;
    }

    @Override
    public boolean authenticate(ServerAuthSender outgoing, Iterator<byte[]> incoming) {
        var identity = readMessage(incoming, "identity not provided during handshake");
        var credential = readMessage(incoming, "credential not provided during handshake");
        var flag = readMessage(incoming, "admin flag not provided during handshake");
        boolean adminRequested = switch (flag) {
            case "0" -> false;
            case "1" -> true;
            default -> throw CallStatus.INVALID_ARGUMENT
                    .withDescription("admin flag has invalid value")
                    .toRuntimeException();
        };

        Optional<Role> role;
        try {
            role = authenticator.authenticate(identity, credential, adminRequested);
        } catch (Exception e) {
            recorder.recordHandshake(false);
            ErrorHandling.handleThrowable(e);
            return false;
        }
        if (role.isEmpty()) {
            recorder.recordHandshake(false);
            logger.info("Handshake refused for {}", identity);
            throw CallStatus.UNAUTHENTICATED.withDescription("authentication failed").toRuntimeException();
        }
        var token = sessionTokenStore.issue(identity, role.get());
        recorder.recordHandshake(true);
        logger.info("Session opened for {} as {}", identity, role.get());
        outgoing.send(token.getBytes(StandardCharsets.UTF_8));
        return true;
    }

    /**
     * Every call passes here, including ones without a handshake token; the session token is
     * checked by the producer from the {@code authorization} header.
     */
    @Override
    public Optional<String> isValid(byte[] token) {
        return Optional.of("");
    }

    private static String readMessage(Iterator<byte[]> incoming, String missingMessage) throws FlightRuntimeException {
        try {
            var bytes = incoming.next();
            if (bytes == null) {
                throw new NoSuchElementException();
            }
            return new String(bytes, StandardCharsets.UTF_8);
        } catch (IllegalStateException | NoSuchElementException e) {
            throw CallStatus.INVALID_ARGUMENT.withDescription(missingMessage).toRuntimeException();
        }
    }
}
