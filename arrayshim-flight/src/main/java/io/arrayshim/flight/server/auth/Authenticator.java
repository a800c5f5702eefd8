package io.arrayshim.flight.server.auth;

import io.arrayshim.flight.store.Role;

import java.util.Optional;

/**
 * Decides whether a handshake may open a session, and with which role.
 */
@FunctionalInterface
public interface Authenticator {

    /**
     * @param adminRequested whether the client asked for an administrative session
     * @return the role granted, or empty when the credentials are refused or the requested
     *         role is not allowed for this identity
     */
    Optional<Role> authenticate(String identity, String credential, boolean adminRequested) throws Exception;
}
