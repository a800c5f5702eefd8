package io.arrayshim.flight.store;

import java.time.Instant;

public record SessionRecord(String token, String identity, Instant issuedAt, Role role) {

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }
}
