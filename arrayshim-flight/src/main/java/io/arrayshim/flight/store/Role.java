package io.arrayshim.flight.store;

public enum Role {
    ADMIN,
    REGULAR
}
