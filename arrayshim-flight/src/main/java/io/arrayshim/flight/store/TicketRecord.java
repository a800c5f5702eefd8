package io.arrayshim.flight.store;

import io.arrayshim.flight.context.DeferredQuery;

import java.time.Instant;

public record TicketRecord(String ticket, DeferredQuery deferredQuery, Instant issuedAt) { }
