package io.arrayshim.flight;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

public class MicroMeterBrokerRecorder implements BrokerRecorder {

    private final MeterRegistry registry;

    // -------------------- Sessions -------------------------
    private final Counter handshakeCounter;
    private final Counter handshakeFailedCounter;
    private final Counter unauthorizedCounter;
    private final Counter permissionDeniedCounter;

    // -------------------- Tickets --------------------------
    private final Counter ticketIssuedCounter;
    private final Counter ticketNotFoundCounter;

    // -------------------- Streams --------------------------
    private final Counter streamCounter;
    private final Counter streamCompletedCounter;
    private final Counter streamErrorCounter;
    private final Counter streamBytesOutCounter;

    // -------------------- Admin ----------------------------
    private final Counter refreshCounter;
    private final Counter refreshErrorCounter;
    private final Counter prunedSessionTokensCounter;
    private final Counter prunedTicketsCounter;

    public MicroMeterBrokerRecorder(MeterRegistry registry, String producerId) {
        this.registry = registry;
        this.handshakeCounter = counter("handshake", producerId);
        this.handshakeFailedCounter = counter("handshake_failed", producerId);
        this.unauthorizedCounter = counter("unauthorized", producerId);
        this.permissionDeniedCounter = counter("permission_denied", producerId);
        this.ticketIssuedCounter = counter("ticket_issued", producerId);
        this.ticketNotFoundCounter = counter("ticket_not_found", producerId);
        this.streamCounter = counter("stream", producerId);
        this.streamCompletedCounter = counter("stream_completed", producerId);
        this.streamErrorCounter = counter("stream_error", producerId);
        this.streamBytesOutCounter = counter("stream_bytes_out", producerId);
        this.refreshCounter = counter("refresh_context", producerId);
        this.refreshErrorCounter = counter("refresh_context_error", producerId);
        this.prunedSessionTokensCounter = counter("pruned_session_tokens", producerId);
        this.prunedTicketsCounter = counter("pruned_tickets", producerId);
    }

    private Counter counter(String name, String producerId) {
        return Counter.builder("arrayshim.flight." + name + ".count")
                .tag("producer", producerId)
                .register(registry);
    }

    @Override
    public void recordHandshake(boolean success) {
        (success ? handshakeCounter : handshakeFailedCounter).increment();
    }

    @Override
    public void recordUnauthorized() {
        unauthorizedCounter.increment();
    }

    @Override
    public void recordPermissionDenied() {
        permissionDeniedCounter.increment();
    }

    @Override
    public void recordTicketIssued() {
        ticketIssuedCounter.increment();
    }

    @Override
    public void recordTicketNotFound() {
        ticketNotFoundCounter.increment();
    }

    @Override
    public void startStream() {
        streamCounter.increment();
    }

    @Override
    public void recordGetStream(long size) {
        streamBytesOutCounter.increment(size);
    }

    @Override
    public void endStream() {
        streamCompletedCounter.increment();
    }

    @Override
    public void errorStream() {
        streamErrorCounter.increment();
    }

    @Override
    public void recordContextRefresh(boolean success) {
        (success ? refreshCounter : refreshErrorCounter).increment();
    }

    @Override
    public void recordPrunedSessionTokens(int count) {
        prunedSessionTokensCounter.increment(count);
    }

    @Override
    public void recordPrunedTickets(int count) {
        prunedTicketsCounter.increment(count);
    }
}
