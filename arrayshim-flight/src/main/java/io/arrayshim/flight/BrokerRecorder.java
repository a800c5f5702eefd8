package io.arrayshim.flight;

public interface BrokerRecorder {

    void recordHandshake(boolean success);

    void recordUnauthorized();

    void recordPermissionDenied();

    void recordTicketIssued();

    void recordTicketNotFound();

    void startStream();

    void recordGetStream(long size);

    void endStream();

    void errorStream();

    void recordContextRefresh(boolean success);

    void recordPrunedSessionTokens(int count);

    void recordPrunedTickets(int count);
}
