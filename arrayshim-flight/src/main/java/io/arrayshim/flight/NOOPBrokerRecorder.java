package io.arrayshim.flight;

public class NOOPBrokerRecorder implements BrokerRecorder {

    @Override
    public void recordHandshake(boolean success) { }

    @Override
    public void recordUnauthorized() { }

    @Override
    public void recordPermissionDenied() { }

    @Override
    public void recordTicketIssued() { }

    @Override
    public void recordTicketNotFound() { }

    @Override
    public void startStream() { }

    @Override
    public void recordGetStream(long size) { }

    @Override
    public void endStream() { }

    @Override
    public void errorStream() { }

    @Override
    public void recordContextRefresh(boolean success) { }

    @Override
    public void recordPrunedSessionTokens(int count) { }

    @Override
    public void recordPrunedTickets(int count) { }
}
