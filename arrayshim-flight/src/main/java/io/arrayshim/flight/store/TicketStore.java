package io.arrayshim.flight.store;

import io.arrayshim.flight.context.DeferredQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Compiled queries waiting to be streamed, keyed by single-use ticket.
 */
public class TicketStore {

    private static final Logger logger = LoggerFactory.getLogger(TicketStore.class);

    private final Map<String, TicketRecord> tickets = new ConcurrentHashMap<>();
    private final Clock clock;

    public TicketStore(Clock clock) {
        this.clock = clock;
    }

    public String issue(DeferredQuery deferredQuery) {
        while (true) {
            var ticket = RandomTokens.next();
            var record = new TicketRecord(ticket, deferredQuery, clock.instant());
            if (tickets.putIfAbsent(ticket, record) == null) {
                return ticket;
            }
        }
    }

    /**
     * Removes and returns the record for {@code ticket}. Of several concurrent redemptions
     * of the same ticket at most one sees the record.
     */
    public Optional<TicketRecord> redeem(String ticket) {
        return Optional.ofNullable(tickets.remove(ticket));
    }

    /**
     * Removes every ticket issued more than {@code maxAge} ago and closes its query.
     *
     * @return the number of tickets removed by this call
     */
    public int prune(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        int removed = 0;
        for (var entry : tickets.entrySet()) {
            var record = entry.getValue();
            if (record.issuedAt().isBefore(cutoff) && tickets.remove(entry.getKey(), record)) {
                removed++;
                try {
                    record.deferredQuery().close();
                } catch (Exception e) {
                    logger.atWarn().setCause(e).log("Error closing query of expired ticket");
                }
            }
        }
        return removed;
    }

    public int size() {
        return tickets.size();
    }
}
