package io.arrayshim.flight.server;

import io.arrayshim.flight.BrokerRecorder;
import io.arrayshim.flight.context.ContextBuilder;
import io.arrayshim.flight.context.ContextManager;
import io.arrayshim.flight.context.DeferredQuery;
import io.arrayshim.flight.context.QueryContext;
import io.arrayshim.flight.server.auth.AuthUtils;
import io.arrayshim.flight.store.SessionRecord;
import io.arrayshim.flight.store.SessionTokenStore;
import io.arrayshim.flight.store.TicketStore;
import io.arrayshim.flight.store.UnauthorizedException;
import org.apache.arrow.flight.Action;
import org.apache.arrow.flight.ActionType;
import org.apache.arrow.flight.CallStatus;
import org.apache.arrow.flight.Criteria;
import org.apache.arrow.flight.FlightDescriptor;
import org.apache.arrow.flight.FlightEndpoint;
import org.apache.arrow.flight.FlightInfo;
import org.apache.arrow.flight.FlightProducer;
import org.apache.arrow.flight.FlightStream;
import org.apache.arrow.flight.PutResult;
import org.apache.arrow.flight.Result;
import org.apache.arrow.flight.SchemaResult;
import org.apache.arrow.flight.Ticket;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.util.AutoCloseables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Flight service answering SQL queries against the live {@link QueryContext}.
 * <p>
 * Every call except the handshake must carry a session token in its {@code authorization}
 * header. {@link #getFlightInfo} compiles the query named by a path descriptor and hands
 * back a single-use ticket; {@link #getStream} redeems the ticket and streams the result.
 * Administrative actions require an admin session.
 */
public class ArrayFlightProducer implements FlightProducer, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ArrayFlightProducer.class);

    public static final String REFRESH_CONTEXT = "REFRESH_CONTEXT";
    public static final String CLEAR_EXPIRED_ITEMS = "CLEAR_EXPIRED_ITEMS";
    public static final String SUCCESS = "SUCCESS";

    private final String producerId;
    private final SessionTokenStore sessionTokenStore;
    private final TicketStore ticketStore;
    private final ContextManager contextManager;
    private final ContextBuilder contextBuilder;
    private final BufferAllocator allocator;
    private final int batchSize;
    private final ExecutorService executorService;
    private final BrokerRecorder recorder;
    private final List<ActionType> actionTypes;

    public ArrayFlightProducer(String producerId,
                               SessionTokenStore sessionTokenStore,
                               TicketStore ticketStore,
                               ContextManager contextManager,
                               ContextBuilder contextBuilder,
                               BufferAllocator allocator,
                               int batchSize,
                               ExecutorService executorService,
                               BrokerRecorder recorder) {
        this.producerId = producerId;
        this.sessionTokenStore = sessionTokenStore;
        this.ticketStore = ticketStore;
        this.contextManager = contextManager;
        this.contextBuilder = contextBuilder;
        this.allocator = allocator;
        this.batchSize = batchSize;
        this.executorService = executorService;
        this.recorder = recorder;
        this.actionTypes = List.of(
                new ActionType(REFRESH_CONTEXT, "Re-generate the tables by querying the backing database"),
                new ActionType(CLEAR_EXPIRED_ITEMS, "Clear all session tokens and tickets older than %d secs"
                        .formatted(sessionTokenStore.expirationAge().toSeconds())));
    }

    @Override
    public void listFlights(CallContext context, Criteria criteria, StreamListener<FlightInfo> listener) {
        try {
            authorize(context);
            for (var table : contextManager.current().tables()) {
                listener.onNext(new FlightInfo(table.schema(), FlightDescriptor.path(table.name()), List.of(), -1, -1));
            }
            listener.onCompleted();
        } catch (Throwable t) {
            ErrorHandling.handleThrowable(listener, t);
        }
    }

    @Override
    public FlightInfo getFlightInfo(CallContext context, FlightDescriptor descriptor) {
        try {
            authorize(context);
            var query = contextManager.compile(resolveQuery(descriptor));
            var ticket = ticketStore.issue(query);
            recorder.recordTicketIssued();
            var endpoint = new FlightEndpoint(new Ticket(ticket.getBytes(StandardCharsets.UTF_8)));
            return new FlightInfo(query.schema(), descriptor, List.of(endpoint), -1, -1);
        } catch (Throwable t) {
            throw ErrorHandling.toFlightException(t);
        }
    }

    @Override
    public SchemaResult getSchema(CallContext context, FlightDescriptor descriptor) {
        try {
            authorize(context);
            try (DeferredQuery query = contextManager.compile(resolveQuery(descriptor))) {
                return new SchemaResult(query.schema());
            }
        } catch (Throwable t) {
            throw ErrorHandling.toFlightException(t);
        }
    }

    @Override
    public void getStream(CallContext context, Ticket ticket, ServerStreamListener listener) {
        try {
            authorize(context);
            var key = new String(ticket.getBytes(), StandardCharsets.UTF_8);
            var record = ticketStore.redeem(key);
            if (record.isEmpty()) {
                recorder.recordTicketNotFound();
                listener.error(CallStatus.NOT_FOUND.withDescription("ticket not found").toRuntimeException());
                return;
            }
            var query = record.get().deferredQuery();
            try {
                ResultStreamUtil.streamQuery(executorService, query, allocator, batchSize, listener, recorder);
            } catch (RuntimeException e) {
                // never handed to the stream executor
                query.close();
                throw e;
            }
        } catch (Throwable t) {
            ErrorHandling.handleThrowable(listener, t);
        }
    }

    @Override
    public Runnable acceptPut(CallContext context, FlightStream flightStream, StreamListener<PutResult> ackStream) {
        return () -> ackStream.onError(CallStatus.UNAUTHENTICATED
                .withDescription("PUT not authorized for this database")
                .toRuntimeException());
    }

    @Override
    public void doAction(CallContext context, Action action, StreamListener<Result> listener) {
        try {
            requireAdmin(authorize(context));
            switch (action.getType()) {
                case REFRESH_CONTEXT -> refreshContext(listener);
                case CLEAR_EXPIRED_ITEMS -> clearExpiredItems(listener);
                default -> throw ErrorHandling.invalidArgument("invalid action");
            }
        } catch (Throwable t) {
            ErrorHandling.handleThrowable(listener, t);
        }
    }

    @Override
    public void listActions(CallContext context, StreamListener<ActionType> listener) {
        try {
            requireAdmin(authorize(context));
            actionTypes.forEach(listener::onNext);
            listener.onCompleted();
        } catch (Throwable t) {
            ErrorHandling.handleThrowable(listener, t);
        }
    }

    @Override
    public void doExchange(CallContext context, FlightStream reader, ServerStreamListener writer) {
        ErrorHandling.throwUnimplemented(writer, "DoExchange");
    }

    public String getProducerId() {
        return producerId;
    }

    @Override
    public void close() throws Exception {
        executorService.shutdown();
        AutoCloseables.close(contextManager);
    }

    private SessionRecord authorize(CallContext context) throws UnauthorizedException {
        try {
            return sessionTokenStore.validate(AuthUtils.readSessionToken(context));
        } catch (UnauthorizedException e) {
            recorder.recordUnauthorized();
            throw e;
        }
    }

    private void requireAdmin(SessionRecord session) {
        if (!session.isAdmin()) {
            recorder.recordPermissionDenied();
            logger.info("Admin request refused for {}", session.identity());
            throw ErrorHandling.permissionDenied();
        }
    }

    /**
     * The query of a path descriptor is its first path element, with {@code \'} standing
     * for a single quote.
     */
    static String resolveQuery(FlightDescriptor descriptor) {
        if (!descriptor.isCommand()) {
            var path = descriptor.getPath();
            if (path != null && !path.isEmpty()) {
                return path.get(0).replace("\\'", "'");
            }
        }
        throw ErrorHandling.invalidArgument("flight descriptor must be a path holding the query");
    }

    private void refreshContext(StreamListener<Result> listener) {
        QueryContext next;
        try {
            next = contextBuilder.rebuild();
        } catch (Exception e) {
            recorder.recordContextRefresh(false);
            logger.atError().setCause(e).log("Error refreshing query context");
            throw CallStatus.INTERNAL.withDescription("internal error refreshing context").withCause(e).toRuntimeException();
        }
        contextManager.replace(next);
        recorder.recordContextRefresh(true);
        listener.onNext(result(SUCCESS));
        listener.onCompleted();
    }

    private void clearExpiredItems(StreamListener<Result> listener) {
        var maxAge = sessionTokenStore.expirationAge();
        var results = new ArrayList<Result>();
        RuntimeException failure = null;
        try {
            int removed = sessionTokenStore.prune(maxAge);
            recorder.recordPrunedSessionTokens(removed);
            results.add(result("REMOVED %d EXPIRED SESSION TOKENS".formatted(removed)));
        } catch (RuntimeException e) {
            failure = e;
        }
        try {
            int removed = ticketStore.prune(maxAge);
            recorder.recordPrunedTickets(removed);
            results.add(result("REMOVED %d EXPIRED TICKETS".formatted(removed)));
        } catch (RuntimeException e) {
            if (failure == null) {
                failure = e;
            } else {
                failure.addSuppressed(e);
            }
        }
        if (failure == null) {
            listener.onNext(result(SUCCESS));
        }
        results.forEach(listener::onNext);
        if (failure != null) {
            logger.atError().setCause(failure).log("Error clearing expired items");
            listener.onError(CallStatus.INTERNAL.withDescription("internal error clearing expired items")
                    .withCause(failure).toRuntimeException());
            return;
        }
        logger.info("Expired items cleared");
        listener.onCompleted();
    }

    private static Result result(String message) {
        return new Result(message.getBytes(StandardCharsets.UTF_8));
    }
}
