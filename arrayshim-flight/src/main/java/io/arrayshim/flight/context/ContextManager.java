package io.arrayshim.flight.context;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the single live {@link QueryContext} and swaps it atomically.
 */
public class ContextManager implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ContextManager.class);

    private final AtomicReference<QueryContext> current;

    public ContextManager(QueryContext initial) {
        this.current = new AtomicReference<>(initial);
    }

    /**
     * The live context, without taking a reference. Only safe for reading table metadata.
     */
    public QueryContext current() {
        var context = current.get();
        if (context == null) {
            throw new IllegalStateException("context manager is closed");
        }
        return context;
    }

    /**
     * Compiles {@code sql} against the live context. A concurrent {@link #replace} either
     * happens entirely before or entirely after.
     */
    public DeferredQuery compile(String sql) throws EngineException {
        while (true) {
            var context = current();
            try {
                return context.compile(sql);
            } catch (IllegalStateException e) {
                if (current.get() == context) {
                    throw e;
                }
                // swapped out and closed between read and compile
            }
        }
    }

    /**
     * Installs {@code next} as the live context and releases the previous one. Queries
     * compiled against the previous context keep it open until they are closed.
     */
    public void replace(QueryContext next) {
        var previous = current.getAndSet(next);
        if (previous != null) {
            previous.release();
        }
        logger.info("Query context replaced, {} tables", next.tables().size());
    }

    @Override
    public void close() {
        var previous = current.getAndSet(null);
        if (previous != null) {
            previous.release();
        }
    }
}
