package io.arrayshim.flight.server;

import io.arrayshim.flight.BrokerRecorder;
import io.arrayshim.flight.context.DeferredQuery;
import io.arrayshim.flight.context.EngineException;
import org.apache.arrow.flight.FlightProducer;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.ipc.ArrowReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.ExecutorService;

public class ResultStreamUtil {

    private static final Logger logger = LoggerFactory.getLogger(ResultStreamUtil.class);

    private ResultStreamUtil() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Executes {@code query} on {@code executorService} and sends its batches to
     * {@code listener}. The query is closed once the stream ends, whatever the outcome.
     */
    static void streamQuery(ExecutorService executorService,
                            DeferredQuery query,
                            BufferAllocator allocator,
                            final int batchSize,
                            final FlightProducer.ServerStreamListener listener,
                            BrokerRecorder recorder) {
        executorService.submit(() -> {
            BufferAllocator childAllocator = null;
            var error = false;
            try {
                childAllocator = allocator.newChildAllocator("query-allocator", 0, allocator.getLimit());
                recorder.startStream();
                try (ArrowReader reader = query.execute(childAllocator, batchSize)) {
                    listener.start(reader.getVectorSchemaRoot());
                    while (loadNextBatch(reader)) {
                        if (listener.isCancelled()) {
                            logger.debug("Stream cancelled by client");
                            break;
                        }
                        recorder.recordGetStream(childAllocator.getAllocatedMemory());
                        listener.putNext();
                    }
                }
            } catch (Throwable throwable) {
                error = true;
                recorder.errorStream();
                ErrorHandling.handleThrowable(listener, throwable);
            } finally {
                try {
                    if (!error) {
                        listener.completed();
                    }
                    recorder.endStream();
                    query.close();
                    if (childAllocator != null) {
                        childAllocator.close();
                    }
                } catch (Exception e) {
                    logger.atError().setCause(e).log("Error running finally block");
                }
            }
        });
    }

    private static boolean loadNextBatch(ArrowReader reader) throws EngineException {
        try {
            return reader.loadNextBatch();
        } catch (IOException e) {
            throw new EngineException(e.getMessage(), e);
        }
    }
}
