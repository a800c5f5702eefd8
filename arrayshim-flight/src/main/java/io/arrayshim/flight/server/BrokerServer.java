package io.arrayshim.flight.server;

import io.arrayshim.common.database.DatabaseCallExecutor;
import org.apache.arrow.flight.FlightServer;
import org.apache.arrow.flight.Location;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.util.AutoCloseables;

import java.io.IOException;

/**
 * A configured Flight server together with the resources it owns.
 */
public record BrokerServer(FlightServer flightServer,
                           ArrayFlightProducer producer,
                           DatabaseCallExecutor callExecutor,
                           BufferAllocator allocator) implements AutoCloseable {

    public BrokerServer start() throws IOException {
        flightServer.start();
        return this;
    }

    public Location getLocation() {
        return flightServer.getLocation();
    }

    public void awaitTermination() throws InterruptedException {
        flightServer.awaitTermination();
    }

    @Override
    public void close() throws Exception {
        AutoCloseables.close(flightServer, producer, callExecutor, allocator);
    }
}
