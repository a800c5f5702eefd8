package io.arrayshim.flight.context;

/**
 * Produces a complete replacement for the live {@link QueryContext}.
 */
@FunctionalInterface
public interface ContextBuilder {

    QueryContext rebuild() throws Exception;
}
