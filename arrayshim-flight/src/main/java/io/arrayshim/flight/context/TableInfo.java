package io.arrayshim.flight.context;

import org.apache.arrow.vector.types.pojo.Schema;

public record TableInfo(String name, Schema schema) { }
