package com.pytaintscanner.graph;

import com.pytaintscanner.model.IrGraph;

/**
 * Adds call targets that no call expression names explicitly, such as a message handler reached
 * through a broker. Runs after call resolution and before taint propagation.
 */
public interface GraphEnricher {

    String getName();

    void enrich(IrGraph graph, CallSites callSites, ModuleIndex index);
}
