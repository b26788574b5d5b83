package com.mycelium.resilience.engine;

import com.mycelium.resilience.api.EdgeKey;

import java.util.Map;

/**
 * Outcome of one nutrient flow distribution.
 *
 * @param totalSupply    sum of requested supplies
 * @param totalDemand    sum of requested demands
 * @param delivered      total amount that reached sinks
 * @param rounds         rounds executed
 * @param converged      false when the round limit stopped the distribution
 *                       while deliverable demand remained
 * @param edgeFlows      amount carried per edge (only edges that carried flow)
 * @param sinkDeliveries amount received per sink (only sinks that received any)
 */
public record FlowReport(double totalSupply, double totalDemand, double delivered, int rounds,
        boolean converged, Map<EdgeKey, Double> edgeFlows, Map<String, Double> sinkDeliveries) {

    public FlowReport {
        edgeFlows = Map.copyOf(edgeFlows);
        sinkDeliveries = Map.copyOf(sinkDeliveries);
    }

    public double flowOn(EdgeKey edge) {
        return edgeFlows.getOrDefault(edge, 0.0);
    }

    public double deliveredTo(String sink) {
        return sinkDeliveries.getOrDefault(sink, 0.0);
    }
}
