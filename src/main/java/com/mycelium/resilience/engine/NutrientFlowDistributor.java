package com.mycelium.resilience.engine;

import com.mycelium.resilience.api.EdgeKey;
import com.mycelium.resilience.api.ResilienceListener;
import com.mycelium.resilience.model.GraphModel;
import com.mycelium.resilience.model.MycelialEdge;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

import lombok.extern.log4j.Log4j2;

/**
 * Nutrient flow: moves resource from sources to sinks along the cheapest
 * capacity-respecting paths, and lets the pathways that carry it strengthen.
 *
 * Round structure:
 * Each round visits the sources in identifier order. A source with remaining
 * supply searches (lowest effective cost, no diversity penalty) for the nearest
 * sink with unmet demand over edges that still have residual capacity, and
 * pushes min(remaining supply, remaining demand, bottleneck residual) along
 * that path. Every edge on the path gets one usage count per push.
 *
 * Reinforcement and decay:
 * - After every round, each edge that carried flow in it loses
 * {@code reinforcementRate * roundFlow / capacity} of its reinforcement factor,
 * never going below {@code reinforcementFloor}.
 * - After the distribution, each edge that carried nothing drifts back toward
 * its base cost by {@code decayRate} of the remaining gap.
 *
 * Termination:
 * A round without any push means convergence. Hitting {@code maxFlowRounds}
 * ends the distribution as a partial success; the report says whether
 * deliverable demand was left.
 *
 * Capacities:
 * Edge capacity bounds the total carried by an edge in one distribution (both
 * directions share it on undirected edges). A sink never accepts more than its
 * free headroom, and node resource levels stay clamped in [0, capacity].
 */
@Log4j2
public final class NutrientFlowDistributor {
    private static final double EPSILON = 1e-9;

    private final GraphModel graph;
    private final EngineConfig config;
    private ResilienceListener listener;

    public NutrientFlowDistributor(GraphModel graph, EngineConfig config) {
        this.graph = graph;
        this.config = config;
    }

    public void setListener(ResilienceListener listener) {
        this.listener = listener;
    }

    /**
     * Distributes supply to demand.
     *
     * @param supplies Source node -> quantity to ship.
     * @param demands  Sink node -> quantity wanted.
     * @throws com.mycelium.resilience.model.UnknownNodeException if a source or
     *                                                            sink does not
     *                                                            exist.
     * @throws IllegalArgumentException                           for a negative or
     *                                                            non-finite
     *                                                            quantity.
     */
    public FlowReport distribute(Map<String, Double> supplies, Map<String, Double> demands) {
        // Validate everything before touching the graph.
        validate(supplies, "supply");
        validate(demands, "demand");

        TreeMap<String, Double> supply = new TreeMap<>();
        double totalSupply = 0.0;
        for (var e : supplies.entrySet()) {
            totalSupply += e.getValue();
            if (e.getValue() > EPSILON)
                supply.put(e.getKey(), e.getValue());
        }
        Map<String, Double> demand = new HashMap<>();
        double totalDemand = 0.0;
        for (var e : demands.entrySet()) {
            totalDemand += e.getValue();
            double acceptable = Math.min(e.getValue(), graph.node(e.getKey()).headroom());
            if (acceptable > EPSILON)
                demand.put(e.getKey(), acceptable);
        }

        Map<EdgeKey, Double> carried = new LinkedHashMap<>();
        Map<String, Double> deliveries = new LinkedHashMap<>();
        double delivered = 0.0;
        int rounds = 0;
        boolean converged = false;

        while (rounds < config.getMaxFlowRounds()) {
            rounds++;
            Map<EdgeKey, Double> roundFlow = new HashMap<>();
            double roundTotal = 0.0;

            for (var source : supply.entrySet()) {
                String src = source.getKey();
                double remaining = source.getValue();
                if (remaining <= EPSILON)
                    continue;

                PathSearch.Route route = nearestSink(src, demand, carried);
                if (route == null)
                    continue;

                String sink = route.destination();
                double bottleneck = Double.POSITIVE_INFINITY;
                for (EdgeKey key : route.edges())
                    bottleneck = Math.min(bottleneck, residual(graph.edge(key), carried));
                double amount = Math.min(remaining, Math.min(demand.get(sink), bottleneck));
                if (amount <= EPSILON)
                    continue;

                for (EdgeKey key : route.edges()) {
                    carried.merge(key, amount, Double::sum);
                    roundFlow.merge(key, amount, Double::sum);
                    graph.recordUsage(key, 1);
                }
                source.setValue(remaining - amount);
                demand.merge(sink, -amount, Double::sum);
                deliveries.merge(sink, amount, Double::sum);
                graph.adjustResourceLevel(src, -amount);
                graph.adjustResourceLevel(sink, amount);
                delivered += amount;
                roundTotal += amount;
                log.debug("Round {}: pushed {} from {} to {} via {}", rounds, amount, src, sink, route.nodes());
            }

            reinforce(roundFlow);
            if (listener != null)
                listener.onFlowRound(rounds, roundTotal);

            if (roundTotal <= EPSILON) {
                converged = true;
                break;
            }
        }

        if (!converged)
            converged = !anyDeliverable(supply, demand, carried);

        decayUnused(carried);

        FlowReport report = new FlowReport(totalSupply, totalDemand, delivered, rounds, converged, carried, deliveries);
        log.info("Flow distribution: delivered {} of supply {} / demand {} in {} rounds (converged={})",
                delivered, totalSupply, totalDemand, rounds, converged);
        if (listener != null)
            listener.onFlowEnd(report);
        return report;
    }

    private void validate(Map<String, Double> quantities, String what) {
        for (var e : quantities.entrySet()) {
            graph.node(e.getKey());
            Double q = e.getValue();
            if (q == null || !(q >= 0) || Double.isInfinite(q))
                throw new IllegalArgumentException("Invalid " + what + " for " + e.getKey() + ": " + q);
        }
    }

    private PathSearch.Route nearestSink(String src, Map<String, Double> demand, Map<EdgeKey, Double> carried) {
        return PathSearch.shortest(graph, src,
                id -> demand.getOrDefault(id, 0.0) > EPSILON,
                e -> residual(e, carried) > EPSILON ? e.effectiveCost() : Double.POSITIVE_INFINITY);
    }

    private static double residual(MycelialEdge edge, Map<EdgeKey, Double> carried) {
        return edge.capacity() - carried.getOrDefault(edge.key(), 0.0);
    }

    private boolean anyDeliverable(Map<String, Double> supply, Map<String, Double> demand,
            Map<EdgeKey, Double> carried) {
        for (var source : supply.entrySet()) {
            if (source.getValue() > EPSILON && nearestSink(source.getKey(), demand, carried) != null)
                return true;
        }
        return false;
    }

    private void reinforce(Map<EdgeKey, Double> roundFlow) {
        for (var e : roundFlow.entrySet()) {
            MycelialEdge edge = graph.edge(e.getKey());
            double drop = config.getReinforcementRate() * (e.getValue() / edge.capacity());
            double factor = Math.max(config.getReinforcementFloor(), edge.reinforcement() - drop);
            graph.setReinforcement(edge.key(), factor);
        }
    }

    private void decayUnused(Map<EdgeKey, Double> carried) {
        for (MycelialEdge edge : graph.edges()) {
            if (carried.containsKey(edge.key()) || edge.reinforcement() >= 1.0)
                continue;
            double factor = edge.reinforcement() + config.getDecayRate() * (1.0 - edge.reinforcement());
            graph.setReinforcement(edge.key(), Math.min(1.0, factor));
        }
    }
}
