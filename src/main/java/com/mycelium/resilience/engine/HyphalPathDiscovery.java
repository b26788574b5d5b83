package com.mycelium.resilience.engine;

import com.mycelium.resilience.api.EdgeKey;
import com.mycelium.resilience.model.GraphModel;
import com.mycelium.resilience.model.MycelialNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Hyphal growth pathfinding: diversity-seeking multi-path search.
 *
 * A fungal network does not settle for one route to a food source; it keeps
 * growing alternatives because the first one gets depleted. This class models
 * that pressure with an invocation-scoped penalty map:
 *
 * 1. Run the lowest-cost search from source to target.
 * 2. Accept the route (unless it repeats an accepted one) and multiply the cost
 * of every edge on it by the diversity penalty, for this invocation only.
 * 3. Search again, until K routes were accepted, no route remains, or the
 * attempt limit ({@code k * maxDiscoveryAttemptsFactor}) is reached.
 *
 * Routes may overlap; the penalty only makes overlap expensive. Results are
 * ranked by their true effective cost (penalties removed), then hop count, then
 * node sequence. The search never mutates edge state; usage is recorded
 * separately through {@link #recordSelection(List)}.
 *
 * K may be arbitrarily large ("every path"): a penalty that keeps compounding
 * overflows to infinity, which drops the edge from the search, so the loop
 * ends once the topology is exhausted.
 */
public final class HyphalPathDiscovery {
    private static final Logger log = LogManager.getLogger(HyphalPathDiscovery.class);
    private static final int INITIAL_CAPACITY = 16;

    private static final Comparator<PathSearch.Route> RANKING = (a, b) -> {
        int c = PathSearch.compareCost(a.cost(), b.cost());
        if (c != 0)
            return c;
        c = Integer.compare(a.hops(), b.hops());
        if (c != 0)
            return c;
        return PathSearch.compareSequence(a.nodes(), b.nodes());
    };

    private final GraphModel graph;
    private final EngineConfig config;

    public HyphalPathDiscovery(GraphModel graph, EngineConfig config) {
        this.graph = graph;
        this.config = config;
    }

    /**
     * Discovers up to {@code k} diverse paths.
     *
     * @return Paths ranked by ascending effective cost; empty when the nodes are
     *         disconnected or either endpoint is damaged.
     * @throws com.mycelium.resilience.model.UnknownNodeException if either node
     *                                                            does not exist.
     * @throws IllegalArgumentException                           if k <= 0.
     */
    public List<HyphalPath> discover(String source, String target, int k) {
        if (k <= 0)
            throw new IllegalArgumentException("Path count must be positive: " + k);
        MycelialNode from = graph.node(source);
        MycelialNode to = graph.node(target);

        if (source.equals(target)) {
            return from.isHealthy()
                    ? List.of(new HyphalPath("primary", List.of(source), List.of(), 0.0))
                    : List.of();
        }
        if (!from.isHealthy() || !to.isHealthy())
            return List.of();

        Map<EdgeKey, Double> penalties = new HashMap<>();
        Set<List<EdgeKey>> seen = new HashSet<>();
        List<PathSearch.Route> accepted = new ArrayList<>(Math.min(k, INITIAL_CAPACITY));
        long maxAttempts = (long) k * config.getMaxDiscoveryAttemptsFactor();
        long attempts = 0;

        while (accepted.size() < k && attempts < maxAttempts) {
            attempts++;
            PathSearch.Route route = PathSearch.shortest(graph, source, target::equals,
                    e -> e.effectiveCost() * penalties.getOrDefault(e.key(), 1.0));
            if (route == null)
                break;
            if (seen.add(route.edges()))
                accepted.add(trueCost(route));
            for (EdgeKey key : route.edges())
                penalties.merge(key, config.getDiversityPenalty(), (a, b) -> a * b);
        }

        accepted.sort(RANKING);
        List<HyphalPath> result = new ArrayList<>(accepted.size());
        for (int i = 0; i < accepted.size(); i++) {
            PathSearch.Route r = accepted.get(i);
            result.add(new HyphalPath(i == 0 ? "primary" : "alternative_" + i, r.nodes(), r.edges(), r.cost()));
        }
        log.debug("Discovered {}/{} paths {} -> {} in {} attempts", result.size(), k, source, target, attempts);
        return result;
    }

    /**
     * Single lowest-cost probe without diversity penalties or usage accounting.
     * Used by repair to test reachability on the current healthy subgraph.
     *
     * @return The cheapest path, or null if none exists.
     */
    HyphalPath probe(String source, String target) {
        List<HyphalPath> paths = discover(source, target, 1);
        return paths.isEmpty() ? null : paths.get(0);
    }

    /** Counts one selection on every edge of every given path. */
    public void recordSelection(List<HyphalPath> paths) {
        for (HyphalPath path : paths)
            for (EdgeKey key : path.edges())
                graph.recordUsage(key, 1);
    }

    private PathSearch.Route trueCost(PathSearch.Route route) {
        double cost = 0.0;
        for (EdgeKey key : route.edges())
            cost += graph.edge(key).effectiveCost();
        return new PathSearch.Route(route.nodes(), route.edges(), cost);
    }
}
