package com.mycelium.resilience.engine;

import com.mycelium.resilience.api.EdgeKey;
import com.mycelium.resilience.model.GraphModel;
import com.mycelium.resilience.model.MycelialEdge;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.ToDoubleFunction;

/**
 * Deterministic lowest-cost search over the traversable part of a
 * {@link GraphModel}. Shared by path discovery, flow distribution and repair.
 *
 * Algorithm:
 * Label-setting Dijkstra. A label carries the cumulative cost, the hop count and
 * the full node sequence from its origin. Labels are totally ordered by:
 * 1. cost (values within a relative epsilon are treated as equal),
 * 2. hop count,
 * 3. the node identifier sequence, compared lexicographically.
 * Extending two labels by the same edge preserves their order, so the first
 * label settled at a node is the best one under this order and ties resolve the
 * same way on every run.
 *
 * Costs:
 * The caller supplies the cost of each edge. Returning
 * {@link Double#POSITIVE_INFINITY} (or NaN) excludes the edge, which is how
 * residual capacity and invocation-scoped penalties are layered on without
 * touching persistent edge state. Costs must be non-negative.
 */
final class PathSearch {
    private static final double EPSILON = 1e-9;

    private PathSearch() {
    }

    /** A found route: node sequence, edge sequence and total cost under the search's cost function. */
    record Route(List<String> nodes, List<EdgeKey> edges, double cost) {

        String origin() {
            return nodes.get(0);
        }

        String destination() {
            return nodes.get(nodes.size() - 1);
        }

        int hops() {
            return edges.size();
        }
    }

    /**
     * Finds the best route from {@code source} to the first node accepted by
     * {@code isTarget}. The source itself is never a target.
     *
     * @return The route, or null if no target is reachable at finite cost.
     */
    static Route shortest(GraphModel graph, String source, Predicate<String> isTarget,
            ToDoubleFunction<MycelialEdge> cost) {
        Map<String, Label> settled = run(graph, List.of(source), cost, id -> !id.equals(source) && isTarget.test(id));
        for (Label label : settled.values())
            if (!label.node.equals(source) && isTarget.test(label.node))
                return label.toRoute();
        return null;
    }

    /**
     * Settles every node reachable from any of {@code sources} (a multi-source
     * search). Each result route starts at the source that reaches the node best.
     *
     * @return Routes keyed by destination, in settling order. Sources map to
     *         zero-length routes.
     */
    static Map<String, Route> shortestFrom(GraphModel graph, Collection<String> sources,
            ToDoubleFunction<MycelialEdge> cost) {
        Map<String, Label> settled = run(graph, sources, cost, id -> false);
        Map<String, Route> routes = new LinkedHashMap<>(settled.size() * 2);
        for (var entry : settled.entrySet())
            routes.put(entry.getKey(), entry.getValue().toRoute());
        return routes;
    }

    /** Orders two costs, treating values within a relative epsilon as equal. */
    static int compareCost(double a, double b) {
        double scale = Math.max(1.0, Math.max(Math.abs(a), Math.abs(b)));
        if (Math.abs(a - b) <= EPSILON * scale)
            return 0;
        return Double.compare(a, b);
    }

    /** Lexicographic comparison of node identifier sequences. */
    static int compareSequence(List<String> a, List<String> b) {
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            int c = a.get(i).compareTo(b.get(i));
            if (c != 0)
                return c;
        }
        return Integer.compare(a.size(), b.size());
    }

    private static Map<String, Label> run(GraphModel graph, Collection<String> sources,
            ToDoubleFunction<MycelialEdge> cost, Predicate<String> stopAt) {
        Map<String, Label> best = new HashMap<>();
        Map<String, Label> settled = new LinkedHashMap<>();
        Set<String> done = new HashSet<>();
        PriorityQueue<Label> queue = new PriorityQueue<>();

        for (String source : sources) {
            Label start = new Label(source, 0.0, List.of(source), List.of());
            Label existing = best.get(source);
            if (existing == null || start.compareTo(existing) < 0) {
                best.put(source, start);
                queue.add(start);
            }
        }

        while (!queue.isEmpty()) {
            Label current = queue.poll();
            if (!done.add(current.node))
                continue; // stale entry
            settled.put(current.node, current);
            if (stopAt.test(current.node))
                break;

            for (MycelialEdge edge : graph.traversableEdgesFrom(current.node)) {
                double w = cost.applyAsDouble(edge);
                if (!(w < Double.POSITIVE_INFINITY))
                    continue; // excluded (infinite or NaN)
                if (w < 0)
                    throw new IllegalStateException("Negative edge cost " + w + " on " + edge.key());
                String next = edge.key().other(current.node);
                if (done.contains(next))
                    continue;
                Label candidate = current.extend(next, edge.key(), w);
                Label existing = best.get(next);
                if (existing == null || candidate.compareTo(existing) < 0) {
                    best.put(next, candidate);
                    queue.add(candidate);
                }
            }
        }
        return settled;
    }

    private static final class Label implements Comparable<Label> {
        final String node;
        final double cost;
        final List<String> nodes;
        final List<EdgeKey> edges;

        Label(String node, double cost, List<String> nodes, List<EdgeKey> edges) {
            this.node = node;
            this.cost = cost;
            this.nodes = nodes;
            this.edges = edges;
        }

        Label extend(String next, EdgeKey via, double weight) {
            List<String> n = new ArrayList<>(nodes.size() + 1);
            n.addAll(nodes);
            n.add(next);
            List<EdgeKey> e = new ArrayList<>(edges.size() + 1);
            e.addAll(edges);
            e.add(via);
            return new Label(next, cost + weight, n, e);
        }

        Route toRoute() {
            return new Route(Collections.unmodifiableList(nodes), Collections.unmodifiableList(edges), cost);
        }

        @Override
        public int compareTo(Label o) {
            int c = compareCost(cost, o.cost);
            if (c != 0)
                return c;
            c = Integer.compare(edges.size(), o.edges.size());
            if (c != 0)
                return c;
            return compareSequence(nodes, o.nodes);
        }
    }
}
