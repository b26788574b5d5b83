package com.mycelium.resilience.engine;

import com.mycelium.resilience.api.EdgeKey;
import com.mycelium.resilience.api.Health;
import com.mycelium.resilience.api.ResilienceListener;
import com.mycelium.resilience.model.GraphModel;
import com.mycelium.resilience.model.MycelialEdge;
import com.mycelium.resilience.model.MycelialNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import lombok.extern.log4j.Log4j2;

/**
 * Damage and repair: marks failed nodes, measures the fragmentation it causes
 * and restores connectivity with the fewest structural changes.
 *
 * Procedure for one invocation:
 * 1. Validate every identifier (nothing is mutated if one is unknown).
 * 2. Snapshot the healthy components, and preview the components the damage
 * will leave behind. For every pre-damage component that splits, find the
 * closest pair of nodes between each two of its fragments on the pre-damage
 * graph (the prior distance).
 * 3. Mark the nodes and their incident edges damaged, optionally sharing each
 * node's resources among its healthy neighbors.
 * 4. Visit the fragment pairs by ascending prior distance. If a single-path
 * discovery between the representative nodes succeeds, the fragments are
 * already joined (directly or through a previously grown edge). Otherwise grow
 * an edge between them priced at prior distance + growth penalty, while the
 * growth budget lasts.
 * 5. Recompute components for the report.
 *
 * A fragment pair stands for every node pair across the two fragments, so
 * reconnected/unreconnected counts are node-pair counts. Repeating an
 * invocation with the same damage set finds no newly damaged nodes, no split
 * components, and grows nothing.
 */
@Log4j2
public final class SelfHealingController {
    private final GraphModel graph;
    private final EngineConfig config;
    private final HyphalPathDiscovery discovery;
    private ResilienceListener listener;

    public SelfHealingController(GraphModel graph, EngineConfig config, HyphalPathDiscovery discovery) {
        this.graph = graph;
        this.config = config;
        this.discovery = discovery;
    }

    public void setListener(ResilienceListener listener) {
        this.listener = listener;
    }

    /**
     * Applies damage to the given nodes and repairs the resulting fragmentation.
     *
     * @throws com.mycelium.resilience.model.UnknownNodeException if any
     *                                                            identifier is
     *                                                            unknown; the
     *                                                            graph is left
     *                                                            untouched.
     */
    public RepairReport apply(Collection<String> nodeIds) {
        long start = System.nanoTime();

        for (String id : nodeIds)
            graph.node(id);
        Set<String> fresh = new TreeSet<>();
        for (String id : nodeIds)
            if (graph.node(id).isHealthy())
                fresh.add(id);

        ConnectedComponents before = ConnectedComponents.of(graph);
        ConnectedComponents preview = ConnectedComponents.of(graph, fresh);
        List<Candidate> candidates = fresh.isEmpty() ? new ArrayList<>() : candidates(before, preview);

        int edgesDamaged = 0;
        double redistributed = 0.0;
        for (String id : fresh) {
            int marked = markDamaged(id);
            edgesDamaged += marked;
            if (config.isRedistributeOnDamage())
                redistributed += redistribute(id, fresh);
            log.info("Node {} damaged ({} incident edges)", id, marked);
            if (listener != null)
                listener.onNodeDamaged(id, marked);
        }
        ConnectedComponents afterDamage = ConnectedComponents.of(graph);

        candidates.sort(Comparator.comparingDouble((Candidate c) -> c.priorDistance)
                .thenComparing(c -> c.u)
                .thenComparing(c -> c.v));

        List<EdgeKey> grown = new ArrayList<>();
        boolean exhausted = false;
        for (Candidate c : candidates) {
            HyphalPath path = discovery.probe(c.u, c.v);
            if (path != null) {
                log.debug("Fragments of {} and {} still joined via {}", c.u, c.v, path.nodes());
                continue;
            }
            if (grown.size() >= config.getGrowthBudget()) {
                exhausted = true;
                continue;
            }
            grown.add(grow(c));
        }

        ConnectedComponents afterRepair = ConnectedComponents.of(graph);
        long reconnected = 0;
        long unreconnected = 0;
        for (Candidate c : candidates) {
            if (afterRepair.sameComponent(c.u, c.v))
                reconnected += c.pairs;
            else
                unreconnected += c.pairs;
        }

        double total = graph.nodeCount();
        RepairReport report = new RepairReport(
                new ArrayList<>(fresh),
                edgesDamaged,
                grown,
                reconnected,
                unreconnected,
                before.count(),
                afterDamage.count(),
                afterRepair.count(),
                total == 0 ? 0.0 : afterDamage.largestSize() / total,
                total == 0 ? 0.0 : afterRepair.largestSize() / total,
                exhausted,
                redistributed,
                System.nanoTime() - start);

        if (exhausted)
            log.warn("Growth budget {} exhausted: {} node pairs left disconnected",
                    config.getGrowthBudget(), unreconnected);
        log.info("Repair complete: damaged={} grown={} components {} -> {} -> {}",
                fresh, grown, report.componentsBeforeDamage(), report.componentsAfterDamage(),
                report.componentsAfterRepair());
        if (listener != null)
            listener.onRepairEnd(report);
        return report;
    }

    /**
     * For every pre-damage component that the damage splits, one candidate per
     * pair of surviving fragments: the closest node pair between them.
     */
    private List<Candidate> candidates(ConnectedComponents before, ConnectedComponents preview) {
        Map<Integer, List<Integer>> fragmentsByOrigin = new HashMap<>();
        for (int f = 0; f < preview.count(); f++) {
            String any = preview.members(f).get(0);
            fragmentsByOrigin.computeIfAbsent(before.componentOf(any), x -> new ArrayList<>()).add(f);
        }

        List<Candidate> out = new ArrayList<>();
        for (List<Integer> fragments : fragmentsByOrigin.values()) {
            if (fragments.size() < 2)
                continue;
            List<Map<String, PathSearch.Route>> reach = new ArrayList<>(fragments.size());
            for (int f : fragments)
                reach.add(PathSearch.shortestFrom(graph, preview.members(f), MycelialEdge::effectiveCost));

            for (int i = 0; i < fragments.size(); i++) {
                for (int j = i + 1; j < fragments.size(); j++) {
                    List<String> a = preview.members(fragments.get(i));
                    List<String> b = preview.members(fragments.get(j));
                    Candidate c = closest(reach.get(i), b);
                    Candidate reverse = closest(reach.get(j), a);
                    if (c == null || (reverse != null && PathSearch.compareCost(reverse.priorDistance, c.priorDistance) < 0))
                        c = reverse;
                    if (c == null)
                        c = new Candidate(a.get(0), b.get(0), 0.0);
                    c.pairs = (long) a.size() * b.size();
                    out.add(c);
                }
            }
        }
        return out;
    }

    private static Candidate closest(Map<String, PathSearch.Route> reach, List<String> targets) {
        Candidate best = null;
        for (String t : targets) {
            PathSearch.Route r = reach.get(t);
            if (r == null)
                continue;
            if (best == null || PathSearch.compareCost(r.cost(), best.priorDistance) < 0
                    || (PathSearch.compareCost(r.cost(), best.priorDistance) == 0
                            && (r.origin() + "\0" + t).compareTo(best.u + "\0" + best.v) < 0))
                best = new Candidate(r.origin(), t, r.cost());
        }
        return best;
    }

    private int markDamaged(String id) {
        int marked = 0;
        for (MycelialEdge edge : graph.incidentEdges(id)) {
            if (edge.isHealthy()) {
                graph.setEdgeHealth(edge.key(), Health.DAMAGED);
                marked++;
            }
        }
        graph.setNodeHealth(id, Health.DAMAGED);
        return marked;
    }

    /** Shares a damaged node's stock equally among its healthy neighbors; neighbors absorb up to their capacity. */
    private double redistribute(String id, Set<String> damaging) {
        MycelialNode node = graph.node(id);
        Set<String> neighbors = new TreeSet<>();
        for (MycelialEdge edge : graph.incidentEdges(id)) {
            String other = edge.key().other(id);
            if (!damaging.contains(other) && graph.node(other).isHealthy())
                neighbors.add(other);
        }
        if (neighbors.isEmpty() || node.resourceLevel() <= 0)
            return 0.0;

        double share = node.resourceLevel() / neighbors.size();
        double moved = 0.0;
        for (String n : neighbors)
            moved += graph.adjustResourceLevel(n, share);
        graph.setResourceLevel(id, 0.0);
        return moved;
    }

    private EdgeKey grow(Candidate c) {
        double cost = c.priorDistance + config.getGrowthCostPenalty();
        if (!(cost > 0))
            cost = config.getGrowthCostPenalty() > 0 ? config.getGrowthCostPenalty() : 1.0;

        EdgeKey key = graph.key(c.u, c.v);
        if (graph.containsEdge(c.u, c.v)) {
            // Regrow a damaged connection instead of duplicating it.
            graph.setEdgeHealth(key, Health.HEALTHY);
            log.info("Regrew edge {} (base cost {})", key, graph.edge(key).baseCost());
            if (listener != null)
                listener.onEdgeGrown(key, graph.edge(key).baseCost());
            return key;
        }
        graph.growEdge(c.u, c.v, cost, config.getGrownEdgeCapacity());
        log.info("Grew edge {} (base cost {}, prior distance {})", key, cost, c.priorDistance);
        if (listener != null)
            listener.onEdgeGrown(key, cost);
        return key;
    }

    private static final class Candidate {
        final String u;
        final String v;
        final double priorDistance;
        long pairs;

        Candidate(String u, String v, double priorDistance) {
            this.u = u;
            this.v = v;
            this.priorDistance = priorDistance;
        }
    }
}
