package com.mycelium.resilience;

import com.mycelium.resilience.engine.FlowReport;
import com.mycelium.resilience.engine.HyphalPath;
import com.mycelium.resilience.engine.MetricsSnapshot;
import com.mycelium.resilience.engine.RepairReport;
import com.mycelium.resilience.io.MyceliumNetworkFactory;
import com.mycelium.resilience.store.InMemoryGraphStore;
import com.mycelium.resilience.util.RepairLatencyListener;

import java.util.List;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * End-to-end walk through the engine on a generated network: path discovery,
 * nutrient flow, damage with repair, and the metrics before and after.
 *
 * Usage: {@code SelfHealingDemo [nodes] [connectionProbability] [seed]}
 */
@Log4j2
public class SelfHealingDemo {

    public static void main(String[] args) {
        int nodes = args.length > 0 ? Integer.parseInt(args[0]) : 20;
        double p = args.length > 1 ? Double.parseDouble(args[1]) : 0.3;
        long seed = args.length > 2 ? Long.parseLong(args[2]) : 42L;

        log.info("Starting self-healing demo: {} nodes, p={}, seed={}", nodes, p, seed);

        InMemoryGraphStore store = new InMemoryGraphStore();
        try (MyceliumGraph graph = MyceliumGraph.fromDefinition(MyceliumNetworkFactory.generate(nodes, p, seed))) {
            graph.attachStore(store);
            RepairLatencyListener latency = graph.enableRepairLatencyTracking();

            String source = MyceliumNetworkFactory.name(0);
            String sink = MyceliumNetworkFactory.name(nodes - 1);

            // 1. Redundant paths
            List<HyphalPath> paths = graph.discoverPaths(source, sink, 3);
            for (HyphalPath path : paths)
                log.info("{}: {} (cost {})", path.label(), path.nodes(), String.format("%.3f", path.cost()));

            // 2. Nutrient flow from the three sources to the three sinks
            FlowReport flow = graph.distributeFlow(
                    Map.of(MyceliumNetworkFactory.name(0), 20.0,
                            MyceliumNetworkFactory.name(1), 20.0,
                            MyceliumNetworkFactory.name(2), 20.0),
                    Map.of(MyceliumNetworkFactory.name(nodes - 3), 20.0,
                            MyceliumNetworkFactory.name(nodes - 2), 20.0,
                            MyceliumNetworkFactory.name(nodes - 1), 20.0));
            log.info("Flow delivered {} / {} in {} rounds", flow.delivered(), flow.totalDemand(), flow.rounds());

            // 3. Damage the busiest intermediate and watch the network heal
            MetricsSnapshot before = graph.metricsSnapshot();
            String hub = busiestIntermediate(graph, nodes);
            RepairReport report = graph.applyDamage(hub);
            MetricsSnapshot after = graph.metricsSnapshot();

            log.info("Damaged {}: grew {} edges, reconnected {} pairs, {} left",
                    report.damagedNodes(), report.grownEdges(), report.reconnectedPairs(),
                    report.unreconnectedPairs());
            log.info("Components {} -> {}, largest ratio {} -> {}",
                    before.componentCount(), after.componentCount(),
                    String.format("%.3f", before.largestComponentRatio()),
                    String.format("%.3f", after.largestComponentRatio()));

            log.info("\n{}", graph.explain().explainNode(hub));
            log.info("\n{}", latency.dump());
        }
        log.info("Store holds {} nodes and {} edges", store.nodeCount(), store.edgeCount());
    }

    private static String busiestIntermediate(MyceliumGraph graph, int nodes) {
        String best = MyceliumNetworkFactory.name(nodes / 2);
        int bestDegree = -1;
        for (int i = 3; i < nodes - 3; i++) {
            String id = MyceliumNetworkFactory.name(i);
            int degree = graph.model().degree(id);
            if (degree > bestDegree) {
                best = id;
                bestDegree = degree;
            }
        }
        return best;
    }
}
