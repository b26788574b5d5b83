package com.mycelium.resilience;

import com.mycelium.resilience.api.EdgeKey;
import com.mycelium.resilience.api.Health;
import com.mycelium.resilience.api.NodeRole;
import com.mycelium.resilience.engine.EngineConfig;
import com.mycelium.resilience.engine.FlowReport;
import com.mycelium.resilience.engine.HyphalPath;
import com.mycelium.resilience.engine.MetricsSnapshot;
import com.mycelium.resilience.engine.RepairReport;
import com.mycelium.resilience.io.GraphDefinitionLoader;
import com.mycelium.resilience.model.NotFoundException;
import com.mycelium.resilience.store.InMemoryGraphStore;
import com.mycelium.resilience.util.RepairLatencyListener;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class MyceliumGraphTest {

    private static MyceliumGraph chain() {
        return MyceliumGraph.fromDefinition(GraphDefinitionLoader.fromClasspath("chain.json"));
    }

    @Test
    public void testDisjointChainScenario() {
        try (MyceliumGraph graph = chain()) {
            RepairReport report = graph.applyDamage("B");
            assertEquals(List.of(new EdgeKey("A", "C")), report.grownEdges());

            MetricsSnapshot m = graph.metricsSnapshot();
            assertEquals(1, m.componentCount());
            assertEquals(0.75, m.largestComponentRatio(), 1e-9);
            assertEquals(report.elapsedNanos(), m.lastRepairElapsedNanos());
            assertEquals(4, m.edgeCount());
            assertEquals(2, m.healthyEdgeCount());

            RepairReport again = graph.applyDamage(List.of("B"));
            assertTrue(again.grownEdges().isEmpty());
            assertEquals(4, graph.metricsSnapshot().edgeCount());
        }
    }

    @Test
    public void testFlowSplitScenario() {
        MyceliumGraph graph = MyceliumGraph.fromDefinition(GraphDefinitionLoader.fromClasspath("flow_split.json"));
        FlowReport report = graph.distributeFlow(Map.of("S", 10.0), Map.of("T", 10.0));
        assertEquals(10.0, report.delivered(), 1e-9);
        assertEquals(5.0, report.flowOn(new EdgeKey("S", "T")), 1e-9);
        assertEquals(5.0, report.flowOn(new EdgeKey("S", "U")), 1e-9);
        assertEquals(5.0, report.flowOn(new EdgeKey("T", "U")), 1e-9);
    }

    @Test
    public void testDiscoverPathsCountsUsage() {
        MyceliumGraph graph = chain();
        List<HyphalPath> paths = graph.discoverPaths("A", "D", 2);
        assertEquals(1, paths.size());
        assertEquals(List.of("A", "B", "C", "D"), paths.get(0).nodes());
        assertEquals(1, graph.model().edge("B", "C").usageCount());
    }

    @Test
    public void testNoPathAcrossComponents() {
        MyceliumGraph graph = MyceliumGraph.builder("split")
                .node("A").node("B").node("C").node("D")
                .edge("A", "B", 1.0)
                .edge("C", "D", 1.0)
                .build();
        assertTrue(graph.discoverPaths("A", "D", 3).isEmpty());
        assertEquals(2, graph.metricsSnapshot().componentCount());
    }

    @Test
    public void testBuilderAndTopologyMutation() {
        EngineConfig config = new EngineConfig();
        config.setGrowthBudget(2);
        MyceliumGraph graph = MyceliumGraph.builder("built")
                .config(config)
                .node("S", 50, 100, NodeRole.SOURCE)
                .node("T", 0, 100, NodeRole.SINK)
                .edge("S", "T", 2.0, 3.0)
                .build();
        assertEquals("built", graph.name());
        assertEquals(2, graph.config().getGrowthBudget());

        graph.addNode("X", 0, 10, NodeRole.INTERMEDIATE);
        graph.addEdge("X", "T", 1.0, 1.0);
        assertEquals(2, graph.metricsSnapshot().edgeCount());
        graph.removeEdge("T", "X");
        graph.removeNode("X");
        assertEquals(2, graph.metricsSnapshot().nodeCount());

        try {
            graph.removeEdge("S", "X");
            fail("Expected NotFoundException");
        } catch (NotFoundException expected) {
            // ok
        }
    }

    @Test(expected = IllegalStateException.class)
    public void testBuilderCannotBeReused() {
        GraphBuilder builder = MyceliumGraph.builder("once").node("A");
        builder.build();
        builder.node("B");
    }

    @Test
    public void testDirectedBuilder() {
        MyceliumGraph graph = MyceliumGraph.builder("dir")
                .directed(true)
                .node("A").node("B")
                .edge("A", "B", 1.0)
                .build();
        assertTrue(graph.model().isDirected());
        assertEquals(1, graph.discoverPaths("A", "B", 1).size());
        assertTrue(graph.discoverPaths("B", "A", 1).isEmpty());
    }

    @Test
    public void testStoreMirrorsInitialStateAndRepairs() {
        InMemoryGraphStore store = new InMemoryGraphStore();
        MyceliumGraph graph = chain();
        graph.attachStore(store);
        graph.applyDamage("B");
        graph.close();

        assertEquals(4, store.nodeCount());
        assertEquals(4, store.edgeCount());
        assertEquals(Health.DAMAGED, store.node("B").health());
        assertEquals(Health.DAMAGED, store.edge(new EdgeKey("B", "C")).health());
        assertTrue(store.edge(new EdgeKey("A", "C")).grown());
    }

    @Test
    public void testListenersAndLatencyTracking() {
        MyceliumGraph graph = chain();
        RepairLatencyListener latency = graph.enableRepairLatencyTracking();
        graph.applyDamage("B");
        graph.distributeFlow(Map.of("A", 5.0), Map.of("D", 5.0));

        assertEquals(1, latency.totalRepairs());
        assertEquals(1, latency.damagedNodes());
        assertEquals(1, latency.grownEdges());
        assertEquals(1, latency.flowRuns());
        assertEquals(5.0, latency.totalDelivered(), 1e-9);
        assertTrue(graph.explain().dumpTopology().contains("A -- C"));
    }
}
