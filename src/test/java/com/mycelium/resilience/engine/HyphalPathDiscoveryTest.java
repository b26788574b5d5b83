package com.mycelium.resilience.engine;

import com.mycelium.resilience.api.EdgeKey;
import com.mycelium.resilience.api.Health;
import com.mycelium.resilience.model.GraphModel;
import com.mycelium.resilience.model.UnknownNodeException;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class HyphalPathDiscoveryTest {

    private GraphModel graph;
    private HyphalPathDiscovery discovery;

    // A - B - D  (1 + 1)
    // A - C - D  (1 + 2)
    // A ----- D  (5)
    @Before
    public void setUp() {
        graph = new GraphModel(false);
        for (String id : List.of("A", "B", "C", "D", "E"))
            graph.addNode(id, 0, 100, null);
        graph.addEdge("A", "B", 1.0, 10);
        graph.addEdge("B", "D", 1.0, 10);
        graph.addEdge("A", "C", 1.0, 10);
        graph.addEdge("C", "D", 2.0, 10);
        graph.addEdge("A", "D", 5.0, 10);
        discovery = new HyphalPathDiscovery(graph, new EngineConfig());
    }

    @Test
    public void testPenaltyProducesDiverseRankedPaths() {
        List<HyphalPath> paths = discovery.discover("A", "D", 3);

        assertEquals(3, paths.size());
        assertEquals(List.of("A", "B", "D"), paths.get(0).nodes());
        assertEquals(List.of("A", "C", "D"), paths.get(1).nodes());
        assertEquals(List.of("A", "D"), paths.get(2).nodes());
        assertEquals(2.0, paths.get(0).cost(), 1e-9);
        assertEquals(3.0, paths.get(1).cost(), 1e-9);
        assertEquals(5.0, paths.get(2).cost(), 1e-9);
        assertEquals("primary", paths.get(0).label());
        assertEquals("alternative_1", paths.get(1).label());
        assertEquals("alternative_2", paths.get(2).label());
    }

    @Test
    public void testResultsAreSortedByCost() {
        List<HyphalPath> paths = discovery.discover("D", "A", 5);
        assertFalse(paths.isEmpty());
        for (int i = 1; i < paths.size(); i++)
            assertTrue(paths.get(i - 1).cost() <= paths.get(i).cost() + 1e-9);
        assertEquals("D", paths.get(0).source());
        assertEquals("A", paths.get(0).target());
    }

    @Test
    public void testFewerPathsThanRequestedWhenTopologyRunsOut() {
        assertEquals(3, discovery.discover("A", "D", 5).size());
    }

    @Test
    public void testUnboundedKReturnsEveryDistinctPath() {
        List<HyphalPath> paths = discovery.discover("A", "D", Integer.MAX_VALUE);
        assertEquals(3, paths.size());
        assertEquals(List.of("A", "B", "D"), paths.get(0).nodes());
        assertEquals(List.of("A", "D"), paths.get(2).nodes());
    }

    @Test
    public void testAttemptLimitDoesNotOverflowOnChain() {
        GraphModel chain = new GraphModel(false);
        for (String id : List.of("A", "B", "C"))
            chain.addNode(id, 0, 10, null);
        chain.addEdge("A", "B", 1.0, 1);
        chain.addEdge("B", "C", 1.0, 1);
        EngineConfig config = new EngineConfig();
        config.setMaxDiscoveryAttemptsFactor(2);
        HyphalPathDiscovery d = new HyphalPathDiscovery(chain, config);

        List<HyphalPath> paths = d.discover("A", "C", 1_500_000_000);
        assertEquals(1, paths.size());
        assertEquals(List.of("A", "B", "C"), paths.get(0).nodes());
        assertEquals(1, d.discover("A", "C", Integer.MAX_VALUE).size());
    }

    @Test
    public void testDamagedElementsAreNeverUsed() {
        graph.setNodeHealth("B", Health.DAMAGED);
        graph.setEdgeHealth(graph.key("A", "D"), Health.DAMAGED);

        List<HyphalPath> paths = discovery.discover("A", "D", 3);
        assertEquals(1, paths.size());
        assertEquals(List.of("A", "C", "D"), paths.get(0).nodes());
        for (HyphalPath p : paths) {
            assertFalse(p.nodes().contains("B"));
            for (EdgeKey key : p.edges())
                assertTrue(graph.edge(key).isHealthy());
        }
    }

    @Test
    public void testDisconnectedNodesYieldEmptyResult() {
        assertTrue(discovery.discover("A", "E", 2).isEmpty());
    }

    @Test
    public void testDamagedEndpointYieldsEmptyResult() {
        graph.setNodeHealth("D", Health.DAMAGED);
        assertTrue(discovery.discover("A", "D", 1).isEmpty());
    }

    @Test
    public void testSourceEqualsTargetIsZeroLengthPath() {
        List<HyphalPath> paths = discovery.discover("C", "C", 4);
        assertEquals(1, paths.size());
        assertTrue(paths.get(0).isZeroLength());
        assertEquals(List.of("C"), paths.get(0).nodes());
        assertEquals(0.0, paths.get(0).cost(), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonPositiveKRejected() {
        discovery.discover("A", "D", 0);
    }

    @Test(expected = UnknownNodeException.class)
    public void testUnknownNodeRejected() {
        discovery.discover("A", "Z", 1);
    }

    @Test
    public void testEqualCostTiesBreakLexicographically() {
        GraphModel g = new GraphModel(false);
        for (String id : List.of("S", "X", "Y", "T"))
            g.addNode(id, 0, 10, null);
        g.addEdge("S", "Y", 1.0, 1);
        g.addEdge("Y", "T", 1.0, 1);
        g.addEdge("S", "X", 1.0, 1);
        g.addEdge("X", "T", 1.0, 1);
        HyphalPathDiscovery d = new HyphalPathDiscovery(g, new EngineConfig());

        assertEquals(List.of("S", "X", "T"), d.discover("S", "T", 1).get(0).nodes());
        List<HyphalPath> both = d.discover("S", "T", 2);
        assertEquals(List.of("S", "Y", "T"), both.get(1).nodes());
    }

    @Test
    public void testDiscoveryLeavesEdgeStateUntouched() {
        discovery.discover("A", "D", 3);
        assertEquals(0, graph.edge("A", "B").usageCount());
        assertEquals(1.0, graph.edge("A", "B").reinforcement(), 0.0);
    }

    @Test
    public void testRecordSelectionCountsEveryEdgeOfEveryPath() {
        List<HyphalPath> paths = discovery.discover("A", "D", 2);
        discovery.recordSelection(paths);
        assertEquals(1, graph.edge("A", "B").usageCount());
        assertEquals(1, graph.edge("C", "D").usageCount());
        assertEquals(0, graph.edge("A", "D").usageCount());
    }

    @Test
    public void testShortestCostHonoursReinforcement() {
        graph.setReinforcement(graph.key("A", "D"), 0.25);
        List<HyphalPath> paths = discovery.discover("A", "D", 1);
        assertEquals(List.of("A", "D"), paths.get(0).nodes());
        assertEquals(1.25, paths.get(0).cost(), 1e-9);
    }
}
