package com.mycelium.resilience.engine;

import com.mycelium.resilience.api.EdgeKey;
import com.mycelium.resilience.api.Health;
import com.mycelium.resilience.model.GraphModel;
import com.mycelium.resilience.model.UnknownNodeException;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class SelfHealingControllerTest {

    private GraphModel chain;
    private EngineConfig config;

    // A - B - C - D, unit costs
    @Before
    public void setUp() {
        chain = new GraphModel(false);
        for (String id : List.of("A", "B", "C", "D"))
            chain.addNode(id, 100, 1000, null);
        chain.addEdge("A", "B", 1.0, 10);
        chain.addEdge("B", "C", 1.0, 10);
        chain.addEdge("C", "D", 1.0, 10);
        config = new EngineConfig();
        config.setGrowthBudget(1);
    }

    private SelfHealingController controller(GraphModel graph) {
        return new SelfHealingController(graph, config, new HyphalPathDiscovery(graph, config));
    }

    @Test
    public void testChainRepairGrowsEdgeToClosestFragmentNode() {
        RepairReport report = controller(chain).apply(List.of("B"));

        assertEquals(List.of("B"), report.damagedNodes());
        assertEquals(2, report.edgesDamaged());
        assertEquals(List.of(new EdgeKey("A", "C")), report.grownEdges());
        assertEquals(1, report.componentsBeforeDamage());
        assertEquals(2, report.componentsAfterDamage());
        assertEquals(1, report.componentsAfterRepair());
        assertEquals(2, report.reconnectedPairs());
        assertEquals(0, report.unreconnectedPairs());
        assertFalse(report.budgetExhausted());
        assertTrue(report.fullyReconnected());

        assertTrue(chain.edge("A", "C").isGrown());
        assertEquals(3.0, chain.edge("A", "C").baseCost(), 1e-9);
        assertEquals(config.getGrownEdgeCapacity(), chain.edge("A", "C").capacity(), 0.0);
        assertEquals(Health.DAMAGED, chain.node("B").health());
        assertEquals(Health.DAMAGED, chain.edge("A", "B").health());
    }

    @Test
    public void testDamagedResourcesAreSharedWithHealthyNeighbors() {
        RepairReport report = controller(chain).apply(List.of("B"));

        assertEquals(100.0, report.redistributedResources(), 1e-9);
        assertEquals(0.0, chain.node("B").resourceLevel(), 0.0);
        assertEquals(150.0, chain.node("A").resourceLevel(), 1e-9);
        assertEquals(150.0, chain.node("C").resourceLevel(), 1e-9);
    }

    @Test
    public void testRedistributionCanBeDisabled() {
        config.setRedistributeOnDamage(false);
        RepairReport report = controller(chain).apply(List.of("B"));
        assertEquals(0.0, report.redistributedResources(), 0.0);
        assertEquals(100.0, chain.node("B").resourceLevel(), 0.0);
    }

    @Test
    public void testRepeatingTheSameDamageGrowsNothing() {
        SelfHealingController controller = controller(chain);
        controller.apply(List.of("B"));
        int edges = chain.edgeCount();

        RepairReport second = controller.apply(List.of("B"));
        assertTrue(second.grownEdges().isEmpty());
        assertTrue(second.damagedNodes().isEmpty());
        assertEquals(0, second.edgesDamaged());
        assertEquals(edges, chain.edgeCount());
        assertEquals(1, second.componentsAfterRepair());
    }

    @Test
    public void testRepairNeverShrinksTheLargestComponent() {
        RepairReport report = controller(chain).apply(List.of("B"));
        assertEquals(0.5, report.largestRatioAfterDamage(), 1e-9);
        assertEquals(0.75, report.largestRatioAfterRepair(), 1e-9);
        assertTrue(report.largestRatioAfterRepair() >= report.largestRatioAfterDamage());
    }

    @Test
    public void testUnknownNodeRejectsWholeRequest() {
        try {
            controller(chain).apply(List.of("B", "Z"));
            fail("Expected UnknownNodeException");
        } catch (UnknownNodeException e) {
            assertEquals("Z", e.nodeId());
        }
        assertTrue(chain.node("B").isHealthy());
        assertTrue(chain.edge("A", "B").isHealthy());
        assertEquals(3, chain.edgeCount());
    }

    @Test
    public void testExhaustedBudgetIsReportedNotThrown() {
        GraphModel star = star();
        RepairReport report = controller(star).apply(List.of("H"));

        assertEquals(1, report.grownEdges().size());
        assertEquals(new EdgeKey("L1", "L2"), report.grownEdges().get(0));
        assertTrue(report.budgetExhausted());
        assertEquals(1, report.reconnectedPairs());
        assertEquals(2, report.unreconnectedPairs());
        assertEquals(2, report.componentsAfterRepair());
    }

    @Test
    public void testLaterPairsReuseEarlierGrowth() {
        config.setGrowthBudget(2);
        GraphModel star = star();
        RepairReport report = controller(star).apply(List.of("H"));

        assertEquals(List.of(new EdgeKey("L1", "L2"), new EdgeKey("L1", "L3")), report.grownEdges());
        assertFalse(report.budgetExhausted());
        assertEquals(3, report.reconnectedPairs());
        assertEquals(1, report.componentsAfterRepair());
    }

    @Test
    public void testZeroBudgetLeavesFragmentsApart() {
        config.setGrowthBudget(0);
        RepairReport report = controller(chain).apply(List.of("B"));
        assertTrue(report.grownEdges().isEmpty());
        assertTrue(report.budgetExhausted());
        assertEquals(2, report.unreconnectedPairs());
        assertEquals(2, report.componentsAfterRepair());
    }

    @Test
    public void testDamagedEdgeBetweenFragmentsIsRegrown() {
        chain.addEdge("A", "C", 4.0, 2);
        chain.setEdgeHealth(chain.key("A", "C"), Health.DAMAGED);

        RepairReport report = controller(chain).apply(List.of("B"));
        assertEquals(List.of(new EdgeKey("A", "C")), report.grownEdges());
        assertEquals(4, chain.edgeCount());
        assertTrue(chain.edge("A", "C").isHealthy());
        assertEquals(4.0, chain.edge("A", "C").baseCost(), 0.0);
        assertEquals(1, report.componentsAfterRepair());
    }

    @Test
    public void testSurvivingAlternativeNeedsNoGrowth() {
        chain.addEdge("A", "D", 10.0, 1);
        RepairReport report = controller(chain).apply(List.of("B"));
        assertTrue(report.grownEdges().isEmpty());
        assertEquals(1, report.componentsAfterDamage());
        assertEquals(0, report.unreconnectedPairs());
    }

    @Test
    public void testListenerReceivesDamageGrowthAndReport() {
        SelfHealingController controller = controller(chain);
        RecordingListener listener = new RecordingListener();
        controller.setListener(listener);

        RepairReport report = controller.apply(List.of("B"));
        assertEquals(List.of("B"), listener.damaged);
        assertEquals(List.of(new EdgeKey("A", "C")), listener.grown);
        assertSame(report, listener.repairs.get(0));
    }

    private static GraphModel star() {
        GraphModel star = new GraphModel(false);
        for (String id : List.of("H", "L1", "L2", "L3"))
            star.addNode(id, 0, 100, null);
        star.addEdge("H", "L1", 1.0, 10);
        star.addEdge("H", "L2", 1.0, 10);
        star.addEdge("H", "L3", 1.0, 10);
        return star;
    }
}
