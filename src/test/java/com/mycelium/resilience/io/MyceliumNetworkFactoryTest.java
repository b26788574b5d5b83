package com.mycelium.resilience.io;

import com.mycelium.resilience.api.NodeRole;
import com.mycelium.resilience.model.GraphModel;
import com.mycelium.resilience.model.MycelialEdge;
import com.mycelium.resilience.model.MycelialNode;
import org.junit.Test;

import static org.junit.Assert.*;

public class MyceliumNetworkFactoryTest {

    @Test
    public void testSameSeedSameNetwork() {
        GraphDefinition a = MyceliumNetworkFactory.generate(30, 0.3, 7L);
        GraphDefinition b = MyceliumNetworkFactory.generate(30, 0.3, 7L);
        assertEquals(a, b);
    }

    @Test
    public void testRolesAndRanges() {
        GraphModel model = new GraphCompiler().compile(MyceliumNetworkFactory.generate(20, 0.5, 11L)).model();
        assertEquals(20, model.nodeCount());
        assertEquals(NodeRole.SOURCE, model.node("node_0").role());
        assertEquals(NodeRole.SOURCE, model.node("node_2").role());
        assertEquals(NodeRole.INTERMEDIATE, model.node("node_3").role());
        assertEquals(NodeRole.INTERMEDIATE, model.node("node_16").role());
        assertEquals(NodeRole.SINK, model.node("node_17").role());
        assertEquals(NodeRole.SINK, model.node("node_19").role());

        for (MycelialNode n : model.nodes()) {
            assertTrue(n.resourceLevel() >= 50 && n.resourceLevel() <= 150);
            assertEquals(Math.rint(n.resourceLevel()), n.resourceLevel(), 0.0);
        }
        for (MycelialEdge e : model.edges()) {
            assertTrue(e.baseCost() >= 0.5 && e.baseCost() < 1.5);
            assertTrue(e.capacity() >= 5 && e.capacity() <= 15);
        }
    }

    @Test
    public void testZeroProbabilityHasNoEdges() {
        assertTrue(MyceliumNetworkFactory.generate(10, 0.0, 1L).getGraph().getEdges().isEmpty());
    }

    @Test
    public void testFullProbabilityConnectsNeighbors() {
        GraphModel model = new GraphCompiler().compile(MyceliumNetworkFactory.generate(8, 1.0, 3L)).model();
        // Pair (i, j) connects with probability 1 - |i - j| / n
        assertTrue(model.edgeCount() > 0);
        assertTrue(model.edgeCount() <= 8 * 7 / 2);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testProbabilityOutOfRange() {
        MyceliumNetworkFactory.generate(5, 1.5, 1L);
    }
}
