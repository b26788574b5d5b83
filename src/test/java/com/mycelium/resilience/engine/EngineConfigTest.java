package com.mycelium.resilience.engine;

import org.junit.Test;

import static org.junit.Assert.*;

public class EngineConfigTest {

    @Test
    public void testDefaultsAreValid() {
        EngineConfig config = new EngineConfig();
        assertSame(config, config.validate());
        assertFalse(config.isDirected());
        assertEquals(2.0, config.getDiversityPenalty(), 0.0);
        assertEquals(5, config.getGrowthBudget());
    }

    @Test
    public void testPenaltyMustExceedOne() {
        EngineConfig config = new EngineConfig();
        config.setDiversityPenalty(1.0);
        try {
            config.validate();
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("diversityPenalty"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroFloorRejected() {
        EngineConfig config = new EngineConfig();
        config.setReinforcementFloor(0.0);
        config.validate();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMirrorBufferMustBePowerOfTwo() {
        EngineConfig config = new EngineConfig();
        config.setMirrorBufferSize(1000);
        config.validate();
    }
}
