package com.mycelium.resilience.engine;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;

/**
 * Tunable constants of the resilience engine.
 *
 * None of the defaults are load-bearing: they are starting points that keep the
 * algorithms well behaved (penalties above 1, a strictly positive reinforcement
 * floor, finite budgets). Bound from the {@code config} block of a topology
 * definition or set programmatically; call {@link #validate()} before use.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EngineConfig {
    /** Edge direction semantics. Undirected by default. */
    private boolean directed = false;

    /** Cost multiplier applied to the edges of every accepted path during one discovery. */
    private double diversityPenalty = 2.0;

    /** Search attempts allowed per requested path before discovery gives up. */
    private int maxDiscoveryAttemptsFactor = 3;

    /** Reinforcement drop per unit of capacity-normalized flow in a round. */
    private double reinforcementRate = 0.1;

    /** Lowest reinforcement factor; keeps effective costs strictly positive. */
    private double reinforcementFloor = 0.25;

    /** Fraction of the gap to base cost recovered by an edge left unused for a whole distribution. */
    private double decayRate = 0.05;

    private int maxFlowRounds = 50;

    /** Maximum number of edges one repair invocation may grow. */
    private int growthBudget = 5;

    /** Added to the prior shortest distance to price a grown edge. */
    private double growthCostPenalty = 1.0;

    private double grownEdgeCapacity = 5.0;

    /** Share a damaged node's resources among its healthy neighbors. */
    private boolean redistributeOnDamage = true;

    /** Ring buffer size of the storage mirror. Must be a power of two. */
    private int mirrorBufferSize = 1024;

    /**
     * Checks every parameter.
     *
     * @return this, for chaining.
     * @throws IllegalArgumentException naming the first invalid parameter.
     */
    public EngineConfig validate() {
        if (!(diversityPenalty > 1.0) || Double.isInfinite(diversityPenalty))
            throw new IllegalArgumentException("diversityPenalty must be > 1: " + diversityPenalty);
        if (maxDiscoveryAttemptsFactor < 1)
            throw new IllegalArgumentException("maxDiscoveryAttemptsFactor must be >= 1: " + maxDiscoveryAttemptsFactor);
        if (!(reinforcementRate >= 0))
            throw new IllegalArgumentException("reinforcementRate must be >= 0: " + reinforcementRate);
        if (!(reinforcementFloor > 0) || reinforcementFloor > 1.0)
            throw new IllegalArgumentException("reinforcementFloor must be in (0, 1]: " + reinforcementFloor);
        if (!(decayRate >= 0) || decayRate > 1.0)
            throw new IllegalArgumentException("decayRate must be in [0, 1]: " + decayRate);
        if (maxFlowRounds < 1)
            throw new IllegalArgumentException("maxFlowRounds must be >= 1: " + maxFlowRounds);
        if (growthBudget < 0)
            throw new IllegalArgumentException("growthBudget must be >= 0: " + growthBudget);
        if (!(growthCostPenalty >= 0))
            throw new IllegalArgumentException("growthCostPenalty must be >= 0: " + growthCostPenalty);
        if (!(grownEdgeCapacity >= 0))
            throw new IllegalArgumentException("grownEdgeCapacity must be >= 0: " + grownEdgeCapacity);
        if (mirrorBufferSize < 1 || Integer.bitCount(mirrorBufferSize) != 1)
            throw new IllegalArgumentException("mirrorBufferSize must be a power of two: " + mirrorBufferSize);
        return this;
    }
}
