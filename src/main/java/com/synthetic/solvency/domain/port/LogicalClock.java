package com.synthetic.solvency.domain.port;

/**
 * Monotonic, non-decreasing block counter.
 */
public interface LogicalClock {

    long currentBlock();
}
