package com.synthetic.solvency.domain.model;

/**
 * Collateral health of a position. A position without debt has no meaningful
 * ratio and is {@link Unbounded}; it is never compared against numeric
 * thresholds as if it were a percentage.
 */
public sealed interface Health permits Health.Ratio, Health.Unbounded {

    long UNBOUNDED_WIRE_VALUE = 999_999L;

    Health UNBOUNDED = new Unbounded();

    static Health ratio(long percent) {
        return new Ratio(percent);
    }

    boolean isBelow(long thresholdPercent);

    boolean isAtLeast(long thresholdPercent);

    boolean isUnbounded();

    /**
     * Value for external surfaces (JSON, journal). Unbounded renders as 999999.
     */
    long wireValue();

    record Ratio(long percent) implements Health {

        public Ratio {
            if (percent < 0) {
                throw new IllegalArgumentException("percent must not be negative");
            }
        }

        @Override
        public boolean isBelow(long thresholdPercent) {
            return percent < thresholdPercent;
        }

        @Override
        public boolean isAtLeast(long thresholdPercent) {
            return percent >= thresholdPercent;
        }

        @Override
        public boolean isUnbounded() {
            return false;
        }

        @Override
        public long wireValue() {
            return percent;
        }
    }

    record Unbounded() implements Health {

        @Override
        public boolean isBelow(long thresholdPercent) {
            return false;
        }

        @Override
        public boolean isAtLeast(long thresholdPercent) {
            return true;
        }

        @Override
        public boolean isUnbounded() {
            return true;
        }

        @Override
        public long wireValue() {
            return UNBOUNDED_WIRE_VALUE;
        }
    }
}
