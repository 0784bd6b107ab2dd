package com.viewquality.pmos.fusion;

/**
 * Maps a raw objective metric value onto the opinion-compatible input of the fusion formula.
 */
public enum LinkFunction {

    /** {@code Q = 1 / (1 + exp(−ε · (metric − ζ)))}. */
    LOGISTIC {
        @Override
        public double apply(double metric, double epsilon, double zeta) {
            return 1.0 / (1.0 + Math.exp(-epsilon * (metric - zeta)));
        }
    },

    /** {@code Q = metric}. VMAF is already on an opinion-like scale. */
    IDENTITY {
        @Override
        public double apply(double metric, double epsilon, double zeta) {
            return metric;
        }
    };

    public abstract double apply(double metric, double epsilon, double zeta);
}
