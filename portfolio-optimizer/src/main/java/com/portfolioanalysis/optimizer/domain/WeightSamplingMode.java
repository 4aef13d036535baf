package com.portfolioanalysis.optimizer.domain;

import org.apache.commons.math3.random.RandomGenerator;

/**
 * How random weight vectors are drawn from the simplex.
 */
public enum WeightSamplingMode {

    /**
     * Independent uniforms divided by their sum.
     * Not uniform over the simplex: vectors near the centroid are over-represented.
     */
    UNIFORM_NORMALIZED {
        @Override
        double draw(RandomGenerator random) {
            return random.nextDouble();
        }
    },

    /**
     * Independent unit exponentials divided by their sum, i.e. Dirichlet(1, ..., 1),
     * which is uniform over the simplex.
     */
    DIRICHLET {
        @Override
        double draw(RandomGenerator random) {
            return -Math.log(1.0 - random.nextDouble());
        }
    };

    abstract double draw(RandomGenerator random);

    /**
     * Draw one weight vector of the given dimension.
     */
    public Weights sample(RandomGenerator random, int assets) {
        double[] raw = new double[assets];
        for (int i = 0; i < assets; i++) {
            raw[i] = draw(random);
        }
        return Weights.normalize(raw);
    }
}
