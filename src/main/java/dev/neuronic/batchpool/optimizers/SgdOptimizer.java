package dev.neuronic.batchpool.optimizers;

import dev.neuronic.batchpool.math.GradientMath;

/**
 * Stochastic gradient descent over one flat parameter vector.
 *
 * <p>Updates parameters using: param = param - learning_rate * gradient
 *
 * <p>The pool calls {@link #apply} once per round on the coordinating thread, so the update
 * never races with the workers reading the parameters.
 */
public class SgdOptimizer implements OptimizerStep {

    private final float[] parameters;
    private long steps;

    /**
     * @param parameters the model parameters, updated in place
     */
    public SgdOptimizer(float[] parameters) {
        if (parameters == null || parameters.length == 0)
            throw new IllegalArgumentException("Parameters must not be empty");
        this.parameters = parameters;
    }

    @Override
    public void apply(float[] reducedGradient, float learningRate) {
        if (reducedGradient.length != parameters.length)
            throw new IllegalArgumentException(String.format(
                "Gradient length %d does not match %d parameters", reducedGradient.length, parameters.length));
        if (learningRate <= 0)
            throw new IllegalArgumentException("Learning rate must be positive: " + learningRate);

        GradientMath.parameterUpdate(parameters, reducedGradient, learningRate);
        steps++;
    }

    public float[] getParameters() {
        return parameters;
    }

    /**
     * @return number of updates applied so far
     */
    public long getSteps() {
        return steps;
    }
}
