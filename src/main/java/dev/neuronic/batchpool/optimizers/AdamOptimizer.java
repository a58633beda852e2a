package dev.neuronic.batchpool.optimizers;

/**
 * Adam (Adaptive Moment Estimation) over one flat parameter vector.
 *
 * <p><b>Adam Algorithm:</b>
 * <pre>
 * m_t = β₁ * m_{t-1} + (1 - β₁) * gradient    // Momentum (moving average of gradients)
 * v_t = β₂ * v_{t-1} + (1 - β₂) * gradient²   // Velocity (moving average of squared gradients)
 * m̂_t = m_t / (1 - β₁^t)                      // Bias correction for momentum
 * v̂_t = v_t / (1 - β₂^t)                      // Bias correction for velocity
 * param = param - α * m̂_t / (√v̂_t + ε)        // Parameter update
 * </pre>
 *
 * <p>Moment state is sized to the parameters at construction. Rounds in which every worker
 * contribution was rejected never reach the optimizer, so the time step counts applied
 * updates only.
 */
public class AdamOptimizer implements OptimizerStep {

    private final float[] parameters;
    private final float beta1;
    private final float beta2;
    private final float epsilon;
    private final float[] momentum;
    private final float[] velocity;
    private long timeStep;

    /**
     * Adam with β₁ = 0.9, β₂ = 0.999, ε = 1e-8.
     */
    public AdamOptimizer(float[] parameters) {
        this(parameters, 0.9f, 0.999f, 1e-8f);
    }

    /**
     * @param parameters the model parameters, updated in place
     * @param beta1 momentum decay rate (typically 0.9)
     * @param beta2 velocity decay rate (typically 0.999)
     * @param epsilon small constant to avoid division by zero (typically 1e-8)
     */
    public AdamOptimizer(float[] parameters, float beta1, float beta2, float epsilon) {
        if (parameters == null || parameters.length == 0)
            throw new IllegalArgumentException("Parameters must not be empty");
        if (beta1 < 0 || beta1 >= 1)
            throw new IllegalArgumentException("Beta1 must be in [0, 1): " + beta1);
        if (beta2 < 0 || beta2 >= 1)
            throw new IllegalArgumentException("Beta2 must be in [0, 1): " + beta2);
        if (epsilon <= 0)
            throw new IllegalArgumentException("Epsilon must be positive: " + epsilon);

        this.parameters = parameters;
        this.beta1 = beta1;
        this.beta2 = beta2;
        this.epsilon = epsilon;
        this.momentum = new float[parameters.length];
        this.velocity = new float[parameters.length];
    }

    @Override
    public void apply(float[] reducedGradient, float learningRate) {
        if (reducedGradient.length != parameters.length)
            throw new IllegalArgumentException(String.format(
                "Gradient length %d does not match %d parameters", reducedGradient.length, parameters.length));

        timeStep++;
        // Pre-compute bias correction factors
        float momentumCorrection = 1.0f - (float) Math.pow(beta1, timeStep);
        float velocityCorrection = 1.0f - (float) Math.pow(beta2, timeStep);

        for (int i = 0; i < parameters.length; i++) {
            float g = reducedGradient[i];
            momentum[i] = beta1 * momentum[i] + (1 - beta1) * g;
            velocity[i] = beta2 * velocity[i] + (1 - beta2) * g * g;

            float mHat = momentum[i] / momentumCorrection;
            float vHat = velocity[i] / velocityCorrection;
            parameters[i] -= learningRate * mHat / ((float) Math.sqrt(vHat) + epsilon);
        }
    }

    public float[] getParameters() {
        return parameters;
    }

    public long getTimeStep() {
        return timeStep;
    }
}
