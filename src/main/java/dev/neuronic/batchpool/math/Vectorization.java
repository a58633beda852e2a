package dev.neuronic.batchpool.math;

import jdk.incubator.vector.FloatVector;
import jdk.incubator.vector.VectorSpecies;

import java.util.logging.Logger;

/**
 * Central configuration for vector/SIMD support.
 * Checks availability once at startup and provides shared configuration.
 */
public final class Vectorization {

    private static final Logger LOG = Logger.getLogger(Vectorization.class.getName());

    private static final VectorSpecies<Float> SPECIES;
    private static final boolean AVAILABLE;
    private static final int VECTOR_LENGTH;

    static {
        boolean available = false;
        VectorSpecies<Float> species = null;

        try {
            Class.forName("jdk.incubator.vector.FloatVector");
            species = FloatVector.SPECIES_PREFERRED;
            available = true;
        } catch (ClassNotFoundException | NoClassDefFoundError e) {
            LOG.fine("Vector API not resolvable: " + e);
        }

        AVAILABLE = available;
        SPECIES = species;
        VECTOR_LENGTH = available ? species.length() : 1;

        if (available) {
            LOG.fine("Vector API enabled with " + VECTOR_LENGTH + " lanes");
        } else {
            LOG.fine("Vector API not available, using scalar operations");
        }
    }

    /**
     * @return true if Vector API is available on this platform
     */
    public static boolean isAvailable() {
        return AVAILABLE;
    }

    /**
     * @return the preferred vector species for float operations, or null if unavailable
     */
    public static VectorSpecies<Float> getSpecies() {
        return SPECIES;
    }

    /**
     * @return number of float lanes in the vector, or 1 if using scalar operations
     */
    public static int getVectorLength() {
        return VECTOR_LENGTH;
    }

    /**
     * @return the loop bound for vectorized operations (aligned to vector length)
     */
    public static int loopBound(int length) {
        return AVAILABLE && SPECIES != null ? SPECIES.loopBound(length) : 0;
    }

    /**
     * Check if the given length is worth vectorizing.
     * Small arrays may be faster with scalar operations due to overhead.
     */
    public static boolean shouldVectorize(int length) {
        return AVAILABLE && length >= VECTOR_LENGTH * 2;
    }

    /**
     * Load the SIMD implementation of an op by class name, or null when the
     * Vector API is missing or the class cannot be instantiated.
     */
    public static <T> T loadVectorImpl(String className, Class<T> type) {
        if (!AVAILABLE)
            return null;
        try {
            Class<?> vectorClass = Class.forName(className);
            return type.cast(vectorClass.getDeclaredConstructor().newInstance());
        } catch (ReflectiveOperationException | LinkageError e) {
            LOG.fine("Falling back to scalar for " + className + ": " + e);
            return null;
        }
    }

    private Vectorization() {} // Prevent instantiation
}
