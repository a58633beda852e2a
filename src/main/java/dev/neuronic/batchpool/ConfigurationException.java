package dev.neuronic.batchpool;

/**
 * The requested configuration cannot be run. Raised before any thread is started.
 */
public class ConfigurationException extends TrainingException {

    public ConfigurationException(String message) {
        super(message);
    }
}
