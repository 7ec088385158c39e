package io.jobs4j.core;

/**
 * Invalid queue or job declarations. Raised before any collaborator is touched;
 * the process must not start serving.
 */
public class JobsConfigurationException extends JobsException {

    public JobsConfigurationException(String message) {
        super(message);
    }

    public JobsConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
