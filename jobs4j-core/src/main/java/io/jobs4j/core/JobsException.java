package io.jobs4j.core;

/**
 * Base type of the errors raised by the jobs runtime.
 */
public class JobsException extends RuntimeException {

    public JobsException(String message) {
        super(message);
    }

    public JobsException(String message, Throwable cause) {
        super(message, cause);
    }
}
