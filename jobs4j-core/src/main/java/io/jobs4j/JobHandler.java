package io.jobs4j;


/**
 * Unit of work executed by the job processor.
 *
 * <p>Delivery is at-least-once, so {@link #execute(Object)} must tolerate being re-run for the
 * same logical execution after a retry or a stall redelivery.
 */
public interface JobHandler<T> {
    String name();

    Class<T> dataClass();

    void execute(T data) throws Exception;
}
