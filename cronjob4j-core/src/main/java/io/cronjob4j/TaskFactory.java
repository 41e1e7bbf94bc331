package io.cronjob4j;

/**
 * Builds {@link Task} instances for one task type.
 *
 * <p>The job's JSON payload is converted into {@code payloadClass()} before {@link #create} is called.
 *
 * @param <P> payload type
 */
public interface TaskFactory<P> {

    String taskType();

    Class<P> payloadClass();

    Task create(P payload) throws Exception;
}
