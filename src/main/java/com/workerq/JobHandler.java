package com.workerq;

import com.fasterxml.jackson.databind.JsonNode;
import com.workerq.annotation.WorkerJobType;
import org.springframework.core.ResolvableType;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.util.ClassUtils;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Executes jobs of one type. Implementations must be Spring beans to be picked up by the
 * worker's handler registry.
 *
 * @param <T> the type of the payload expected by this handler
 */
public interface JobHandler<T> {

    Map<Class<?>, Class<?>> PAYLOAD_CLASS_CACHE = new ConcurrentHashMap<>();

    /**
     * Returns the job type this handler executes. By default, this is taken from the
     * {@link WorkerJobType} annotation.
     */
    default String getJobType() {
        Class<?> targetClass = ClassUtils.getUserClass(this);
        WorkerJobType annotation = AnnotationUtils.findAnnotation(targetClass, WorkerJobType.class);
        if (annotation == null || annotation.value().isBlank()) {
            throw new IllegalStateException("JobHandler " + targetClass.getName()
                    + " must either be annotated with @WorkerJobType or override getJobType()");
        }
        return annotation.value().trim();
    }

    /**
     * Runs a single job. The returned object is stored as the job result (converted to JSON);
     * {@code null} stores an empty object. Any exception fails the job with its message as
     * {@code result.error}.
     */
    Object run(JobContext<T> context) throws Exception;

    /**
     * The class the stored {@code data} is converted to. By default, this is inferred from
     * {@code JobHandler<T>}.
     */
    @SuppressWarnings("unchecked")
    default Class<T> getPayloadClass() {
        Class<?> targetClass = ClassUtils.getUserClass(this);
        Class<?> payloadClass = PAYLOAD_CLASS_CACHE.computeIfAbsent(targetClass, JobHandler::inferPayloadClass);
        return (Class<T>) payloadClass;
    }

    private static Class<?> inferPayloadClass(Class<?> targetClass) {
        Class<?> resolved = ResolvableType.forClass(targetClass)
                .as(JobHandler.class)
                .getGeneric(0)
                .resolve();
        // raw handlers get the untouched JSON tree
        return resolved != null ? resolved : JsonNode.class;
    }
}
