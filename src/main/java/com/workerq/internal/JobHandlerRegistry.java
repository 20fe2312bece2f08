package com.workerq.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.workerq.JobContext;
import com.workerq.JobHandler;
import com.workerq.WorkerJob;
import com.workerq.exception.JobHandlerException;
import com.workerq.exception.UnknownJobTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps job type names to handler beans. Built once from the application context and
 * read-only afterwards.
 */
@Component
public class JobHandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(JobHandlerRegistry.class);

    static final String JOB_LOGGER_PREFIX = "com.workerq.job.";

    private final Map<String, JobHandler<?>> handlers;
    private final ObjectMapper objectMapper;

    public JobHandlerRegistry(List<JobHandler<?>> handlers,
            ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        Map<String, JobHandler<?>> byType = new LinkedHashMap<>();
        for (JobHandler<?> handler : handlers) {
            String type = handler.getJobType();
            if (type == null || type.isBlank()) {
                throw new IllegalStateException("JobHandler " + ClassUtils.getUserClass(handler).getName()
                        + " returned a blank job type");
            }
            JobHandler<?> existing = byType.putIfAbsent(type.trim(), handler);
            if (existing != null) {
                throw new IllegalStateException("Job type '" + type + "' is handled by both "
                        + ClassUtils.getUserClass(existing).getName() + " and "
                        + ClassUtils.getUserClass(handler).getName());
            }
        }
        this.handlers = Map.copyOf(byType);
        log.info("Registered {} job handler(s): {}", this.handlers.size(), byType.keySet());
    }

    public Optional<JobHandler<?>> find(String type) {
        return Optional.ofNullable(type == null ? null : handlers.get(type));
    }

    public Set<String> registeredTypes() {
        return handlers.keySet();
    }

    /**
     * Runs the handler registered for the job's type and returns its result as JSON.
     *
     * @throws UnknownJobTypeException when no handler is registered for the type
     * @throws JobHandlerException     when the payload cannot be read or the handler throws
     */
    public JsonNode execute(WorkerJob job) {
        JobHandler<?> handler = handlers.get(job.getType());
        if (handler == null) {
            throw new UnknownJobTypeException(job.getType());
        }
        return invoke(handler, job);
    }

    private <T> JsonNode invoke(JobHandler<T> handler, WorkerJob job) {
        Logger jobLog = LoggerFactory.getLogger(JOB_LOGGER_PREFIX + job.getType());
        Object result;
        try {
            T payload = readPayload(handler.getPayloadClass(), job.getData());
            result = handler.run(new JobContext<>(job, payload, jobLog));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobHandlerException(job.getType(), e);
        } catch (Exception e) {
            throw new JobHandlerException(job.getType(), e);
        } catch (VirtualMachineError e) {
            if (!(e instanceof StackOverflowError)) {
                throw e;
            }
            throw new JobHandlerException(job.getType(), e);
        } catch (Error e) {
            throw new JobHandlerException(job.getType(), e);
        }
        return toResult(job.getType(), result);
    }

    private <T> T readPayload(Class<T> payloadClass, JsonNode data) throws Exception {
        JsonNode source = data != null ? data : objectMapper.createObjectNode();
        if (payloadClass.isInstance(source)) {
            return payloadClass.cast(source);
        }
        return objectMapper.treeToValue(source, payloadClass);
    }

    private JsonNode toResult(String type, Object result) {
        if (result == null) {
            return objectMapper.createObjectNode();
        }
        if (result instanceof JsonNode node) {
            return node;
        }
        try {
            return objectMapper.valueToTree(result);
        } catch (IllegalArgumentException e) {
            throw new JobHandlerException(type, e);
        }
    }
}
