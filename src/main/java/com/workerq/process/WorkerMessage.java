package com.workerq.process;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Supervision message sent from a worker process to the manager, one JSON object per line.
 * Only liveness and error signals travel this way; job state lives in the database.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "type", "pid", "error" })
public record WorkerMessage(Type type, long pid, String error) {

    public enum Type {
        @JsonProperty("worker-started")
        WORKER_STARTED,
        @JsonProperty("worker-shutdown")
        WORKER_SHUTDOWN,
        @JsonProperty("worker-error")
        WORKER_ERROR,
        @JsonProperty("heartbeat")
        HEARTBEAT
    }

    public WorkerMessage {
        if (type == null) {
            throw new IllegalArgumentException("Worker message type must not be null");
        }
    }

    public static WorkerMessage started(long pid) {
        return new WorkerMessage(Type.WORKER_STARTED, pid, null);
    }

    public static WorkerMessage shutdown(long pid) {
        return new WorkerMessage(Type.WORKER_SHUTDOWN, pid, null);
    }

    public static WorkerMessage error(long pid, String error) {
        return new WorkerMessage(Type.WORKER_ERROR, pid, error);
    }

    public static WorkerMessage heartbeat(long pid) {
        return new WorkerMessage(Type.HEARTBEAT, pid, null);
    }
}
