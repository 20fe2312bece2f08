package com.workerq.exception;

/**
 * A failure that belongs to a single job. The worker loop records its message as the
 * job's {@code result.error} and keeps running.
 */
public abstract class JobExecutionException extends WorkerQException {

    protected JobExecutionException(String message) {
        super(message);
    }

    protected JobExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
