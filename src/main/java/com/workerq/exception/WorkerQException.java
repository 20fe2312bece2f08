package com.workerq.exception;

/**
 * Root of the unchecked exceptions raised by the scheduler, the store and the worker loop.
 * Persistence failures are not wrapped; they surface as Spring's {@code DataAccessException}.
 */
public class WorkerQException extends RuntimeException {

    public WorkerQException(String message) {
        super(message);
    }

    public WorkerQException(String message, Throwable cause) {
        super(message, cause);
    }
}
