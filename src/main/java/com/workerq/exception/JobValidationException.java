package com.workerq.exception;

/**
 * Malformed scheduling input. Always raised before anything is written.
 */
public class JobValidationException extends WorkerQException {

    public JobValidationException(String message) {
        super(message);
    }

    public JobValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
