package com.workerq.exception;

/**
 * Every attempt of a serializable transaction hit a conflict. Callers may treat this as
 * transient and try again later.
 */
public class TransactionSerializationException extends WorkerQException {

    private final int attempts;

    public TransactionSerializationException(int attempts, Throwable lastFailure) {
        super("Serializable transaction failed after " + attempts + " attempts: " + lastFailure.getMessage(),
                lastFailure);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
