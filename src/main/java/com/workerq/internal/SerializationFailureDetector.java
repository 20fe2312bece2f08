package com.workerq.internal;

import java.sql.SQLException;
import java.util.IdentityHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Decides whether a failure is a serialization conflict or deadlock that is worth retrying
 * in a fresh transaction. Checks the whole cause chain since JPA and Spring wrap the driver
 * exception several times.
 */
public final class SerializationFailureDetector {

    static final Set<String> RETRYABLE_SQL_STATES = Set.of("40001", "40P01");

    private static final Set<String> RETRYABLE_MESSAGE_FRAGMENTS = Set.of(
            "could not serialize",
            "deadlock detected",
            "transaction is aborted");

    private SerializationFailureDetector() {
    }

    public static boolean isRetryable(Throwable failure) {
        Map<Throwable, Boolean> seen = new IdentityHashMap<>();
        Throwable current = failure;
        while (current != null && seen.put(current, Boolean.TRUE) == null) {
            if (current instanceof SQLException sqlException && isRetryableSqlState(sqlException)) {
                return true;
            }
            if (hasRetryableMessage(current.getMessage())) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static boolean isRetryableSqlState(SQLException exception) {
        SQLException current = exception;
        while (current != null) {
            if (current.getSQLState() != null && RETRYABLE_SQL_STATES.contains(current.getSQLState())) {
                return true;
            }
            SQLException next = current.getNextException();
            current = next == current ? null : next;
        }
        return false;
    }

    private static boolean hasRetryableMessage(String message) {
        if (message == null) {
            return false;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        for (String fragment : RETRYABLE_MESSAGE_FRAGMENTS) {
            if (normalized.contains(fragment)) {
                return true;
            }
        }
        return false;
    }
}
