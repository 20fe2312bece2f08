package com.workerq.exception;

/**
 * Wraps whatever a handler threw. The message is the handler's own message so that it can
 * be stored unchanged in the job result.
 */
public class JobHandlerException extends JobExecutionException {

    private final String jobType;

    public JobHandlerException(String jobType, Throwable cause) {
        super(describe(cause), cause);
        this.jobType = jobType;
    }

    public String getJobType() {
        return jobType;
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getName() : message;
    }
}
