package com.workerq.exception;

public class UnknownJobTypeException extends JobExecutionException {

    private final String jobType;

    public UnknownJobTypeException(String jobType) {
        super("Unknown job type: " + jobType);
        this.jobType = jobType;
    }

    public String getJobType() {
        return jobType;
    }
}
