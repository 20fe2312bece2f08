package com.workerq.exception;

public class JobNotFoundException extends WorkerQException {

    private final long jobId;

    public JobNotFoundException(long jobId) {
        super("Worker job " + jobId + " does not exist");
        this.jobId = jobId;
    }

    public long getJobId() {
        return jobId;
    }
}
