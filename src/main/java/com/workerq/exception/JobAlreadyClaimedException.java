package com.workerq.exception;

/**
 * The row exists but no longer matches the pending predicate, usually because another
 * worker claimed it between peek and claim.
 */
public class JobAlreadyClaimedException extends WorkerQException {

    private final long jobId;

    public JobAlreadyClaimedException(long jobId) {
        super("Worker job " + jobId + " is no longer pending");
        this.jobId = jobId;
    }

    public long getJobId() {
        return jobId;
    }
}
