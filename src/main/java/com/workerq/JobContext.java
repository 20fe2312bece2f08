package com.workerq;

import org.slf4j.Logger;

/**
 * Everything a handler gets for one execution: the claimed row, its payload converted to the
 * handler's payload type, and a logger named after the job type. Shared resources such as
 * repositories or HTTP clients are injected into the handler bean itself.
 *
 * @param <T> payload type
 */
public record JobContext<T>(WorkerJob job, T payload, Logger log) {

    public long jobId() {
        return job.getId();
    }

    public String jobType() {
        return job.getType();
    }

    public int ownerId() {
        return job.getOwnerId();
    }
}
