package com.workerq.process;

/**
 * Outbound side of the supervision channel, used by a worker process.
 */
public interface WorkerMessageChannel {

    void send(WorkerMessage message);
}
