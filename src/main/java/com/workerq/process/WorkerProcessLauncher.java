package com.workerq.process;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Starts worker OS processes. Separated from {@link WorkerProcessManager} so supervision can be
 * exercised without spawning real JVMs.
 */
public interface WorkerProcessLauncher {

    /**
     * Starts worker {@code workerId}. Messages the child sends are passed to {@code listener}
     * on a reader thread.
     */
    WorkerProcess launch(int workerId, Consumer<WorkerMessage> listener) throws IOException;

    interface WorkerProcess {

        long pid();

        boolean isAlive();

        /**
         * Completes with the exit status once the process has ended.
         */
        CompletableFuture<Integer> onExit();

        /**
         * Asks the process to stop (SIGTERM on Unix).
         */
        void terminate();

        /**
         * Stops the process forcibly (SIGKILL on Unix).
         */
        void kill();
    }
}
