package com.workerq.process;

import com.workerq.config.WorkerQProperties;
import com.workerq.internal.Backoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Keeps a fixed pool of worker processes alive. A worker that exits unexpectedly, never reports
 * {@code worker-started}, or stops sending heartbeats is restarted under the same id with
 * exponential backoff.
 * <p>
 * All supervision state is touched only from the single supervisor thread.
 */
@Component
@ConditionalOnProperty(prefix = "workerq", name = "role", havingValue = WorkerQProperties.ROLE_SERVER,
        matchIfMissing = true)
public class WorkerProcessManager implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(WorkerProcessManager.class);

    private final WorkerProcessLauncher launcher;
    private final WorkerQProperties.Processes settings;
    private final Map<Integer, ManagedWorker> workers = Collections.synchronizedMap(new LinkedHashMap<>());
    private ScheduledExecutorService supervisor;
    private volatile boolean running = false;
    private volatile boolean stopping = false;

    public WorkerProcessManager(WorkerProcessLauncher launcher, WorkerQProperties properties) {
        this.launcher = launcher;
        this.settings = properties.getProcesses();
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        int count = settings.resolveCount();
        stopping = false;
        supervisor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "workerq-supervisor");
            thread.setDaemon(true);
            return thread;
        });
        for (int id = 1; id <= count; id++) {
            ManagedWorker worker = new ManagedWorker(id);
            workers.put(id, worker);
            supervisor.execute(() -> spawn(worker));
        }
        long checkMillis = Math.max(100L, settings.getHeartbeatTimeout().toMillis() / 4);
        supervisor.scheduleWithFixedDelay(this::checkHeartbeats, checkMillis, checkMillis, TimeUnit.MILLISECONDS);
        running = true;
        log.info("Started {} worker process(es)", count);
    }

    /**
     * Terminates every worker, waits up to the shutdown timeout for them to exit and kills the
     * ones that are still alive.
     */
    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        stopping = true;
        log.info("Shutting down {} worker process(es)", workers.size());

        List<ManagedWorker> snapshot;
        synchronized (workers) {
            snapshot = new ArrayList<>(workers.values());
        }
        List<CompletableFuture<Integer>> exits = new ArrayList<>();
        for (ManagedWorker worker : snapshot) {
            worker.cancelTimers();
            WorkerProcessLauncher.WorkerProcess process = worker.process;
            if (process != null && process.isAlive()) {
                process.terminate();
                exits.add(process.onExit());
            }
        }

        awaitExits(exits, settings.getShutdownTimeout());
        for (ManagedWorker worker : snapshot) {
            WorkerProcessLauncher.WorkerProcess process = worker.process;
            if (process != null && process.isAlive()) {
                log.warn("Worker {} (pid {}) did not exit within {} ms, killing it", worker.id, process.pid(),
                        settings.getShutdownTimeout().toMillis());
                process.kill();
            }
        }

        supervisor.shutdownNow();
        workers.clear();
        running = false;
        log.info("All worker processes shut down");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    public int getWorkerCount() {
        return workers.size();
    }

    /**
     * Ids of workers that have reported {@code worker-started} and are still alive.
     */
    public List<Integer> getStartedWorkerIds() {
        List<Integer> ids = new ArrayList<>();
        synchronized (workers) {
            for (ManagedWorker worker : workers.values()) {
                WorkerProcessLauncher.WorkerProcess process = worker.process;
                if (worker.started && process != null && process.isAlive()) {
                    ids.add(worker.id);
                }
            }
        }
        return ids;
    }

    /**
     * Holds the manager's monitor while launching, so {@link #stop()} either runs first and the
     * launch is skipped, or waits and finds the new process in its terminate pass.
     */
    private synchronized void spawn(ManagedWorker worker) {
        if (stopping) {
            return;
        }
        int generation = ++worker.generation;
        worker.started = false;
        WorkerProcessLauncher.WorkerProcess process;
        try {
            process = launcher.launch(worker.id,
                    message -> submit(() -> onMessage(worker, generation, message)));
        } catch (IOException | RuntimeException e) {
            log.error("Failed to spawn worker {}", worker.id, e);
            scheduleRestart(worker);
            return;
        }
        worker.process = process;
        worker.startupTimeout = supervisor.schedule(() -> checkStartup(worker, generation),
                settings.getStartupTimeout().toMillis(), TimeUnit.MILLISECONDS);
        process.onExit().whenComplete((code, error) -> submit(() -> onExit(worker, generation, code)));
        log.debug("Worker {} spawned as pid {}", worker.id, process.pid());
    }

    private void onMessage(ManagedWorker worker, int generation, WorkerMessage message) {
        if (generation != worker.generation) {
            return;
        }
        switch (message.type()) {
            case WORKER_STARTED -> {
                worker.started = true;
                worker.consecutiveFailures = 0;
                worker.lastHeartbeatNanos = System.nanoTime();
                if (worker.startupTimeout != null) {
                    worker.startupTimeout.cancel(false);
                }
                log.info("Worker {} started (pid {})", worker.id, message.pid());
            }
            case WORKER_SHUTDOWN -> log.info("Worker {} shutting down (pid {})", worker.id, message.pid());
            case WORKER_ERROR -> log.error("Worker {} reported an error (pid {}): {}", worker.id, message.pid(),
                    message.error());
            case HEARTBEAT -> {
                worker.lastHeartbeatNanos = System.nanoTime();
                log.trace("Worker {} heartbeat", worker.id);
            }
        }
    }

    private void onExit(ManagedWorker worker, int generation, Integer exitCode) {
        if (generation != worker.generation) {
            return;
        }
        worker.cancelTimers();
        worker.started = false;
        if (stopping) {
            log.debug("Worker {} exited with code {}", worker.id, exitCode);
            return;
        }
        log.warn("Worker {} exited unexpectedly with code {}", worker.id, exitCode);
        scheduleRestart(worker);
    }

    private void checkStartup(ManagedWorker worker, int generation) {
        WorkerProcessLauncher.WorkerProcess process = worker.process;
        if (generation != worker.generation || worker.started || process == null || !process.isAlive()) {
            return;
        }
        log.warn("Worker {} (pid {}) did not report startup within {} ms, killing it", worker.id, process.pid(),
                settings.getStartupTimeout().toMillis());
        process.kill();
    }

    private void checkHeartbeats() {
        long timeoutNanos = settings.getHeartbeatTimeout().toNanos();
        long now = System.nanoTime();
        List<ManagedWorker> snapshot;
        synchronized (workers) {
            snapshot = new ArrayList<>(workers.values());
        }
        for (ManagedWorker worker : snapshot) {
            WorkerProcessLauncher.WorkerProcess process = worker.process;
            if (!worker.started || process == null || !process.isAlive()) {
                continue;
            }
            if (now - worker.lastHeartbeatNanos > timeoutNanos) {
                log.warn("Worker {} (pid {}) sent no heartbeat for {} ms, killing it", worker.id, process.pid(),
                        settings.getHeartbeatTimeout().toMillis());
                worker.started = false;
                process.kill();
            }
        }
    }

    private void scheduleRestart(ManagedWorker worker) {
        if (stopping) {
            return;
        }
        Duration delay = Backoff.exponential(settings.getRestartInitialBackoff(), worker.consecutiveFailures,
                settings.getRestartMaxBackoff());
        worker.consecutiveFailures++;
        log.info("Restarting worker {} in {} ms", worker.id, delay.toMillis());
        worker.restart = supervisor.schedule(() -> spawn(worker), delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void submit(Runnable task) {
        ScheduledExecutorService executor = supervisor;
        if (executor != null && !executor.isShutdown()) {
            executor.execute(task);
        }
    }

    private static void awaitExits(List<CompletableFuture<Integer>> exits, Duration timeout) {
        if (exits.isEmpty()) {
            return;
        }
        try {
            CompletableFuture.allOf(exits.toArray(CompletableFuture[]::new))
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.debug("Not all workers exited within {} ms", timeout.toMillis());
        } catch (ExecutionException e) {
            log.debug("Waiting for worker exit failed: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class ManagedWorker {
        private final int id;
        private volatile WorkerProcessLauncher.WorkerProcess process;
        private volatile boolean started;
        private volatile long lastHeartbeatNanos;
        private int generation;
        private int consecutiveFailures;
        private volatile ScheduledFuture<?> startupTimeout;
        private volatile ScheduledFuture<?> restart;

        private ManagedWorker(int id) {
            this.id = id;
        }

        private void cancelTimers() {
            if (startupTimeout != null) {
                startupTimeout.cancel(false);
            }
            if (restart != null) {
                restart.cancel(false);
            }
        }
    }
}
