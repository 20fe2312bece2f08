package com.workerq.process;

import com.workerq.config.WorkerQProperties;
import com.workerq.internal.WorkerLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationContext;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Worker-process side of supervision. Once the application context is up it reports
 * {@code worker-started}, starts heartbeats and runs the {@link WorkerLoop} on its own thread.
 * If anything ends the loop other than a stop request (a persistence failure, an out-of-memory
 * error) the process reports {@code worker-error} and exits with status 1 so the manager
 * restarts it.
 */
@Component
@ConditionalOnProperty(prefix = "workerq", name = "role", havingValue = WorkerQProperties.ROLE_WORKER)
public class WorkerProcessRunner implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(WorkerProcessRunner.class);

    static final int FAILURE_EXIT_CODE = 1;

    @FunctionalInterface
    public interface ExitHandler {
        void exit(int status);
    }

    private final WorkerLoop loop;
    private final WorkerMessageChannel channel;
    private final WorkerQProperties.Worker settings;
    private final ExitHandler exitHandler;
    private final long pid = ProcessHandle.current().pid();
    private ScheduledExecutorService heartbeats;
    private volatile Thread loopThread;
    private volatile boolean running = false;

    @Autowired
    public WorkerProcessRunner(WorkerLoop loop, WorkerMessageChannel channel, WorkerQProperties properties,
            ApplicationContext applicationContext) {
        this(loop, channel, properties,
                status -> System.exit(SpringApplication.exit(applicationContext, () -> status)));
    }

    WorkerProcessRunner(WorkerLoop loop, WorkerMessageChannel channel, WorkerQProperties properties,
            ExitHandler exitHandler) {
        this.loop = loop;
        this.channel = channel;
        this.settings = properties.getWorker();
        this.exitHandler = exitHandler;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        channel.send(WorkerMessage.started(pid));

        Duration heartbeatInterval = settings.getHeartbeatInterval();
        heartbeats = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "workerq-heartbeat");
            thread.setDaemon(true);
            return thread;
        });
        heartbeats.scheduleAtFixedRate(this::sendHeartbeat, heartbeatInterval.toMillis(),
                heartbeatInterval.toMillis(), TimeUnit.MILLISECONDS);

        Thread thread = new Thread(this::runLoop, "workerq-worker-" + settings.getId());
        loopThread = thread;
        running = true;
        thread.start();
        log.info("Worker {} started (pid {})", settings.getId(), pid);
    }

    /**
     * Lets the current job finish, bounded by the shutdown grace period.
     */
    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        channel.send(WorkerMessage.shutdown(pid));
        loop.stop();

        Thread thread = loopThread;
        if (thread != null && thread != Thread.currentThread()) {
            try {
                thread.join(settings.getShutdownGracePeriod().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (thread.isAlive()) {
                log.warn("Worker {} did not finish its current job within {} ms, interrupting it", settings.getId(),
                        settings.getShutdownGracePeriod().toMillis());
                thread.interrupt();
            }
        }
        if (heartbeats != null) {
            heartbeats.shutdownNow();
        }
        log.info("Worker {} stopped", settings.getId());
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return settings.isAutoStart();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    private void runLoop() {
        try {
            loop.run();
        } catch (Throwable e) {
            log.error("Worker {} stopped on an unrecoverable error", settings.getId(), e);
            channel.send(WorkerMessage.error(pid, describe(e)));
            exitHandler.exit(FAILURE_EXIT_CODE);
        }
    }

    private void sendHeartbeat() {
        try {
            channel.send(WorkerMessage.heartbeat(pid));
        } catch (RuntimeException e) {
            log.warn("Failed to send heartbeat: {}", e.getMessage());
        }
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getName() : message;
    }
}
