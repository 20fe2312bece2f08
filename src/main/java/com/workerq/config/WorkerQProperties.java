package com.workerq.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "workerq")
public class WorkerQProperties {

    public static final String ROLE_SERVER = "server";
    public static final String ROLE_WORKER = "worker";
    public static final String ROLE_CLIENT = "client";

    /**
     * {@code server} supervises worker processes, {@code worker} runs the worker loop,
     * {@code client} only schedules jobs.
     */
    private String role = ROLE_SERVER;

    private final Database database = new Database();
    private final Worker worker = new Worker();
    private final Processes processes = new Processes();
    private final Transaction transaction = new Transaction();
    private final Cleanup cleanup = new Cleanup();

    public String getRole() {
        return role;
    }

    public void setRole(String role) {
        this.role = role;
    }

    public boolean isWorkerRole() {
        return ROLE_WORKER.equalsIgnoreCase(role);
    }

    public Database getDatabase() {
        return database;
    }

    public Worker getWorker() {
        return worker;
    }

    public Processes getProcesses() {
        return processes;
    }

    public Transaction getTransaction() {
        return transaction;
    }

    public Cleanup getCleanup() {
        return cleanup;
    }

    public static class Database {
        private boolean skipCreate = false;
        private boolean failOnMigrationError = true;

        public boolean isSkipCreate() {
            return skipCreate;
        }

        public void setSkipCreate(boolean skipCreate) {
            this.skipCreate = skipCreate;
        }

        public boolean isFailOnMigrationError() {
            return failOnMigrationError;
        }

        public void setFailOnMigrationError(boolean failOnMigrationError) {
            this.failOnMigrationError = failOnMigrationError;
        }
    }

    public static class Worker {
        private int id = 0;
        private boolean autoStart = true;
        private Duration pollInterval = Duration.ofSeconds(1);
        private Duration staleClaimThreshold = Duration.ofHours(1);
        private Duration heartbeatInterval = Duration.ofSeconds(5);
        private Duration shutdownGracePeriod = Duration.ofSeconds(10);

        public int getId() {
            return id;
        }

        public void setId(int id) {
            this.id = id;
        }

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getStaleClaimThreshold() {
            return staleClaimThreshold;
        }

        public void setStaleClaimThreshold(Duration staleClaimThreshold) {
            this.staleClaimThreshold = staleClaimThreshold;
        }

        public Duration getHeartbeatInterval() {
            return heartbeatInterval;
        }

        public void setHeartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
        }

        public Duration getShutdownGracePeriod() {
            return shutdownGracePeriod;
        }

        public void setShutdownGracePeriod(Duration shutdownGracePeriod) {
            this.shutdownGracePeriod = shutdownGracePeriod;
        }
    }

    public static class Processes {
        /**
         * Number of worker processes, or {@code cpus} for one per available processor.
         */
        private String count = "cpus";
        private Duration startupTimeout = Duration.ofSeconds(10);
        private Duration restartInitialBackoff = Duration.ofSeconds(1);
        private Duration restartMaxBackoff = Duration.ofSeconds(5);
        private Duration heartbeatTimeout = Duration.ofSeconds(60);
        private Duration shutdownTimeout = Duration.ofSeconds(15);
        private String mainClass = "com.workerq.server.WorkerQApplication";
        private List<String> jvmArgs = new ArrayList<>();

        public String getCount() {
            return count;
        }

        public void setCount(String count) {
            this.count = count;
        }

        /**
         * Resolves {@link #getCount()} to a positive number of processes.
         */
        public int resolveCount() {
            String value = count == null ? "" : count.trim();
            if (value.isEmpty() || "cpus".equalsIgnoreCase(value)) {
                return Math.max(1, Runtime.getRuntime().availableProcessors());
            }
            int parsed;
            try {
                parsed = Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        "workerq.processes.count must be a positive number or 'cpus' but was '" + count + "'", e);
            }
            if (parsed < 1) {
                throw new IllegalArgumentException("workerq.processes.count must be >= 1 but was " + parsed);
            }
            return parsed;
        }

        public Duration getStartupTimeout() {
            return startupTimeout;
        }

        public void setStartupTimeout(Duration startupTimeout) {
            this.startupTimeout = startupTimeout;
        }

        public Duration getRestartInitialBackoff() {
            return restartInitialBackoff;
        }

        public void setRestartInitialBackoff(Duration restartInitialBackoff) {
            this.restartInitialBackoff = restartInitialBackoff;
        }

        public Duration getRestartMaxBackoff() {
            return restartMaxBackoff;
        }

        public void setRestartMaxBackoff(Duration restartMaxBackoff) {
            this.restartMaxBackoff = restartMaxBackoff;
        }

        public Duration getHeartbeatTimeout() {
            return heartbeatTimeout;
        }

        public void setHeartbeatTimeout(Duration heartbeatTimeout) {
            this.heartbeatTimeout = heartbeatTimeout;
        }

        /**
         * How long a terminated worker may take to exit before it is killed.
         */
        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }

        public String getMainClass() {
            return mainClass;
        }

        public void setMainClass(String mainClass) {
            this.mainClass = mainClass;
        }

        public List<String> getJvmArgs() {
            return jvmArgs;
        }

        public void setJvmArgs(List<String> jvmArgs) {
            this.jvmArgs = jvmArgs;
        }
    }

    public static class Transaction {
        private int maxAttempts = 7;
        private Duration initialRetryDelay = Duration.ofMillis(50);
        private double jitterFactor = 0.5;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialRetryDelay() {
            return initialRetryDelay;
        }

        public void setInitialRetryDelay(Duration initialRetryDelay) {
            this.initialRetryDelay = initialRetryDelay;
        }

        public double getJitterFactor() {
            return jitterFactor;
        }

        public void setJitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
        }
    }

    public static class Cleanup {
        private boolean enabled = true;
        private String cron = "0 * * * * *";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getCron() {
            return cron;
        }

        public void setCron(String cron) {
            this.cron = cron;
        }
    }
}
