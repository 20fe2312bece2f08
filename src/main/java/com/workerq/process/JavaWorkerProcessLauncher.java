package com.workerq.process;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.workerq.config.WorkerQProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Launches workers as child JVMs running the same application with {@code workerq.role=worker}.
 * The child inherits the parent's environment and command-line arguments; its stdout carries
 * supervision messages and its stderr is passed through to the parent's.
 */
@Component
@ConditionalOnProperty(prefix = "workerq", name = "role", havingValue = WorkerQProperties.ROLE_SERVER,
        matchIfMissing = true)
public class JavaWorkerProcessLauncher implements WorkerProcessLauncher {

    private static final Logger log = LoggerFactory.getLogger(JavaWorkerProcessLauncher.class);

    public static final String WORKER_ID_ENV = "WORKER_ID";
    public static final String LOG_TARGET_ENV = "WORKERQ_LOG_TARGET";

    private final WorkerQProperties properties;
    private final ObjectMapper objectMapper;
    private final List<String> forwardedArgs;

    public JavaWorkerProcessLauncher(WorkerQProperties properties,
            ObjectMapper objectMapper,
            ObjectProvider<ApplicationArguments> applicationArguments) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        ApplicationArguments arguments = applicationArguments.getIfAvailable();
        this.forwardedArgs = arguments == null ? List.of() : forwardableArgs(arguments.getSourceArgs());
    }

    @Override
    public WorkerProcess launch(int workerId, Consumer<WorkerMessage> listener) throws IOException {
        List<String> command = buildCommand(workerId);
        ProcessBuilder builder = new ProcessBuilder(command);
        Map<String, String> environment = builder.environment();
        environment.put(WORKER_ID_ENV, Integer.toString(workerId));
        environment.put(LOG_TARGET_ENV, "System.err");
        builder.redirectError(ProcessBuilder.Redirect.INHERIT);
        builder.redirectInput(ProcessBuilder.Redirect.PIPE);

        Process process = builder.start();
        log.debug("Spawned worker {} as pid {}: {}", workerId, process.pid(), command);

        Thread reader = new Thread(() -> readMessages(workerId, process, listener),
                "workerq-worker-" + workerId + "-stdout");
        reader.setDaemon(true);
        reader.start();
        return new ChildProcess(process);
    }

    List<String> buildCommand(int workerId) {
        List<String> command = new ArrayList<>();
        command.add(javaExecutable());
        command.addAll(properties.getProcesses().getJvmArgs());

        String classPath = System.getProperty("java.class.path", "");
        if (isSingleJar(classPath)) {
            command.add("-jar");
            command.add(classPath);
        } else {
            command.add("-cp");
            command.add(classPath);
            command.add(properties.getProcesses().getMainClass());
        }

        command.addAll(forwardedArgs);
        command.add("--workerq.role=" + WorkerQProperties.ROLE_WORKER);
        command.add("--workerq.worker.id=" + workerId);
        command.add("--spring.main.banner-mode=off");
        return command;
    }

    private void readMessages(int workerId, Process process, Consumer<WorkerMessage> listener) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                WorkerMessage message = parse(trimmed);
                if (message == null) {
                    log.debug("worker {}: {}", workerId, line);
                    continue;
                }
                try {
                    listener.accept(message);
                } catch (RuntimeException e) {
                    log.error("Failed to handle {} from worker {}", message.type(), workerId, e);
                }
            }
        } catch (IOException e) {
            log.debug("Stopped reading output of worker {}: {}", workerId, e.getMessage());
        }
    }

    private WorkerMessage parse(String line) {
        if (!line.startsWith("{")) {
            return null;
        }
        try {
            return objectMapper.readValue(line, WorkerMessage.class);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static String javaExecutable() {
        return ProcessHandle.current().info().command()
                .orElseGet(() -> Path.of(System.getProperty("java.home"), "bin", "java").toString());
    }

    private static boolean isSingleJar(String classPath) {
        return !classPath.isEmpty() && !classPath.contains(File.pathSeparator) && classPath.endsWith(".jar");
    }

    static List<String> forwardableArgs(String[] sourceArgs) {
        List<String> forwarded = new ArrayList<>();
        for (String arg : sourceArgs) {
            if (arg.startsWith("--workerq.role") || arg.startsWith("--workerq.worker.id")) {
                continue;
            }
            forwarded.add(arg);
        }
        return forwarded;
    }

    private static final class ChildProcess implements WorkerProcess {

        private final Process process;
        private final CompletableFuture<Integer> exit;

        private ChildProcess(Process process) {
            this.process = process;
            this.exit = process.onExit().thenApply(Process::exitValue);
        }

        @Override
        public long pid() {
            return process.pid();
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        @Override
        public CompletableFuture<Integer> onExit() {
            return exit;
        }

        @Override
        public void terminate() {
            process.destroy();
        }

        @Override
        public void kill() {
            process.destroyForcibly();
        }
    }
}
