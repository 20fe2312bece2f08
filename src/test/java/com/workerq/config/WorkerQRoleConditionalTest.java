package com.workerq.config;

import com.workerq.JobScheduler;
import com.workerq.WorkerJobStore;
import com.workerq.internal.JobHandlerRegistry;
import com.workerq.internal.SerializableTransactionRunner;
import com.workerq.internal.WorkerLoop;
import com.workerq.process.WorkerProcessLauncher;
import com.workerq.process.WorkerProcessManager;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class WorkerQRoleConditionalTest {

    @Configuration
    @EnableConfigurationProperties(WorkerQProperties.class)
    static class Config {
    }

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withPropertyValues("workerq.processes.count=1")
            .withUserConfiguration(Config.class, WorkerProcessManager.class, WorkerLoop.class)
            .withBean(WorkerProcessLauncher.class, () -> (workerId, listener) -> {
                throw new IOException("no child processes in this test");
            })
            .withBean(WorkerJobStore.class, () -> mock(WorkerJobStore.class))
            .withBean(JobScheduler.class, () -> mock(JobScheduler.class))
            .withBean(JobHandlerRegistry.class, () -> mock(JobHandlerRegistry.class))
            .withBean(SerializableTransactionRunner.class, () -> mock(SerializableTransactionRunner.class));

    @Test
    void shouldSuperviseProcessesInServerRoleByDefault() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(WorkerProcessManager.class);
            assertThat(context).doesNotHaveBean(WorkerLoop.class);
        });
    }

    @Test
    void shouldRunWorkerLoopInWorkerRole() {
        contextRunner.withPropertyValues("workerq.role=worker").run(context -> {
            assertThat(context).hasSingleBean(WorkerLoop.class);
            assertThat(context).doesNotHaveBean(WorkerProcessManager.class);
        });
    }

    @Test
    void shouldRunNeitherInClientRole() {
        contextRunner.withPropertyValues("workerq.role=client").run(context -> {
            assertThat(context).doesNotHaveBean(WorkerLoop.class);
            assertThat(context).doesNotHaveBean(WorkerProcessManager.class);
        });
    }
}
