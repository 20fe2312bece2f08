package com.workerq.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkerQPropertiesTest {

    @Configuration
    @EnableConfigurationProperties(WorkerQProperties.class)
    static class Config {
    }

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(Config.class);

    @Test
    void shouldMapDefaultWorkerqProperties() {
        contextRunner.run(context -> {
            WorkerQProperties properties = context.getBean(WorkerQProperties.class);
            assertEquals(WorkerQProperties.ROLE_SERVER, properties.getRole());
            assertFalse(properties.isWorkerRole());
            assertFalse(properties.getDatabase().isSkipCreate());
            assertTrue(properties.getDatabase().isFailOnMigrationError());
            assertEquals(Duration.ofSeconds(1), properties.getWorker().getPollInterval());
            assertEquals(Duration.ofHours(1), properties.getWorker().getStaleClaimThreshold());
            assertEquals("cpus", properties.getProcesses().getCount());
            assertTrue(properties.getProcesses().resolveCount() >= 1);
            assertEquals(Duration.ofSeconds(10), properties.getProcesses().getStartupTimeout());
            assertEquals(Duration.ofSeconds(1), properties.getProcesses().getRestartInitialBackoff());
            assertEquals(Duration.ofSeconds(5), properties.getProcesses().getRestartMaxBackoff());
            assertEquals(7, properties.getTransaction().getMaxAttempts());
            assertEquals(Duration.ofMillis(50), properties.getTransaction().getInitialRetryDelay());
            assertTrue(properties.getCleanup().isEnabled());
            assertEquals("0 * * * * *", properties.getCleanup().getCron());
        });
    }

    @Test
    void shouldMapCustomWorkerqProperties() {
        contextRunner
                .withPropertyValues(
                        "workerq.role=worker",
                        "workerq.worker.id=4",
                        "workerq.worker.poll-interval=250ms",
                        "workerq.worker.stale-claim-threshold=30m",
                        "workerq.processes.count=3",
                        "workerq.processes.jvm-args=-Xmx512m,-XX:+UseG1GC",
                        "workerq.transaction.max-attempts=3",
                        "workerq.cleanup.enabled=false",
                        "workerq.database.skip-create=true")
                .run(context -> {
                    WorkerQProperties properties = context.getBean(WorkerQProperties.class);
                    assertTrue(properties.isWorkerRole());
                    assertEquals(4, properties.getWorker().getId());
                    assertEquals(Duration.ofMillis(250), properties.getWorker().getPollInterval());
                    assertEquals(Duration.ofMinutes(30), properties.getWorker().getStaleClaimThreshold());
                    assertEquals(3, properties.getProcesses().resolveCount());
                    assertEquals(List.of("-Xmx512m", "-XX:+UseG1GC"), properties.getProcesses().getJvmArgs());
                    assertEquals(3, properties.getTransaction().getMaxAttempts());
                    assertFalse(properties.getCleanup().isEnabled());
                    assertTrue(properties.getDatabase().isSkipCreate());
                });
    }

    @Test
    void shouldRejectInvalidProcessCount() {
        WorkerQProperties.Processes processes = new WorkerQProperties().getProcesses();

        processes.setCount("0");
        assertThrows(IllegalArgumentException.class, processes::resolveCount);
        processes.setCount("many");
        assertThrows(IllegalArgumentException.class, processes::resolveCount);
        processes.setCount(" CPUS ");
        assertEquals(Math.max(1, Runtime.getRuntime().availableProcessors()), processes.resolveCount());
    }
}
