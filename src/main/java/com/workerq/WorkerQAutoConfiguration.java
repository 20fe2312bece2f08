package com.workerq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.workerq.config.WorkerQProperties;
import com.workerq.internal.JobHandlerRegistry;
import com.workerq.internal.RecurringJobInitializer;
import com.workerq.internal.RemoveOldWorkerJobsHandler;
import com.workerq.internal.SerializableTransactionRunner;
import com.workerq.internal.WorkerLoop;
import com.workerq.internal.WorkerQMetrics;
import com.workerq.process.JavaWorkerProcessLauncher;
import com.workerq.process.StdoutWorkerMessageChannel;
import com.workerq.process.WorkerProcessManager;
import com.workerq.process.WorkerProcessRunner;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigurationPackage;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.data.jpa.JpaRepositoriesAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.orm.jpa.HibernateJpaAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

/**
 * Registers the job store, scheduler and, depending on {@code workerq.role}, either the worker
 * process supervisor or the in-process worker loop.
 */
@AutoConfiguration(after = JacksonAutoConfiguration.class,
        before = { HibernateJpaAutoConfiguration.class, JpaRepositoriesAutoConfiguration.class })
@AutoConfigurationPackage(basePackageClasses = WorkerJob.class)
@EnableConfigurationProperties(WorkerQProperties.class)
@Import({
        WorkerJobSchemaInitializer.class,
        SerializableTransactionRunner.class,
        WorkerJobStore.class,
        JobScheduler.class,
        JobHandlerRegistry.class,
        RemoveOldWorkerJobsHandler.class,
        RecurringJobInitializer.class,
        WorkerLoop.class,
        StdoutWorkerMessageChannel.class,
        WorkerProcessRunner.class,
        JavaWorkerProcessLauncher.class,
        WorkerProcessManager.class
})
public class WorkerQAutoConfiguration {

    /**
     * Fallback for contexts without Boot's Jackson auto-configuration.
     */
    @Bean
    @ConditionalOnMissingBean(ObjectMapper.class)
    public ObjectMapper workerqObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }

    @Bean
    @ConditionalOnBean(MeterRegistry.class)
    public WorkerQMetrics workerqMetrics(WorkerJobStore store, MeterRegistry meterRegistry) {
        return new WorkerQMetrics(store, meterRegistry);
    }
}
