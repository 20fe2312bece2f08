package com.workerq.process;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.workerq.config.WorkerQProperties;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JavaWorkerProcessLauncherTest {

    @Test
    void shouldDropRoleAndWorkerIdFromForwardedArguments() {
        List<String> forwarded = JavaWorkerProcessLauncher.forwardableArgs(new String[] {
                "--spring.datasource.url=jdbc:postgresql://db/app",
                "--workerq.role=server",
                "--workerq.worker.id=9",
                "--workerq.processes.count=2" });

        assertThat(forwarded).containsExactly("--spring.datasource.url=jdbc:postgresql://db/app",
                "--workerq.processes.count=2");
    }

    @Test
    void shouldStartChildAsWorkerWithItsId() {
        WorkerQProperties properties = new WorkerQProperties();
        properties.getProcesses().setJvmArgs(List.of("-Xmx256m"));
        StaticListableBeanFactory beanFactory = new StaticListableBeanFactory();
        beanFactory.addBean("springApplicationArguments",
                new DefaultApplicationArguments("--server.port=0", "--workerq.role=server"));
        ObjectProvider<ApplicationArguments> arguments = beanFactory.getBeanProvider(ApplicationArguments.class);
        JavaWorkerProcessLauncher launcher = new JavaWorkerProcessLauncher(properties, new ObjectMapper(), arguments);

        List<String> command = launcher.buildCommand(2);

        assertThat(command.get(0)).contains("java");
        assertThat(command.get(1)).isEqualTo("-Xmx256m");
        assertThat(command).contains("--server.port=0", "--workerq.role=worker", "--workerq.worker.id=2");
        assertThat(command).doesNotContain("--workerq.role=server");
        assertThat(command.indexOf("--server.port=0")).isLessThan(command.indexOf("--workerq.role=worker"));
    }
}
