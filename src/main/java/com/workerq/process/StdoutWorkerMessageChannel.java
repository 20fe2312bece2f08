package com.workerq.process;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.workerq.config.WorkerQProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;

/**
 * Writes messages as JSON lines to the process's original standard output, which the manager
 * reads. Worker processes send their logs to stderr so the two never interleave.
 */
@Component
@ConditionalOnProperty(prefix = "workerq", name = "role", havingValue = WorkerQProperties.ROLE_WORKER)
public class StdoutWorkerMessageChannel implements WorkerMessageChannel {

    private static final Logger log = LoggerFactory.getLogger(StdoutWorkerMessageChannel.class);

    private final ObjectMapper objectMapper;
    private final PrintStream out;

    @Autowired
    public StdoutWorkerMessageChannel(ObjectMapper objectMapper) {
        this(objectMapper, System.out);
    }

    StdoutWorkerMessageChannel(ObjectMapper objectMapper, PrintStream out) {
        this.objectMapper = objectMapper;
        this.out = out;
    }

    @Override
    public void send(WorkerMessage message) {
        String line;
        try {
            line = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize worker message " + message, e);
        }
        synchronized (out) {
            out.println(line);
            out.flush();
        }
        if (out.checkError()) {
            log.warn("Standard output is closed, the manager did not receive {}", message.type());
        }
    }
}
