package com.workerq.process;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkerMessageTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void shouldUseHyphenatedTypeNamesOnTheWire() throws Exception {
        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(WorkerMessage.started(4242)));

        assertThat(json.get("type").asText()).isEqualTo("worker-started");
        assertThat(json.get("pid").asLong()).isEqualTo(4242);
        assertThat(json.has("error")).isFalse();
    }

    @Test
    void shouldReadErrorMessageFromWorker() throws Exception {
        WorkerMessage message = objectMapper.readValue(
                "{\"type\":\"worker-error\",\"pid\":17,\"error\":\"database unreachable\"}", WorkerMessage.class);

        assertThat(message).isEqualTo(WorkerMessage.error(17, "database unreachable"));
    }

    @Test
    void shouldReadHeartbeat() throws Exception {
        WorkerMessage message = objectMapper.readValue("{\"type\":\"heartbeat\",\"pid\":5}", WorkerMessage.class);

        assertThat(message.type()).isEqualTo(WorkerMessage.Type.HEARTBEAT);
    }

    @Test
    void shouldRejectMessageWithoutType() {
        assertThatThrownBy(() -> new WorkerMessage(null, 1, null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldWriteOneJsonLinePerMessage() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        StdoutWorkerMessageChannel channel = new StdoutWorkerMessageChannel(objectMapper,
                new PrintStream(buffer, true, StandardCharsets.UTF_8));

        channel.send(WorkerMessage.started(1));
        channel.send(WorkerMessage.shutdown(1));

        String[] lines = buffer.toString(StandardCharsets.UTF_8).split("\\R");
        assertThat(lines).containsExactly(
                "{\"type\":\"worker-started\",\"pid\":1}",
                "{\"type\":\"worker-shutdown\",\"pid\":1}");
    }
}
