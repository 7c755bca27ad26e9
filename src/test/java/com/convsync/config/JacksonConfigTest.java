package com.convsync.config;

import com.convsync.api.dto.SyncStateResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

class JacksonConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(JacksonAutoConfiguration.class))
            .withUserConfiguration(JacksonConfig.class);

    @Test
    void idLongFieldsSerializedAsStringButTimestampsRemainNumber() {
        contextRunner.run(ctx -> {
            ObjectMapper objectMapper = ctx.getBean(ObjectMapper.class);

            String json = objectMapper.writeValueAsString(
                    new SyncStateResponse("dev-a", 2004874454540382209L, "c1", "1700000000000-0", 1_700_000_000_000L));
            JsonNode node = objectMapper.readTree(json);

            assertThat(node.get("userId").isTextual()).isTrue();
            assertThat(node.get("userId").asText()).isEqualTo("2004874454540382209");
            assertThat(node.get("lastSyncAt").isNumber()).isTrue();
            assertThat(node.get("lastMessageId").asText()).isEqualTo("1700000000000-0");
        });
    }

    @Test
    void signalSenderSerializedAsString() {
        contextRunner.run(ctx -> {
            ObjectMapper objectMapper = ctx.getBean(ObjectMapper.class);

            JsonNode node = objectMapper.readTree(objectMapper.writeValueAsString(new Signal(9007199254740993L, 5L)));

            assertThat(node.get("from").isTextual()).isTrue();
            assertThat(node.get("ts").isNumber()).isTrue();
        });
    }

    record Signal(Long from, Long ts) {
    }
}
