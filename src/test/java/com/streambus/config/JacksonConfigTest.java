package com.streambus.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.streambus.domain.MessagePayload;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JacksonConfigTest {

    @Test
    void customizedMapperSkipsNullsAndUnknownFields() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        new JacksonConfig().customize(mapper);

        String json = mapper.writeValueAsString(MessagePayload.of("m1", "order", "svc-a", null));
        MessagePayload decoded = mapper.readValue(
                "{\"id\":\"m1\",\"type\":\"order\",\"source\":\"svc-a\",\"unexpected\":1}", MessagePayload.class);

        assertThat(json).doesNotContain("null");
        assertThat(decoded.getSource()).isEqualTo("svc-a");
        assertThat(mapper.getRegisteredModuleIds()).anyMatch(id -> id.toString().contains("Blackbird"));
    }
}
