package com.streambus.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.streambus.config.JacksonConfig;

/**
 * Builds a {@link MessageCodec} outside the container, with the application mapper settings.
 */
public final class CodecFixtures {

    private CodecFixtures() {}

    public static MessageCodec newCodec() {
        ObjectMapper mapper = new ObjectMapper();
        new JacksonConfig().customize(mapper);
        MessageCodec codec = new MessageCodec();
        codec.objectMapper = mapper;
        codec.init();
        return codec;
    }
}
