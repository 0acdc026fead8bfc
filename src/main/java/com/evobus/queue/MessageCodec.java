package com.evobus.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * JSON codec for every queue payload. Timestamps travel as ISO-8601 strings.
 */
@Component
public class MessageCodec {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper = JsonMapper.builder()
        .findAndAddModules()
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();

    public String encode(Object message) {
        try {
            return mapper.writeValueAsString(message);
        } catch (JsonProcessingException ex) {
            throw new MessageFormatException("cannot encode " + message.getClass().getSimpleName(), ex);
        }
    }

    public <T> T decode(String payload, Class<T> type) {
        if (payload == null || payload.isBlank()) {
            throw new MessageFormatException("empty payload for " + type.getSimpleName());
        }
        try {
            return mapper.readValue(payload, type);
        } catch (JsonProcessingException ex) {
            throw new MessageFormatException("malformed " + type.getSimpleName() + ": " + ex.getOriginalMessage(), ex);
        }
    }

    public Map<String, Object> decodeMap(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new MessageFormatException("empty payload");
        }
        try {
            return mapper.readValue(payload, MAP_TYPE);
        } catch (JsonProcessingException ex) {
            throw new MessageFormatException("malformed payload: " + ex.getOriginalMessage(), ex);
        }
    }
}
