package com.dbkeeper.server.util;

import com.dbkeeper.server.exception.JsonException;
import com.dbkeeper.server.exception.ValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.commons.lang3.StringUtils;

import java.util.Map;

public class JsonUtil {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public static String serializeToString(Object object) throws JsonException {
        try {
            return objectMapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new JsonException("serializeToString failed. object is %s".formatted(object), e);
        }
    }

    public static <T> T deserializeStringToPojo(String jsonString, Class<T> clazz) throws JsonException {
        if (StringUtils.isBlank(jsonString)) {
            return null;
        }
        try {
            return objectMapper.readValue(jsonString, clazz);
        } catch (JsonProcessingException e) {
            throw new JsonException("deserializeStringToPojo failed. jsonString is %s".formatted(jsonString), e);
        }
    }

    public static Map<String, Object> deserializeStringToMap(String jsonString) throws JsonException {
        if (StringUtils.isBlank(jsonString)) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(jsonString, new TypeReference<>() {});
        } catch (JsonProcessingException e) {
            throw new JsonException("deserializeStringToMap failed. jsonString is %s".formatted(jsonString), e);
        }
    }

    /**
     * Parses the JSON document printed by a command, e.g. {@code borg create --json}.
     */
    public static JsonNode parseCommandJsonDocument(String commandLineOutput) throws ValidationException, JsonException {
        if (StringUtils.isBlank(commandLineOutput)) {
            throw new ValidationException("parseCommandJsonDocument failed. commandLineOutput is null.");
        }
        try {
            return objectMapper.readTree(commandLineOutput);
        } catch (JsonProcessingException e) {
            throw new JsonException("parseCommandJsonDocument failed. " +
                    "commandLineOutput is %s".formatted(commandLineOutput),
                    e);
        }
    }
}
