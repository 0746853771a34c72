package com.dbguardian.server.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.dbguardian.server.exception.JsonException;
import com.dbguardian.server.exception.ValidationException;
import org.apache.commons.lang3.StringUtils;

public class JsonUtil {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule()) // jackson to handle field to Instant
            .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);

    public static <T> T parseJsonDocument(String jsonString, Class<T> clazz)
            throws ValidationException, JsonException {
        if (StringUtils.isBlank(jsonString)) {
            throw new ValidationException("parseJsonDocument failed. jsonString is blank.");
        }
        try {
            return objectMapper.readValue(jsonString, clazz);
        } catch (JsonProcessingException e) {
            throw new JsonException("parseJsonDocument failed. " +
                    "jsonString is %s".formatted(jsonString),
                    e);
        }
    }
}
