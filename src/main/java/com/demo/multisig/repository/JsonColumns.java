package com.demo.multisig.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Reads and writes the JSON-typed columns. */
@Component
@RequiredArgsConstructor
class JsonColumns {

    private final ObjectMapper objectMapper;

    String write(Object value) {
        if (value == null) return null;
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    /** Writes through the declared type so polymorphic values keep their type tag. */
    String write(Object value, Class<?> declaredType) {
        if (value == null) return null;
        try {
            return objectMapper.writerFor(declaredType).writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + declaredType.getSimpleName(), e);
        }
    }

    <T> T read(String json, Class<T> type) {
        if (json == null || json.isBlank()) return null;
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt " + type.getSimpleName() + " column", e);
        }
    }
}
