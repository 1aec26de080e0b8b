package com.mobilebackup.importer.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mobilebackup.importer.model.LabeledValue;

import java.util.ArrayList;
import java.util.List;

/**
 * 列表类字段以 JSON 文本存库。
 */
final class JsonColumns {

    private static final TypeReference<List<LabeledValue>> LABELED_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    JsonColumns(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    String write(Object value) {
        try {
            return mapper.writeValueAsString(value == null ? List.of() : value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize column value", e);
        }
    }

    List<LabeledValue> readLabeled(String json) {
        return read(json, LABELED_LIST);
    }

    List<String> readStrings(String json) {
        return read(json, STRING_LIST);
    }

    private <T> List<T> read(String json, TypeReference<List<T>> type) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(mapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize column value", e);
        }
    }
}
