package com.claude.patternlearning.pattern;

import com.claude.patternlearning.entity.PatternType;
import com.claude.patternlearning.exception.MalformedContentException;
import com.claude.patternlearning.exception.PatternCodecException;
import com.claude.patternlearning.extractor.ContentSnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.stereotype.Component;

/**
 * JSON encoding for pattern payloads, weight vectors and content snapshots.
 * Properties and map keys are written in sorted order, so equal values always
 * encode to identical bytes.
 */
@Component
public class PatternJsonCodec {

    private final ObjectMapper objectMapper;

    public PatternJsonCodec() {
        this.objectMapper = JsonMapper.builder()
                .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .addModule(new JavaTimeModule())
                .build();
    }

    public String encode(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PatternCodecException("Cannot encode " + value.getClass().getSimpleName(), e);
        }
    }

    public PatternPayload decodePayload(PatternType patternType, String json) {
        return decode(json, patternType.getPayloadClass());
    }

    public <T> T decode(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new PatternCodecException("Cannot decode " + type.getSimpleName(), e);
        }
    }

    public JsonNode toTree(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new PatternCodecException("Stored payload is not valid JSON", e);
        }
    }

    public ContentSnapshot parseSnapshot(String json) {
        if (json == null || json.isBlank()) {
            throw new MalformedContentException("Content snapshot is missing");
        }
        try {
            ContentSnapshot snapshot = objectMapper.readValue(json, ContentSnapshot.class);
            if (snapshot == null) {
                throw new MalformedContentException("Content snapshot is null");
            }
            return snapshot;
        } catch (JsonProcessingException e) {
            throw new MalformedContentException("Content snapshot cannot be parsed", e);
        }
    }
}
