package com.deuceleague.deuce_api.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.List;

/**
 * Stores a score snapshot (disputed or counter-proposed) as a JSON text column.
 */
@Converter
public class SetScoreListConverter implements AttributeConverter<List<SetScore>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<SetScore>> TYPE = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(List<SetScore> scores) {
        if (scores == null) return null;
        try {
            return MAPPER.writeValueAsString(scores);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unserializable score snapshot", e);
        }
    }

    @Override
    public List<SetScore> convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) return null;
        try {
            return MAPPER.readValue(json, TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt score snapshot: " + json, e);
        }
    }
}
