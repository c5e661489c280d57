package com.adlanda.perema.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

/**
 * Stores a contact's circles as a JSON array string, e.g. {@code ["family","work"]}.
 *
 * An empty list is stored as {@code null} so that "no circles" has one representation.
 */
@Converter
public class CirclesConverter implements AttributeConverter<List<String>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> CIRCLE_LIST = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(List<String> circles) {
        if (circles == null || circles.isEmpty()) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(circles);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize circles: " + circles, e);
        }
    }

    /**
     * One circle as it appears inside the stored array, quotes and escapes included.
     */
    public static String toJsonElement(String circle) {
        try {
            return MAPPER.writeValueAsString(circle);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize circle: " + circle, e);
        }
    }

    @Override
    public List<String> convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(MAPPER.readValue(dbData, CIRCLE_LIST));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unreadable circles column: " + dbData, e);
        }
    }
}
