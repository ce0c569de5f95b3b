package com.enterprise.workflow.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared Jackson mapper and helpers for task outputs and result snapshots
 */
public final class JsonSupport {
    
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    
    private JsonSupport() {
    }
    
    public static ObjectMapper mapper() {
        return MAPPER;
    }
    
    /**
     * A new empty JSON object
     */
    public static ObjectNode object() {
        return MAPPER.createObjectNode();
    }
    
    /**
     * Convert any Jackson-mappable value to a tree
     */
    public static JsonNode toTree(Object value) {
        return MAPPER.valueToTree(value);
    }
    
    public static String toJson(Object value) throws JsonProcessingException {
        return MAPPER.writeValueAsString(value);
    }
    
    public static <T> T fromJson(String json, Class<T> type) throws JsonProcessingException {
        return MAPPER.readValue(json, type);
    }
}
