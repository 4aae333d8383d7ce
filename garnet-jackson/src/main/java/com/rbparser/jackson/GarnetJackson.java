package com.rbparser.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Factory for ObjectMapper instances configured for syntax tree output.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = GarnetJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(program);
 * </pre>
 */
public final class GarnetJackson {

    private GarnetJackson() {
        // Utility class
    }

    /**
     * The returned mapper leaves absent optional children out and writes every
     * node through {@link AstModule}.
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.registerModule(new AstModule());
        return mapper;
    }
}
