package com.syntree.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for ObjectMapper instances that read and write syntax trees.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = SyntreeJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(tree);
 * Node copy = mapper.readValue(json, Node.class);
 * </pre>
 */
public final class SyntreeJackson {

    private SyntreeJackson() {
        // Utility class
    }

    /**
     * Creates a mapper that writes source locations.
     */
    public static ObjectMapper createObjectMapper() {
        return createObjectMapper(true);
    }

    /**
     * Creates a new ObjectMapper configured for tree serialization/deserialization.
     *
     * @param writeLocations whether known source locations are written as {@code loc}
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper(boolean writeLocations) {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        // Readers written against newer formats may add fields
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new NodeModule(writeLocations));

        return mapper;
    }
}
