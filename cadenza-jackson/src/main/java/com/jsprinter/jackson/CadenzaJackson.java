package com.jsprinter.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for creating properly configured ObjectMapper instances for document trees,
 * transform options and source maps.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = CadenzaJackson.createObjectMapper();
 * Document document = mapper.readValue(json, Document.class);
 * String map = mapper.writeValueAsString(sourceMap);
 * </pre>
 */
public final class CadenzaJackson {

    private CadenzaJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for document trees.
     *
     * The returned mapper:
     * - Handles polymorphic Node and Attribute types via the "type" property
     * - Omits null values (synthetic locations, absent namespaces, absent sourcesContent)
     * - Ignores unknown properties, so parser output may carry extra fields
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new DocumentModule());

        return mapper;
    }
}
