package com.raava.concierge.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Loads reference data (inventory, service providers) from JSON files on the classpath.
 * Unknown properties are ignored so data files can carry extra attributes.
 */
public class JsonFileLoader {

    private static final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private JsonFileLoader() {}

    /**
     * Loads a classpath resource as a String.
     *
     * @param resourcePath path relative to the classpath root (e.g. "data/inventory.json")
     * @return file content
     * @throws IOException if the resource does not exist or cannot be read
     */
    public static String loadAsString(String resourcePath) throws IOException {
        try (InputStream inputStream = JsonFileLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /**
     * Loads a JSON object and binds it to {@code clazz}.
     *
     * @throws IOException if the resource is missing or does not bind
     */
    public static <T> T loadAsObject(String resourcePath, Class<T> clazz) throws IOException {
        return objectMapper.readValue(loadAsString(resourcePath), clazz);
    }

    /**
     * Loads a JSON array and binds each element to {@code clazz}.
     *
     * @throws IOException if the resource is missing or does not bind
     */
    public static <T> List<T> loadAsList(String resourcePath, Class<T> clazz) throws IOException {
        return objectMapper.readValue(loadAsString(resourcePath),
                objectMapper.getTypeFactory().constructCollectionType(List.class, clazz));
    }
}
