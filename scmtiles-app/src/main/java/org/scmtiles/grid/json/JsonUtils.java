package org.scmtiles.grid.json;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utilities for working with JSON data.
 * Mappers serialize fields directly so that configuration and parameter classes
 * do not need to expose setters.
 */
public class JsonUtils {

    public static final ObjectMapper MAPPER = new ObjectMapper().
            setSerializationInclusion(JsonInclude.Include.NON_NULL).
            setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY).
            setVisibility(PropertyAccessor.GETTER, JsonAutoDetect.Visibility.NONE).
            setVisibility(PropertyAccessor.IS_GETTER, JsonAutoDetect.Visibility.NONE).
            setVisibility(PropertyAccessor.SETTER, JsonAutoDetect.Visibility.NONE).
            configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false).
            enable(SerializationFeature.INDENT_OUTPUT);

    public static final ObjectMapper STRICT_MAPPER = MAPPER.copy().
            configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    /**
     * @return JSON representation of the specified value, suitable for log messages.
     *
     * @throws IllegalArgumentException
     *   if the value cannot be serialized.
     */
    public static String toJson(final Object value)
            throws IllegalArgumentException {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (final JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
    }

    /**
     * Loads an object of the specified type from a JSON file,
     * rejecting properties the type does not declare.
     *
     * @throws IOException
     *   if the file cannot be read or parsed.
     */
    public static <T> T loadJsonFile(final Path path,
                                     final Class<T> valueType)
            throws IOException {
        try (final Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return STRICT_MAPPER.readValue(reader, valueType);
        } catch (final IOException e) {
            throw new IOException("failed to load " + valueType.getSimpleName() + " from " + path, e);
        }
    }

}
