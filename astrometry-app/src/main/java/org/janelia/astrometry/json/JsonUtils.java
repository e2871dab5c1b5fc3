package org.janelia.astrometry.json;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.List;

/**
 * Shared JSON mappers for solutions, parameters and star lists.
 *
 * Values are serialized through their fields so that immutable classes only need
 * a private no-arg constructor.  Unknown properties are ignored which lets star lists
 * produced by other detection tools carry extra attributes.
 */
public class JsonUtils {

    /** Compact single line output (used for log messages). */
    public static final ObjectMapper FAST_MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY)
            .setVisibility(PropertyAccessor.GETTER, JsonAutoDetect.Visibility.NONE)
            .setVisibility(PropertyAccessor.IS_GETTER, JsonAutoDetect.Visibility.NONE)
            .setVisibility(PropertyAccessor.SETTER, JsonAutoDetect.Visibility.NONE)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /** Indented output with one array element per line (used for persisted files). */
    public static final ObjectMapper MAPPER = FAST_MAPPER.copy()
            .setDefaultPrettyPrinter(new DefaultPrettyPrinter().withArrayIndenter(DefaultIndenter.SYSTEM_LINEFEED_INSTANCE))
            .enable(SerializationFeature.INDENT_OUTPUT);

    private JsonUtils() {
    }

    /**
     * Reads and writes instances (or lists of instances) of one class.
     */
    public static class Helper<T> {

        private final Class<T> valueType;
        private final JavaType listType;

        public Helper(final Class<T> valueType) {
            this.valueType = valueType;
            this.listType = MAPPER.getTypeFactory().constructCollectionType(List.class, valueType);
        }

        public String toJson(final T value)
                throws IllegalArgumentException {
            try {
                return MAPPER.writeValueAsString(value);
            } catch (final IOException e) {
                throw new IllegalArgumentException("failed to serialize " + valueType.getSimpleName(), e);
            }
        }

        public void writeJson(final T value,
                              final Writer writer)
                throws IOException {
            MAPPER.writeValue(writer, value);
        }

        /**
         * @throws IllegalArgumentException
         *   if the json cannot be parsed as an instance of the helper's class.
         */
        public T fromJson(final Reader json)
                throws IllegalArgumentException {
            try {
                return MAPPER.readValue(json, valueType);
            } catch (final IOException e) {
                throw new IllegalArgumentException("failed to parse " + valueType.getSimpleName(), e);
            }
        }

        /**
         * @throws IllegalArgumentException
         *   if the json cannot be parsed as an array of the helper's class.
         */
        public List<T> fromJsonArray(final Reader json)
                throws IllegalArgumentException {
            try {
                return MAPPER.readValue(json, listType);
            } catch (final IOException e) {
                throw new IllegalArgumentException("failed to parse " + valueType.getSimpleName() + " array", e);
            }
        }
    }

}
