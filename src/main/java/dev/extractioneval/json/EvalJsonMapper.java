package dev.extractioneval.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nonnull;
import lombok.SneakyThrows;

/**
 * Jackson setup shared by evaluation output, weight tables and item matching answers.
 *
 * <p>Results are written in snake_case with absent values left out, except where a result type
 * asks to keep them (a null expected or actual value is part of the output). Instants are written
 * as ISO-8601 strings. Input documents are read into insertion-ordered maps so field order
 * survives.
 */
public final class EvalJsonMapper {
    private static final ObjectMapper MAPPER =
            JsonMapper.builder()
                    .addModule(new JavaTimeModule())
                    .addModule(new Jdk8Module())
                    .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                    .serializationInclusion(JsonInclude.Include.NON_ABSENT)
                    .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                    .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                    .build();

    private static final TypeReference<LinkedHashMap<String, Object>> JSON_OBJECT =
            new TypeReference<>() {};

    private EvalJsonMapper() {}

    public static ObjectMapper get() {
        return MAPPER;
    }

    /** Serialize a result (or any value) with the evaluation output settings. */
    @SneakyThrows
    public static String toJson(Object value) {
        return MAPPER.writeValueAsString(value);
    }

    /**
     * Read a JSON object into a map that keeps the document's key order.
     *
     * @throws JsonProcessingException if the text is not JSON or its top level is not an object
     */
    @Nonnull
    public static Map<String, Object> readObject(@Nonnull String json)
            throws JsonProcessingException {
        Map<String, Object> document = MAPPER.readValue(json, JSON_OBJECT);
        if (document == null) {
            throw MismatchedInputException.from(null, Map.class, "expected a JSON object");
        }
        return document;
    }

    /** Parse free-form JSON, such as the answer of a matching model. */
    @Nonnull
    public static JsonNode readTree(@Nonnull String json) throws JsonProcessingException {
        return MAPPER.readTree(json);
    }
}
