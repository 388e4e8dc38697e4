package io.depkit.sdk.internal;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.util.Optional;

/**
 * Mapper shared by the client and the file credential store.
 *
 * <p>
 * DEP timestamps ({@code profile_assign_time}, {@code op_date}, {@code fetched_until} and the token file's
 * {@code access_token_expiry}) travel as RFC 3339 strings such as {@code 2015-01-29T21:12:38Z}; they map to
 * {@link java.time.Instant} and are written back in the same form. An empty string in place of a date or nested
 * object reads as {@code null}. Keys this client does not model are ignored, since the service adds fields between
 * protocol versions.
 * </p>
 */
public final class Json {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .serializationInclusion(JsonInclude.Include.NON_NULL)
        .build();

    private Json() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static JavaType type(Class<?> type) {
        return MAPPER.constructType(type);
    }

    /**
     * Reads the first of {@code fields} that holds a non-blank scalar in a top-level JSON object.
     *
     * @return the value, or empty when the body is not an object or none of the fields is set.
     * @throws IOException when the body is not JSON.
     */
    public static Optional<String> text(byte[] body, String... fields) throws IOException {
        if (body == null || body.length == 0) {
            return Optional.empty();
        }
        JsonNode node = MAPPER.readTree(body);
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isValueNode() && !value.isNull() && !value.asText().isBlank()) {
                return Optional.of(value.asText());
            }
        }
        return Optional.empty();
    }
}
