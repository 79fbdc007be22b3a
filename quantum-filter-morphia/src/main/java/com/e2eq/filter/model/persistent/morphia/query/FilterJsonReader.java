package com.e2eq.filter.model.persistent.morphia.query;

import com.e2eq.filter.exceptions.InvalidFilterException;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Optional;

/**
 * Parses a raw filter string into the untyped form the sanitizer consumes: {@code Map}, {@code List},
 * {@code String}, {@code Number}, {@code Boolean} and {@code null}.
 *
 * <p>Duplicate keys in one object are an error rather than last-one-wins, so a client cannot hide a clause
 * behind a second key with the same name.</p>
 */
public class FilterJsonReader {

    public static final int DEFAULT_MAX_NESTING_DEPTH = 64;

    private final ObjectMapper mapper;

    public FilterJsonReader() {
        this(DEFAULT_MAX_NESTING_DEPTH);
    }

    public FilterJsonReader(int maxNestingDepth) {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
        JsonFactory factory = JsonFactory.builder()
                .streamReadConstraints(StreamReadConstraints.builder().maxNestingDepth(maxNestingDepth).build())
                .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
                .build();
        this.mapper = new ObjectMapper(factory)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * @param json raw filter text, possibly {@code null} or blank
     * @return the parsed value, or empty when there is no filter
     * @throws InvalidFilterException when the text is not a single well formed JSON value
     */
    public Optional<Object> read(String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(mapper.readValue(json, Object.class));
        } catch (JsonProcessingException e) {
            // the message from Jackson carries a location, never the whole payload
            throw new InvalidFilterException("Invalid JSON in advanced filters: " + e.getOriginalMessage(), e);
        }
    }
}
