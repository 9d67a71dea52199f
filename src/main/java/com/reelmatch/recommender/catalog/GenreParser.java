package com.reelmatch.recommender.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Parses the serialized genre column. Accepts a JSON list of names, a JSON list of
 * {@code {"id": .., "name": ..}} objects, and the same with single quotes.
 */
@Slf4j
public class GenreParser {

    private static final String NAME_FIELD = "name";

    private final ObjectMapper objectMapper;

    public GenreParser() {
        this(new ObjectMapper());
    }

    public GenreParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Set<String> parse(String serialized) {
        if (serialized == null || serialized.isBlank()) {
            return Set.of();
        }

        JsonNode node = readTree(serialized.trim());
        if (node == null || !node.isArray()) {
            log.debug("Ignoring unparseable genre value: {}", serialized);
            return Set.of();
        }

        Set<String> genres = new LinkedHashSet<>();
        for (JsonNode element : node) {
            String name = element.isObject() ? element.path(NAME_FIELD).asText("") : element.asText("");
            if (!name.isBlank()) {
                genres.add(name.trim());
            }
        }
        return Collections.unmodifiableSet(genres);
    }

    private JsonNode readTree(String value) {
        try {
            return objectMapper.readTree(value);
        } catch (JsonProcessingException e) {
            try {
                return objectMapper.readTree(value.replace('\'', '"'));
            } catch (JsonProcessingException retry) {
                return null;
            }
        }
    }
}
