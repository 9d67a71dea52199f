package com.reelmatch.recommender.catalog;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class GenreParserTest {

    private final GenreParser parser = new GenreParser();

    @Test
    void shouldParseJsonListOfNames() {
        assertThat(parser.parse("[\"Action\", \"Sci-Fi\"]")).containsExactly("Action", "Sci-Fi");
    }

    @Test
    void shouldParseSingleQuotedObjects() {
        assertThat(parser.parse("[{'id': 16, 'name': 'Animation'}, {'id': 35, 'name': 'Comedy'}]"))
            .containsExactly("Animation", "Comedy");
    }

    @Test
    void shouldDropBlankAndDuplicateNames() {
        assertThat(parser.parse("[\"Drama\", \" \", \"Drama\", \" Romance \"]"))
            .containsExactly("Drama", "Romance");
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "[]", "Action|Drama", "{\"name\": \"Action\"}", "[unclosed"})
    void shouldReturnEmptyForMissingOrMalformedValues(String value) {
        assertThat(parser.parse(value)).isEmpty();
    }
}
