package com.reelmatch.recommender.exception;

import lombok.Getter;

@Getter
public class MovieNotFoundException extends RuntimeException {
    private final String query;

    public MovieNotFoundException(String query) {
        super("No movie found matching '" + query + "'. Try a different title or check the spelling.");
        this.query = query;
    }
}
