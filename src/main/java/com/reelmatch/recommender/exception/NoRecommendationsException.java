package com.reelmatch.recommender.exception;

import lombok.Getter;

@Getter
public class NoRecommendationsException extends RuntimeException {
    private final String reference;

    public NoRecommendationsException(String reference, String message) {
        super(message);
        this.reference = reference;
    }

    public static NoRecommendationsException forTitle(String title) {
        return new NoRecommendationsException(title,
            "Found '" + title + "' but no similar recommendations were generated.");
    }

    public static NoRecommendationsException forEmotion(String emotion, double minRating) {
        return new NoRecommendationsException(emotion,
            "No movies found for emotion '" + emotion + "' with a rating of at least " + minRating + ".");
    }
}
