package com.reelmatch.recommender.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class EmotionNotMappedException extends RuntimeException {
    private final String emotion;
    private final List<String> availableEmotions;

    public EmotionNotMappedException(String emotion, List<String> availableEmotions) {
        super("No genres mapped for emotion '" + emotion + "'. Available emotions: "
            + String.join(", ", availableEmotions));
        this.emotion = emotion;
        this.availableEmotions = availableEmotions;
    }
}
