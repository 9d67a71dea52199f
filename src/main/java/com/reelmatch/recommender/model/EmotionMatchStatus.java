package com.reelmatch.recommender.model;

public enum EmotionMatchStatus {
    MATCHED,
    NO_MATCHES,
    NO_MAPPING
}
