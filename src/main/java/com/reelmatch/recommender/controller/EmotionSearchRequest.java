package com.reelmatch.recommender.controller;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record EmotionSearchRequest(
    @NotBlank(message = "Please select an emotion.") @Size(max = 100) String emotion
) {}
