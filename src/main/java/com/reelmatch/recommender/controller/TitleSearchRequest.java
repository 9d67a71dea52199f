package com.reelmatch.recommender.controller;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record TitleSearchRequest(
    @NotBlank(message = "Please enter a movie title.") @Size(max = 200) String title
) {}
