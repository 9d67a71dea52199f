package com.reelmatch.recommender.controller;

public record ErrorResponse(
    String error,
    int status,
    long timestamp
) {}
