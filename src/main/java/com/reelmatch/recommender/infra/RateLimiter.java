package com.reelmatch.recommender.infra;

import java.util.function.Supplier;

public interface RateLimiter {

    void acquire(String key, int permits);

    default <T> T execute(String key, int permits, Supplier<T> task) {
        acquire(key, permits);
        return task.get();
    }
}
