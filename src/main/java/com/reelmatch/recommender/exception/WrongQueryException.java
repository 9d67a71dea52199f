package com.reelmatch.recommender.exception;

public class WrongQueryException extends RuntimeException {

    public WrongQueryException(String message) {
        super(message);
    }
}
