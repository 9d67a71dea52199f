package com.reelmatch.recommender.exception;

public class MetadataLookupException extends RuntimeException {

    public MetadataLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
