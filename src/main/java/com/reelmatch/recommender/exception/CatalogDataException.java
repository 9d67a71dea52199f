package com.reelmatch.recommender.exception;

/**
 * Raised while building the catalog when the input table is missing or malformed.
 * Fatal: the application does not start without a catalog.
 */
public class CatalogDataException extends RuntimeException {

    public CatalogDataException(String message) {
        super(message);
    }

    public CatalogDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
