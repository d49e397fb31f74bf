package com.example.requestcache.key;

/**
 * A key could not be derived. Callers skip caching for that one operation.
 */
public class CacheKeyException extends RuntimeException {

    public CacheKeyException(String message, Throwable cause) {
        super(message, cause);
    }
}
