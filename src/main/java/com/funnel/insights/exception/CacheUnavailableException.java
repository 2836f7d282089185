package com.funnel.insights.exception;

/**
 * The cache storage backend could not be reached. Callers fall back to
 * computing the result directly.
 */
public class CacheUnavailableException extends RuntimeException {

    public CacheUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
