package com.codeannotation.backend.repo;

/**
 * Raised by a repository when the backing store cannot serve a request.
 */
public class StoreException extends RuntimeException {
    public StoreException(String message) {
        super(message);
    }
}
