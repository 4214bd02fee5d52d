package com.example.tokenauth.exception;

/**
 * The storage backend could not complete an operation. This is a server-side
 * failure, not an authorization decision.
 */
public class TokenStorageException extends RuntimeException {

    public TokenStorageException(String message) {
        super(message);
    }

    public TokenStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
