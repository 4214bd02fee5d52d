package com.example.tokenauth.exception;

/**
 * The presented token is not usable for the requested operation.
 * <p>
 * Absent, expired, revoked, malformed and wrong-kind tokens all produce the
 * same message so callers cannot tell the cases apart.
 */
public class InvalidTokenException extends RuntimeException {

    public static final String MESSAGE = "Invalid or expired token";

    public InvalidTokenException() {
        super(MESSAGE);
    }
}
