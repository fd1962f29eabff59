package com.mergington.activities.exception;

/**
 * A request that conflicts with the current roster, such as a duplicate signup.
 */
public class BadRequestException extends RuntimeException {

    public BadRequestException(String message) {
        super(message);
    }
}
