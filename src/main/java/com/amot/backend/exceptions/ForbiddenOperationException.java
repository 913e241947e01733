package com.amot.backend.exceptions;

/**
 * The acting user does not hold the authority for the requested operation.
 */
public class ForbiddenOperationException extends RuntimeException {

    public ForbiddenOperationException(String message) {
        super(message);
    }
}
