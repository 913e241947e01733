package com.amot.backend.exceptions;

/**
 * Requested operation is not valid for the current state of the resource,
 * or the resource changed since the caller last read it.
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }
}
