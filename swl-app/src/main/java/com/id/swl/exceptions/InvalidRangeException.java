package com.id.swl.exceptions;

/**
 * A time interval whose end lies before its start, or with a missing bound.
 */
public class InvalidRangeException extends IllegalArgumentException {

    public InvalidRangeException(String message) {
        super(message);
    }
}
