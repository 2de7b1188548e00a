package com.id.swl.exceptions;

/**
 * A measurement missing one of its mandatory fields.
 */
public class MalformedMeasurementException extends IllegalArgumentException {

    public MalformedMeasurementException(String message) {
        super(message);
    }
}
