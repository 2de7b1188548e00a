package com.id.swl.exceptions;

/**
 * A batch whose measurements span more than one source or parameter.
 */
public class HeterogeneousBatchException extends IllegalArgumentException {

    public HeterogeneousBatchException(String message) {
        super(message);
    }
}
