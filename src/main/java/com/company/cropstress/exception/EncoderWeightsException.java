package com.company.cropstress.exception;

public class EncoderWeightsException extends RuntimeException {
    public EncoderWeightsException(String message) {
        super(message);
    }

    public EncoderWeightsException(String message, Throwable cause) {
        super(message, cause);
    }
}
