package com.company.cropstress.exception;

public class InvalidRasterStackException extends RuntimeException {
    public InvalidRasterStackException(String message) {
        super(message);
    }
}
