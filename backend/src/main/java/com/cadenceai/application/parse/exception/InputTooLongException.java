package com.cadenceai.application.parse.exception;

public class InputTooLongException extends RuntimeException {

    public InputTooLongException(int length, int maxLength) {
        this(String.format("Input is %d characters; at most %d are allowed", length, maxLength));
    }

    public InputTooLongException(String message) {
        super(message);
    }

    public InputTooLongException(String message, Throwable cause) {
        super(message, cause);
    }
}
