package com.cadenceai.application.parse.exception;

public class BatchTooLargeException extends RuntimeException {

    public BatchTooLargeException(int size, int maxSize) {
        this(String.format("Batch has %d utterances; at most %d are allowed", size, maxSize));
    }

    public BatchTooLargeException(String message) {
        super(message);
    }

    public BatchTooLargeException(String message, Throwable cause) {
        super(message, cause);
    }
}
