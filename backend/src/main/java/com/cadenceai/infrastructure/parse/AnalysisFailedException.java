package com.cadenceai.infrastructure.parse;

/**
 * An analysis worker failed for a reason other than the input's language.
 */
public class AnalysisFailedException extends RuntimeException {

    public AnalysisFailedException(String message) {
        super(message);
    }

    public AnalysisFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
