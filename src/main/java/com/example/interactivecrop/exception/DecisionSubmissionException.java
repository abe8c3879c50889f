package com.example.interactivecrop.exception;

public class DecisionSubmissionException extends RuntimeException {

    public DecisionSubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
