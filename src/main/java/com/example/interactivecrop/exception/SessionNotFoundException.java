package com.example.interactivecrop.exception;

public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String targetId) {
        super("No crop session for target " + targetId);
    }
}
