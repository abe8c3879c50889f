package com.example.interactivecrop.exception;

public class ImageLoadException extends RuntimeException {

    public ImageLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
