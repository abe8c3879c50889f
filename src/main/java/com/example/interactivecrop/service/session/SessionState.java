package com.example.interactivecrop.service.session;

public enum SessionState {
    PENDING,
    ACTIVE,
    SUBMITTED
}
