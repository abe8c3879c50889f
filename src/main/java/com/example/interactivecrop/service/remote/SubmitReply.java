package com.example.interactivecrop.service.remote;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SubmitReply(boolean ok, String error) {
}
