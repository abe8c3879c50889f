package com.example.interactivecrop.geometry;

public record ImagePoint(double x, double y) {
}
