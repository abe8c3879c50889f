package com.example.interactivecrop.util;

import com.example.interactivecrop.geometry.DrawBox;

public record PreviewLayout(DrawBox drawBox, double scale) {
}
