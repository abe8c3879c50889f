package com.example.interactivecrop.interaction;

public interface TargetSelection {

    boolean isSelected(String targetId);
}
