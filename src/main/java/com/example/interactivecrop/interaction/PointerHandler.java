package com.example.interactivecrop.interaction;

public interface PointerHandler {

    boolean onPointerDown(PointerInput input);

    boolean onPointerMove(PointerInput input);

    boolean onPointerUp(PointerInput input);
}
