package com.iimsoft.timeline.render;

/**
 * Pointer position relative to the drawing surface. For {@link Gesture#SCROLL} x carries the
 * horizontal scroll offset.
 */
public final class PointerEvent {
    private final double x;
    private final double y;

    public PointerEvent(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public double getX() { return x; }
    public double getY() { return y; }

    @Override
    public String toString() {
        return "PointerEvent{" + x + ", " + y + "}";
    }
}
