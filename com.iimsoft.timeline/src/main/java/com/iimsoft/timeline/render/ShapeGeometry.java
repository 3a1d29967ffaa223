package com.iimsoft.timeline.render;

import java.util.Objects;

/**
 * x / y / width / height accessor bound to one rectangle shape.
 *
 * The numbers held here are authoritative; every setter mirrors the value onto the shape.
 * A geometry without a renderer is detached and only keeps the numbers.
 */
public class ShapeGeometry {

    private final ShapeRenderer renderer;
    private final ShapeHandle handle;

    private double x;
    private double y;
    private double width;
    private double height;

    public ShapeGeometry(ShapeRenderer renderer, ShapeHandle handle,
                         double x, double y, double width, double height) {
        this.renderer = renderer;
        this.handle = renderer == null ? handle : Objects.requireNonNull(handle, "handle");
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public static ShapeGeometry detached(double x, double y, double width, double height) {
        return new ShapeGeometry(null, null, x, y, width, height);
    }

    public ShapeHandle getHandle() {
        return handle;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public double getEndX() {
        return x + width;
    }

    public void setX(double x) {
        this.x = x;
        push("x", x);
    }

    public void setY(double y) {
        this.y = y;
        push("y", y);
    }

    public void setWidth(double width) {
        this.width = width;
        push("width", width);
    }

    public void setHeight(double height) {
        this.height = height;
        push("height", height);
    }

    private void push(String key, double value) {
        if (renderer != null) {
            renderer.setAttribute(handle, key, value);
        }
    }
}
