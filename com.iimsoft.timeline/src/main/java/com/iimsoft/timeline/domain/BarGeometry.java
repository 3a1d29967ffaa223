package com.iimsoft.timeline.domain;

/**
 * Pixel box of a bar, derived from its task's dates, row and the current scale.
 */
public final class BarGeometry {
    private final double x;
    private final double y;
    private final double width;
    private final double height;
    private final double progressWidth;

    public BarGeometry(double x, double y, double width, double height, double progressWidth) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
        this.progressWidth = progressWidth;
    }

    public double getX() { return x; }
    public double getY() { return y; }
    public double getWidth() { return width; }
    public double getHeight() { return height; }
    public double getProgressWidth() { return progressWidth; }
    public double getEndX() { return x + width; }

    @Override
    public String toString() {
        return "BarGeometry{x=" + x + ", y=" + y + ", width=" + width + ", height=" + height + "}";
    }
}
