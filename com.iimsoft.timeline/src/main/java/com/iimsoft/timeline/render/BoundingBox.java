package com.iimsoft.timeline.render;

public final class BoundingBox {
    public static final BoundingBox EMPTY = new BoundingBox(0, 0, 0, 0);

    private final double x;
    private final double y;
    private final double width;
    private final double height;

    public BoundingBox(double x, double y, double width, double height) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public double getX() { return x; }
    public double getY() { return y; }
    public double getWidth() { return width; }
    public double getHeight() { return height; }
    public double getX2() { return x + width; }
    public double getY2() { return y + height; }

    public BoundingBox union(BoundingBox other) {
        if (other == null || other == EMPTY) return this;
        if (this == EMPTY) return other;
        double minX = Math.min(x, other.x);
        double minY = Math.min(y, other.y);
        double maxX = Math.max(getX2(), other.getX2());
        double maxY = Math.max(getY2(), other.getY2());
        return new BoundingBox(minX, minY, maxX - minX, maxY - minY);
    }

    @Override
    public String toString() {
        return "BoundingBox{x=" + x + ", y=" + y + ", width=" + width + ", height=" + height + "}";
    }
}
