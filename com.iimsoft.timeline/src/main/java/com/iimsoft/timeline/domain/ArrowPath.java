package com.iimsoft.timeline.domain;

import com.iimsoft.timeline.render.ShapeHandle;

/**
 * Dependency arrow from a dependency's bar to its dependent's bar, with the path last routed for it.
 */
public class ArrowPath {
    private final Bar from;
    private final Bar to;
    private ShapeHandle shape;
    private String path;

    public ArrowPath(Bar from, Bar to) {
        this.from = from;
        this.to = to;
    }

    public Bar getFrom() { return from; }
    public Bar getTo() { return to; }

    public ShapeHandle getShape() { return shape; }
    public void setShape(ShapeHandle shape) { this.shape = shape; }

    public String getPath() { return path; }
    public void setPath(String path) { this.path = path; }

    public boolean touches(String taskId) {
        return from.getTask().getId().equals(taskId) || to.getTask().getId().equals(taskId);
    }
}
