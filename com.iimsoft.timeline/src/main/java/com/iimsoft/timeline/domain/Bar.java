package com.iimsoft.timeline.domain;

import com.iimsoft.timeline.render.ShapeGeometry;
import com.iimsoft.timeline.render.ShapeHandle;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A task drawn on the chart: its shapes, the geometry accessors bound to them and the
 * per-gesture bookkeeping of the interaction in progress.
 */
public class Bar {

    private final Task task;
    private final ShapeGeometry geometry;
    private final ShapeGeometry progressGeometry;   // null for invalid tasks

    private ShapeHandle group;
    private ShapeHandle barGroup;
    private ShapeHandle handleGroup;
    private ShapeHandle label;
    private ShapeHandle leftHandle;
    private ShapeHandle rightHandle;
    private ShapeHandle progressHandle;
    private ShapeHandle caret;

    private List<ArrowPath> arrows = new ArrayList<>();

    // drag bookkeeping, reset on every press
    private double originX;
    private double originY;
    private double originWidth;
    private double finalDx;
    private double finalDy;

    // progress bookkeeping
    private double progressOriginWidth;
    private double progressMinDx;
    private double progressMaxDx;
    private double progressFinalDx;

    private Instant cooldownUntil;

    public Bar(Task task, ShapeGeometry geometry, ShapeGeometry progressGeometry) {
        this.task = task;
        this.geometry = geometry;
        this.progressGeometry = progressGeometry;
    }

    public Task getTask() { return task; }
    public ShapeGeometry getGeometry() { return geometry; }
    public ShapeGeometry getProgressGeometry() { return progressGeometry; }

    public boolean isInvalid() { return task.isInvalid(); }
    public double getHeight() { return geometry.getHeight(); }

    /** Remembers the current geometry as the origin of a new gesture. */
    public void markOrigin() {
        originX = geometry.getX();
        originY = geometry.getY();
        originWidth = geometry.getWidth();
        finalDx = 0;
        finalDy = 0;
    }

    public void markProgressOrigin() {
        progressOriginWidth = progressGeometry.getWidth();
        progressMinDx = -progressGeometry.getWidth();
        progressMaxDx = geometry.getWidth() - progressGeometry.getWidth();
        progressFinalDx = 0;
    }

    public boolean movedSinceOrigin() {
        return geometry.getX() != originX || geometry.getWidth() != originWidth;
    }

    public double getOriginX() { return originX; }
    public double getOriginY() { return originY; }
    public double getOriginWidth() { return originWidth; }
    public double getFinalDx() { return finalDx; }
    public void setFinalDx(double finalDx) { this.finalDx = finalDx; }
    public double getFinalDy() { return finalDy; }
    public void setFinalDy(double finalDy) { this.finalDy = finalDy; }

    public double getProgressOriginWidth() { return progressOriginWidth; }
    public double getProgressMinDx() { return progressMinDx; }
    public double getProgressMaxDx() { return progressMaxDx; }
    public double getProgressFinalDx() { return progressFinalDx; }
    public void setProgressFinalDx(double progressFinalDx) { this.progressFinalDx = progressFinalDx; }

    /** Starts the short window after a gesture during which clicks on this bar are ignored. */
    public void setActionCompleted(Instant until) { this.cooldownUntil = until; }

    public boolean isActionCompleted(Instant now) {
        return cooldownUntil != null && now.isBefore(cooldownUntil);
    }

    public ShapeHandle getGroup() { return group; }
    public void setGroup(ShapeHandle group) { this.group = group; }
    public ShapeHandle getBarGroup() { return barGroup; }
    public void setBarGroup(ShapeHandle barGroup) { this.barGroup = barGroup; }
    public ShapeHandle getHandleGroup() { return handleGroup; }
    public void setHandleGroup(ShapeHandle handleGroup) { this.handleGroup = handleGroup; }
    public ShapeHandle getLabel() { return label; }
    public void setLabel(ShapeHandle label) { this.label = label; }
    public ShapeHandle getLeftHandle() { return leftHandle; }
    public void setLeftHandle(ShapeHandle leftHandle) { this.leftHandle = leftHandle; }
    public ShapeHandle getRightHandle() { return rightHandle; }
    public void setRightHandle(ShapeHandle rightHandle) { this.rightHandle = rightHandle; }
    public ShapeHandle getProgressHandle() { return progressHandle; }
    public void setProgressHandle(ShapeHandle progressHandle) { this.progressHandle = progressHandle; }
    public ShapeHandle getCaret() { return caret; }
    public void setCaret(ShapeHandle caret) { this.caret = caret; }

    public List<ArrowPath> getArrows() { return arrows; }
    public void setArrows(List<ArrowPath> arrows) { this.arrows = arrows == null ? new ArrayList<>() : arrows; }

    @Override
    public String toString() {
        return "Bar{" + task.getId() + ", x=" + geometry.getX() + ", width=" + geometry.getWidth() + "}";
    }
}
