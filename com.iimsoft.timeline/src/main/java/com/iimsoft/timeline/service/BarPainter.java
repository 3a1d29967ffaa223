package com.iimsoft.timeline.service;

import com.iimsoft.timeline.config.GanttOptions;
import com.iimsoft.timeline.domain.ArrowPath;
import com.iimsoft.timeline.domain.Bar;
import com.iimsoft.timeline.domain.BarGeometry;
import com.iimsoft.timeline.domain.Task;
import com.iimsoft.timeline.render.BoundingBox;
import com.iimsoft.timeline.render.ShapeGeometry;
import com.iimsoft.timeline.render.ShapeHandle;
import com.iimsoft.timeline.render.ShapeRenderer;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Creates the shapes of a bar and keeps them in step with its geometry.
 */
public class BarPainter {

    static final int HANDLE_WIDTH = 8;
    static final int CARET_WIDTH = 12;
    static final int CARET_HEIGHT = 6;
    /** Room the label must leave inside the bar for the caret to be drawn. */
    static final int CARET_MIN_ROOM = 40;

    private final ShapeRenderer renderer;
    private final GanttOptions options;
    private final ArrowRouter arrowRouter;

    public BarPainter(ShapeRenderer renderer, GanttOptions options, ArrowRouter arrowRouter) {
        this.renderer = renderer;
        this.options = options;
        this.arrowRouter = arrowRouter;
    }

    /**
     * Draws a bar under {@code layer}.
     *
     * @param collapsible whether the task has dependents, which adds the collapse caret
     */
    public Bar draw(Task task, BarGeometry g, ShapeHandle layer, boolean collapsible) {
        String cssClass = "bar-wrapper" + (task.getCustomClass() == null ? "" : " " + task.getCustomClass());
        ShapeHandle group = renderer.createShape("g", attrs("class", cssClass, "data-id", task.getId()), layer);
        ShapeHandle barGroup = renderer.createShape("g", attrs("class", "bar-group"), group);
        ShapeHandle handleGroup = renderer.createShape("g", attrs("class", "handle-group"), group);

        Map<String, Object> rect = attrs("x", g.getX(), "y", g.getY(), "width", g.getWidth(), "height", g.getHeight(),
                "rx", options.getBarCornerRadius(), "ry", options.getBarCornerRadius(),
                "class", task.isInvalid() ? "bar bar-invalid" : "bar");
        if (task.getColor() != null) {
            rect.put("style", "fill: " + task.getColor());
        }
        ShapeHandle barRect = renderer.createShape("rect", rect, barGroup);
        ShapeGeometry geometry = new ShapeGeometry(renderer, barRect, g.getX(), g.getY(), g.getWidth(), g.getHeight());

        ShapeGeometry progressGeometry = null;
        if (!task.isInvalid()) {
            ShapeHandle progressRect = renderer.createShape("rect", attrs("x", g.getX(), "y", g.getY(),
                    "width", g.getProgressWidth(), "height", g.getHeight(),
                    "rx", options.getBarCornerRadius(), "ry", options.getBarCornerRadius(),
                    "class", "bar-progress"), barGroup);
            progressGeometry = new ShapeGeometry(renderer, progressRect,
                    g.getX(), g.getY(), g.getProgressWidth(), g.getHeight());
        }

        Bar bar = new Bar(task, geometry, progressGeometry);
        bar.setGroup(group);
        bar.setBarGroup(barGroup);
        bar.setHandleGroup(handleGroup);

        Map<String, Object> label = attrs("x", g.getX() + g.getWidth() / 2, "y", g.getY() + g.getHeight() / 2,
                "class", "bar-label");
        label.put(ShapeRenderer.TEXT, task.getName() == null ? "" : task.getName());
        bar.setLabel(renderer.createShape("text", label, barGroup));

        if (!task.isInvalid()) {
            bar.setRightHandle(renderer.createShape("rect", attrs("x", g.getEndX() - 9, "y", g.getY() + 1,
                    "width", HANDLE_WIDTH, "height", g.getHeight() - 2,
                    "rx", options.getBarCornerRadius(), "ry", options.getBarCornerRadius(),
                    "class", "handle right"), handleGroup));
            bar.setLeftHandle(renderer.createShape("rect", attrs("x", g.getX() + 1, "y", g.getY() + 1,
                    "width", HANDLE_WIDTH, "height", g.getHeight() - 2,
                    "rx", options.getBarCornerRadius(), "ry", options.getBarCornerRadius(),
                    "class", "handle left"), handleGroup));
            bar.setProgressHandle(renderer.createShape("polygon",
                    attrs("points", progressPolygonPoints(bar), "class", "handle progress"), handleGroup));
        }

        if (collapsible) {
            renderer.addClass(barGroup, "collapsable");
            BoundingBox labelBox = renderer.getBoundingBox(bar.getLabel());
            if (g.getWidth() - labelBox.getWidth() > CARET_MIN_ROOM) {
                bar.setCaret(renderer.createShape("polygon",
                        attrs("points", caretPoints(geometry), "class", "caret"), handleGroup));
            }
        }
        updateLabelPosition(bar);
        return bar;
    }

    /**
     * Applies a new position. A width narrower than one column is not applied.
     */
    public void updateBarPosition(Bar bar, Double x, Double width, Double y, int columnWidth) {
        ShapeGeometry geometry = bar.getGeometry();
        if (x != null) {
            geometry.setX(x);
        }
        if (width != null && width >= columnWidth) {
            geometry.setWidth(width);
        }
        if (y != null) {
            geometry.setY(y);
        }
        updateLabelPosition(bar);
        updateHandlePosition(bar);
        updateProgressBarPosition(bar);
        updateArrowPosition(bar);
    }

    public void updateLabelPosition(Bar bar) {
        ShapeGeometry geometry = bar.getGeometry();
        ShapeHandle label = bar.getLabel();
        if (renderer.getBoundingBox(label).getWidth() > geometry.getWidth()) {
            renderer.addClass(label, "big");
            renderer.setAttribute(label, "x", geometry.getEndX() + 5);
        } else {
            renderer.removeClass(label, "big");
            renderer.setAttribute(label, "x", geometry.getX() + geometry.getWidth() / 2);
        }
        renderer.setAttribute(label, "y", geometry.getY() + geometry.getHeight() / 2);
    }

    public void updateHandlePosition(Bar bar) {
        ShapeGeometry geometry = bar.getGeometry();
        if (!bar.isInvalid()) {
            renderer.setAttribute(bar.getLeftHandle(), "x", geometry.getX() + 1);
            renderer.setAttribute(bar.getLeftHandle(), "y", geometry.getY() + 1);
            renderer.setAttribute(bar.getRightHandle(), "x", geometry.getEndX() - 9);
            renderer.setAttribute(bar.getRightHandle(), "y", geometry.getY() + 1);
        }
        if (bar.getCaret() != null) {
            renderer.setAttribute(bar.getCaret(), "points", caretPoints(geometry));
        }
        updateProgressHandle(bar);
    }

    public void updateProgressHandle(Bar bar) {
        if (bar.getProgressHandle() != null) {
            renderer.setAttribute(bar.getProgressHandle(), "points", progressPolygonPoints(bar));
        }
    }

    public void updateProgressBarPosition(Bar bar) {
        ShapeGeometry progress = bar.getProgressGeometry();
        if (progress == null) {
            return;
        }
        ShapeGeometry geometry = bar.getGeometry();
        progress.setX(geometry.getX());
        progress.setY(geometry.getY());
        progress.setWidth(geometry.getWidth() * bar.getTask().getProgress() / 100.0);
        updateProgressHandle(bar);
    }

    public void updateArrowPosition(Bar bar) {
        for (ArrowPath arrow : bar.getArrows()) {
            updateArrow(arrow);
        }
    }

    public void updateArrow(ArrowPath arrow) {
        String path = arrowRouter.route(arrow.getFrom().getGeometry(), arrow.getTo().getGeometry());
        arrow.setPath(path);
        if (arrow.getShape() != null) {
            renderer.setAttribute(arrow.getShape(), "d", path);
        }
    }

    public void setActive(Bar bar, boolean active) {
        if (active) {
            renderer.addClass(bar.getGroup(), "active");
        } else {
            renderer.removeClass(bar.getGroup(), "active");
        }
    }

    String progressPolygonPoints(Bar bar) {
        ShapeGeometry p = bar.getProgressGeometry();
        double endX = p.getEndX();
        double bottom = p.getY() + p.getHeight();
        return ArrowRouter.n(endX - 5) + "," + ArrowRouter.n(bottom) + ","
                + ArrowRouter.n(endX + 5) + "," + ArrowRouter.n(bottom) + ","
                + ArrowRouter.n(endX) + "," + (bottom - 8.66);
    }

    String caretPoints(ShapeGeometry geometry) {
        double caretX = geometry.getEndX() - 20;
        double caretY = geometry.getY() + geometry.getHeight() / 2;
        return ArrowRouter.n(caretX - CARET_WIDTH / 2.0) + "," + ArrowRouter.n(caretY - CARET_HEIGHT / 2.0) + " "
                + ArrowRouter.n(caretX) + "," + ArrowRouter.n(caretY + CARET_HEIGHT / 2.0) + " "
                + ArrowRouter.n(caretX + CARET_WIDTH / 2.0) + "," + ArrowRouter.n(caretY - CARET_HEIGHT / 2.0);
    }

    static Map<String, Object> attrs(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }
}
