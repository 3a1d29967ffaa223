package com.iimsoft.timeline.service;

import com.iimsoft.timeline.config.GanttOptions;
import com.iimsoft.timeline.render.ShapeGeometry;

/**
 * Routes the path of a dependency arrow.
 *
 * <p>Normal case: drop from the middle of the dependency bar, bend once, run right to just before
 * the dependent bar and end in a chevron. When the dependent starts left of
 * {@code from.x + padding} the arrow detours: drop, bend left, run past the dependent's left edge,
 * bend towards its row and approach it from the left.
 */
public class ArrowRouter {

    static final int START_SHIFT = 10;

    private final GanttOptions options;

    public ArrowRouter(GanttOptions options) {
        this.options = options;
    }

    public String route(ShapeGeometry from, ShapeGeometry to) {
        int padding = options.getPadding();
        int curve = options.getArrowCurve();
        int barHeight = options.getBarHeight();

        double startX = from.getX() + from.getWidth() / 2;
        // pull the start left until it clears the dependent, but never past the dependency's own padding
        while (to.getX() < startX + padding && startX > from.getX() + padding) {
            startX -= START_SHIFT;
        }
        double startY = from.getY() + barHeight;
        double endX = to.getX() - padding / 2.0;
        double endY = to.getY() + barHeight / 2.0;

        boolean fromIsBelowTo = from.getY() > to.getY();
        int clockwise = fromIsBelowTo ? 1 : 0;
        double curveY = fromIsBelowTo ? -curve : curve;
        double offset = fromIsBelowTo ? endY + curve : endY - curve;

        if (to.getX() < from.getX() + padding) {
            double down1 = padding / 2.0 - curve;
            double down2 = to.getY() + to.getHeight() / 2 - curveY;
            double left = to.getX() - padding;
            return "M " + n(startX) + " " + n(startY)
                    + " v " + n(down1)
                    + " a " + curve + " " + curve + " 0 0 1 -" + curve + " " + curve
                    + " H " + n(left)
                    + " a " + curve + " " + curve + " 0 0 " + clockwise + " -" + curve + " " + n(curveY)
                    + " V " + n(down2)
                    + " a " + curve + " " + curve + " 0 0 " + clockwise + " " + curve + " " + n(curveY)
                    + " L " + n(endX) + " " + n(endY)
                    + chevron();
        }
        return "M " + n(startX) + " " + n(startY)
                + " V " + n(offset)
                + " a " + curve + " " + curve + " 0 0 " + clockwise + " " + curve + " " + n(curveY)
                + " L " + n(endX) + " " + n(endY)
                + chevron();
    }

    private static String chevron() {
        return " m -5 -5 l 5 5 l -5 5";
    }

    static String n(double v) {
        if (v == Math.rint(v)) {
            return Long.toString((long) v);
        }
        return Double.toString(v);
    }
}
