package com.iimsoft.timeline.service;

import com.iimsoft.timeline.calendar.DateUnit;
import com.iimsoft.timeline.calendar.DateUtils;
import com.iimsoft.timeline.domain.Bar;
import com.iimsoft.timeline.domain.DateSpan;
import com.iimsoft.timeline.domain.Task;
import com.iimsoft.timeline.render.PointerEvent;
import com.iimsoft.timeline.render.ShapeGeometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Pointer gesture state machine of the chart.
 *
 * <p>A press picks the gesture (drag, left / right resize, progress resize or collapse caret), moves
 * update geometry from the press origin, and the release commits geometry back to dates. Only one
 * gesture is tracked at a time; presses arriving while one is in flight are ignored, and only a
 * release leaves a non-idle state.
 *
 * <p>Moving or left-resizing a bar shifts every descendant by the same snapped delta. Ancestor bars of
 * type project or tag are re-fitted around their descendants on every move.
 */
public class BarInteractionService {

    private static final Logger LOGGER = LoggerFactory.getLogger(BarInteractionService.class);

    /** Pointer travel beyond which a caret press is no longer a click. */
    static final double CLICK_THRESHOLD = 5;
    /** Window after a gesture during which clicks on the bar are ignored. */
    static final Duration ACTION_COOLDOWN = Duration.ofSeconds(1);

    private final GanttChart chart;

    private InteractionState state = InteractionState.IDLE;
    private Bar primary;
    private List<Bar> movingBars = Collections.emptyList();
    private List<Bar> ancestorBars = Collections.emptyList();
    private double xOnStart;
    private double yOnStart;

    // pending caret press
    private Bar caretBar;
    private boolean caretMoved;

    public BarInteractionService(GanttChart chart) {
        this.chart = chart;
    }

    public InteractionState getState() {
        return state;
    }

    /** Bar the current gesture started on, null while idle. */
    public Bar getPrimary() {
        return primary;
    }

    public void press(Bar bar, PressTarget target, PointerEvent e) {
        if (state != InteractionState.IDLE || caretBar != null) {
            LOGGER.debug("Ignoring press on {} while {}", bar.getTask().getId(), state);
            return;
        }
        xOnStart = e.getX();
        yOnStart = e.getY();

        switch (target) {
            case CARET:
                caretBar = bar;
                caretMoved = false;
                return;
            case PROGRESS_HANDLE:
                if (bar.getProgressGeometry() == null) {
                    return;
                }
                primary = bar;
                bar.markProgressOrigin();
                state = InteractionState.RESIZING_PROGRESS;
                return;
            case LEFT_HANDLE:
            case RIGHT_HANDLE:
                if (bar.isInvalid()) {
                    return;
                }
                state = target == PressTarget.LEFT_HANDLE
                        ? InteractionState.RESIZING_LEFT
                        : InteractionState.RESIZING_RIGHT;
                break;
            case BODY:
            default:
                state = InteractionState.DRAGGING;
                break;
        }

        primary = bar;
        chart.getPainter().setActive(bar, true);

        List<Bar> moving = new ArrayList<>();
        moving.add(bar);
        for (String id : chart.getGraph().descendants(bar.getTask().getId())) {
            Bar b = chart.getBar(id);
            if (b != null) {
                moving.add(b);
            }
        }
        List<Bar> ancestors = new ArrayList<>();
        for (String id : chart.getGraph().ancestors(bar.getTask().getId())) {
            Bar b = chart.getBar(id);
            if (b != null) {
                ancestors.add(b);
            }
        }
        moving.forEach(Bar::markOrigin);
        ancestors.forEach(Bar::markOrigin);
        movingBars = moving;
        ancestorBars = ancestors;
        LOGGER.debug("{} started on {} ({} dependents, {} ancestors)",
                state, bar.getTask().getId(), moving.size() - 1, ancestors.size());
    }

    public void move(PointerEvent e) {
        if (caretBar != null) {
            if (distanceFromStart(e) > CLICK_THRESHOLD) {
                caretMoved = true;
            }
            return;
        }
        if (state == InteractionState.IDLE) {
            return;
        }
        if (state == InteractionState.RESIZING_PROGRESS) {
            moveProgress(e);
            return;
        }

        double dx = e.getX() - xOnStart;
        double dy = e.getY() - yOnStart;
        BarGeometryService geometryService = chart.getGeometryService();
        BarPainter painter = chart.getPainter();
        int columnWidth = chart.getScale().getColumnWidth();

        double snapped = geometryService.snap(dx, chart.getScale());
        if (state == InteractionState.RESIZING_LEFT && primary.getOriginWidth() - snapped < columnWidth
                || state == InteractionState.RESIZING_RIGHT && primary.getOriginWidth() + snapped < columnWidth) {
            // narrower than one column: keep the last accepted frame
            return;
        }
        primary.setFinalDx(snapped);
        switch (state) {
            case RESIZING_LEFT:
                painter.updateBarPosition(primary, primary.getOriginX() + snapped,
                        primary.getOriginWidth() - snapped, null, columnWidth);
                break;
            case RESIZING_RIGHT:
                painter.updateBarPosition(primary, null, primary.getOriginWidth() + snapped, null, columnWidth);
                break;
            default:
                Double y = null;
                if (chart.getOptions().isSortable()) {
                    y = clampY(primary.getOriginY() + dy);
                }
                painter.updateBarPosition(primary, primary.getOriginX() + snapped, null, y, columnWidth);
                break;
        }

        for (Bar bar : movingBars) {
            if (bar == primary) {
                continue;
            }
            if (state == InteractionState.RESIZING_LEFT || state.isMoving()) {
                bar.setFinalDx(snapped);
                painter.updateBarPosition(bar, bar.getOriginX() + snapped, null, null, columnWidth);
            }
        }

        updateEnvelopes();

        if (chart.getOptions().isSortable() && state.isMoving()
                && Math.abs(dy - primary.getFinalDy()) > primary.getHeight()) {
            state = InteractionState.SORTING;
            for (Bar bar : chart.sortBars()) {
                double y = geometryService.computeY(bar.getTask().getIndex());
                if (bar == primary) {
                    bar.setFinalDy(y - bar.getOriginY());
                    continue;
                }
                commitDates(bar);
                painter.updateBarPosition(bar, null, null, y, columnWidth);
            }
        }
    }

    private void moveProgress(PointerEvent e) {
        double dx = e.getX() - xOnStart;
        dx = Math.min(dx, primary.getProgressMaxDx());
        dx = Math.max(dx, primary.getProgressMinDx());
        primary.getProgressGeometry().setWidth(primary.getProgressOriginWidth() + dx);
        chart.getPainter().updateProgressHandle(primary);
        primary.setProgressFinalDx(dx);
    }

    /**
     * Fits every project / tag ancestor around its descendants. When the left edge moved both x and
     * width change, otherwise only the width.
     */
    private void updateEnvelopes() {
        int columnWidth = chart.getScale().getColumnWidth();
        for (Bar ancestor : ancestorBars) {
            if (!ancestor.getTask().getType().isEnvelope()) {
                continue;
            }
            double minX = Double.POSITIVE_INFINITY;
            double maxX = Double.NEGATIVE_INFINITY;
            for (String id : chart.getGraph().descendants(ancestor.getTask().getId())) {
                Bar b = chart.getBar(id);
                if (b == null) {
                    continue;
                }
                ShapeGeometry g = b.getGeometry();
                minX = Math.min(minX, g.getX());
                maxX = Math.max(maxX, g.getEndX());
            }
            if (minX > maxX) {
                continue;
            }
            if (minX != ancestor.getOriginX()) {
                chart.getPainter().updateBarPosition(ancestor, minX, maxX - minX, null, columnWidth);
            } else {
                chart.getPainter().updateBarPosition(ancestor, null, maxX - ancestor.getOriginX(), null, columnWidth);
            }
        }
    }

    public void release(PointerEvent e) {
        if (caretBar != null) {
            Bar bar = caretBar;
            boolean click = !caretMoved && distanceFromStart(e) <= CLICK_THRESHOLD;
            caretBar = null;
            caretMoved = false;
            if (click) {
                toggleCollapse(bar);
            }
            return;
        }
        if (state == InteractionState.IDLE) {
            return;
        }
        Instant now = chart.getClock().instant();
        try {
            if (state == InteractionState.RESIZING_PROGRESS) {
                releaseProgress(now);
                return;
            }
            double dy = e.getY() - yOnStart;
            for (Bar bar : movingBars) {
                chart.getPainter().setActive(bar, false);
                if (bar.getFinalDx() != 0) {
                    commitDates(bar);
                    bar.setActionCompleted(now.plus(ACTION_COOLDOWN));
                }
            }
            for (Bar ancestor : ancestorBars) {
                if (ancestor.getTask().getType().isEnvelope() && ancestor.movedSinceOrigin()) {
                    commitDates(ancestor);
                }
            }
            if (chart.getOptions().isSortable() && dy != primary.getFinalDy()) {
                chart.getPainter().updateBarPosition(primary, null, null,
                        primary.getOriginY() + primary.getFinalDy(), chart.getScale().getColumnWidth());
                commitDates(primary);
            }
        } finally {
            state = InteractionState.IDLE;
            primary = null;
            movingBars = Collections.emptyList();
            ancestorBars = Collections.emptyList();
        }
    }

    private void releaseProgress(Instant now) {
        if (primary.getProgressFinalDx() == 0) {
            return;
        }
        Task task = primary.getTask();
        int progress = chart.getGeometryService()
                .progress(primary.getProgressGeometry().getWidth(), primary.getGeometry().getWidth());
        task.setProgress(progress);
        primary.setActionCompleted(now.plus(ACTION_COOLDOWN));
        LOGGER.debug("Progress of {} set to {}", task.getId(), progress);
        chart.fireProgressChange(task, progress);
    }

    /**
     * Converts the bar's geometry back to dates and stores them when they differ from the task's.
     *
     * @return whether the task's dates changed
     */
    boolean commitDates(Bar bar) {
        ShapeGeometry g = bar.getGeometry();
        DateSpan span = chart.getGeometryService()
                .fromGeometry(g.getX(), g.getWidth(), chart.getScale(), chart.getRange().getStart());
        Task task = bar.getTask();
        if (span.getStart().equals(task.getStart()) && span.getEnd().equals(task.getEnd())) {
            return false;
        }
        TaskNormalizer.writeBack(task, span.getStart(), span.getEnd());
        LOGGER.debug("Dates of {} changed to {}", task.getId(), span);
        chart.fireDateChange(task, span.getStart(), DateUtils.add(span.getEnd(), -1, DateUnit.SECOND));
        return true;
    }

    /**
     * Flips the collapsed flag and hides (or shows again) the bar's descendants, then refreshes the chart.
     */
    public void toggleCollapse(Bar bar) {
        Task parent = bar.getTask();
        parent.setCollapsed(!parent.isCollapsed());
        for (String id : chart.getGraph().descendants(parent.getId())) {
            Task task = chart.getTask(id);
            if (task == null) {
                continue;
            }
            boolean hide = parent.isCollapsed() || firstDependencyCollapsed(task);
            task.setVisible(!hide);
        }
        LOGGER.debug("{} {}", parent.isCollapsed() ? "Collapsed" : "Expanded", parent.getId());
        chart.refresh(chart.getTasks());
    }

    private boolean firstDependencyCollapsed(Task task) {
        if (task.getDependencies().isEmpty()) {
            return false;
        }
        Task dependency = chart.getTask(task.getDependencies().get(0));
        return dependency != null && dependency.isCollapsed();
    }

    /** Popup trigger on a bar: selects it unless it just finished a gesture. */
    public void select(Bar bar) {
        if (bar.isInvalid() || bar.isActionCompleted(chart.getClock().instant())) {
            return;
        }
        chart.unselectAll();
        chart.getPainter().setActive(bar, true);
    }

    public void doubleClick(Bar bar) {
        if (bar.isInvalid() || bar.isActionCompleted(chart.getClock().instant())) {
            return;
        }
        chart.fireClick(bar.getTask());
    }

    private double clampY(double y) {
        double minY = chart.getOptions().getHeaderHeight();
        double maxY = chart.getOptions().getHeaderHeight()
                + (double) chart.getVisibleTasks().size() * chart.getOptions().getRowHeight();
        return Math.max(minY, Math.min(maxY, y));
    }

    private double distanceFromStart(PointerEvent e) {
        return Math.hypot(e.getX() - xOnStart, e.getY() - yOnStart);
    }
}
