package com.iimsoft.timeline.service;

import com.iimsoft.timeline.domain.Task;
import com.iimsoft.timeline.util.Debouncer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Remembers which date sits in the middle of the viewport so a re-render can scroll back to it.
 */
public class ScrollTracker implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ScrollTracker.class);

    public static final long DEBOUNCE_MILLIS = 50;
    public static final double DEFAULT_VIEWPORT_WIDTH = 1000;

    private final BarGeometryService geometryService;
    private final Debouncer debouncer;
    private double viewportWidth = DEFAULT_VIEWPORT_WIDTH;
    private volatile double scrollLeft;
    private volatile LocalDateTime middleDate;

    public ScrollTracker(BarGeometryService geometryService, Debouncer debouncer) {
        this.geometryService = geometryService;
        this.debouncer = debouncer;
    }

    /**
     * Stores the new offset right away; the middle date is recorded once scrolling settles.
     * The scale is copied here, the debounced action must not see later view changes.
     */
    public void onScroll(double scrollLeft, TimeScale scale, LocalDateTime ganttStart) {
        this.scrollLeft = scrollLeft;
        double middleX = scrollLeft + viewportWidth / 2;
        TimeScale atScroll = new TimeScale(scale.getViewMode());
        debouncer.call(() -> {
            middleDate = dateAt(middleX, atScroll, ganttStart);
            LOGGER.debug("Viewport centred on {}", middleDate);
        });
    }

    /**
     * Scroll offset for a fresh render: back to the recorded middle date, or one column before the oldest
     * task start when nothing was recorded yet.
     */
    public double restore(List<Task> tasks, TimeScale scale, LocalDateTime ganttStart) {
        double left;
        if (middleDate != null) {
            left = geometryService.computeX(middleDate, scale, ganttStart) - viewportWidth / 2;
        } else {
            LocalDateTime oldest = null;
            for (Task task : tasks) {
                if (oldest == null || task.getStart().isBefore(oldest)) {
                    oldest = task.getStart();
                }
            }
            if (oldest == null) {
                left = 0;
            } else {
                left = geometryService.computeX(oldest, scale, ganttStart) - scale.getColumnWidth();
            }
        }
        scrollLeft = Math.max(0, left);
        return scrollLeft;
    }

    LocalDateTime dateAt(double x, TimeScale scale, LocalDateTime ganttStart) {
        return geometryService.fromGeometry(x, 0, scale, ganttStart).getStart();
    }

    public double getScrollLeft() {
        return scrollLeft;
    }

    public LocalDateTime getMiddleDate() {
        return middleDate;
    }

    public void setViewportWidth(double viewportWidth) {
        this.viewportWidth = viewportWidth;
    }

    public double getViewportWidth() {
        return viewportWidth;
    }

    public boolean isClosed() {
        return debouncer.isClosed();
    }

    /** Drops any pending middle-date update and stops the debouncer thread. */
    @Override
    public void close() {
        debouncer.close();
    }
}
