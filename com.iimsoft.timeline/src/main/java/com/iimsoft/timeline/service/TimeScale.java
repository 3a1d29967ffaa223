package com.iimsoft.timeline.service;

import com.iimsoft.timeline.calendar.DateUnit;
import com.iimsoft.timeline.calendar.DateUtils;
import com.iimsoft.timeline.calendar.ViewMode;
import com.iimsoft.timeline.domain.GanttRange;
import com.iimsoft.timeline.domain.Task;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Current resolution of the chart: the view mode with its step (hours per column) and column width.
 */
public class TimeScale {

    private ViewMode viewMode;
    private int step;
    private int columnWidth;

    public TimeScale(ViewMode viewMode) {
        applyScale(viewMode);
    }

    public void applyScale(ViewMode mode) {
        this.viewMode = Objects.requireNonNull(mode, "mode");
        this.step = mode.getStep();
        this.columnWidth = mode.getColumnWidth();
    }

    public ViewMode getViewMode() {
        return viewMode;
    }

    public int getStep() {
        return step;
    }

    public int getColumnWidth() {
        return columnWidth;
    }

    public boolean is(ViewMode... modes) {
        for (ViewMode m : modes) {
            if (m == viewMode) return true;
        }
        return false;
    }

    /**
     * Pixel quantum a drag delta snaps to: a day in Week and Month views, a whole column otherwise.
     */
    public double snapUnit() {
        if (viewMode == ViewMode.WEEK) {
            return columnWidth / 7.0;
        }
        if (viewMode == ViewMode.MONTH) {
            return columnWidth / 30.0;
        }
        return columnWidth;
    }

    /**
     * Min start / max end over the tasks, floored to days and padded per mode.
     * An empty task list is centred on {@code today}.
     */
    public static GanttRange computeRange(List<Task> tasks, ViewMode mode, LocalDateTime today) {
        LocalDateTime start = null;
        LocalDateTime end = null;
        for (Task task : tasks) {
            if (start == null || task.getStart().isBefore(start)) {
                start = task.getStart();
            }
            if (end == null || task.getEnd().isAfter(end)) {
                end = task.getEnd();
            }
        }
        if (start == null) {
            start = today;
            end = today;
        }
        start = DateUtils.startOf(start, DateUnit.DAY);
        end = DateUtils.startOf(end, DateUnit.DAY);

        switch (mode) {
            case YEAR:
                LocalDateTime padded = DateUtils.add(start, -6, DateUnit.YEAR);
                start = LocalDate.of(padded.getYear(), 1, 1).atStartOfDay();
                end = DateUtils.add(end, 6, DateUnit.YEAR);
                break;
            case MONTH:
                start = DateUtils.add(start, -8, DateUnit.MONTH);
                end = DateUtils.add(end, 8, DateUnit.MONTH);
                break;
            default:
                start = DateUtils.add(start, -2, DateUnit.MONTH);
                end = DateUtils.add(end, 2, DateUnit.MONTH);
                break;
        }
        return new GanttRange(start, end);
    }
}
