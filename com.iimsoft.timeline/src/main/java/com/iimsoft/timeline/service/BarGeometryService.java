package com.iimsoft.timeline.service;

import com.iimsoft.timeline.calendar.DateUnit;
import com.iimsoft.timeline.calendar.DateUtils;
import com.iimsoft.timeline.calendar.ViewMode;
import com.iimsoft.timeline.config.GanttOptions;
import com.iimsoft.timeline.domain.BarGeometry;
import com.iimsoft.timeline.domain.DateSpan;
import com.iimsoft.timeline.domain.Task;

import java.time.LocalDateTime;

/**
 * Dates ↔ pixels.
 *
 * <p>x is the time from the chart start to the task start in columns, times the column width. Month view
 * measures that distance in days over 30 instead of hours over the step. Widths always use hours.
 */
public class BarGeometryService {

    private final GanttOptions options;

    public BarGeometryService(GanttOptions options) {
        this.options = options;
    }

    public BarGeometry toGeometry(Task task, int rowIndex, TimeScale scale, LocalDateTime ganttStart) {
        double x = computeX(task.getStart(), scale, ganttStart);
        double y = computeY(rowIndex);
        double width = computeWidth(task.getStart(), task.getEnd(), scale);
        double progressWidth = width * task.getProgress() / 100.0;
        return new BarGeometry(x, y, width, options.getBarHeight(), progressWidth);
    }

    public double computeX(LocalDateTime start, TimeScale scale, LocalDateTime ganttStart) {
        int cw = scale.getColumnWidth();
        if (scale.is(ViewMode.MONTH)) {
            long days = DateUtils.diff(start, ganttStart, DateUnit.DAY);
            return days * cw / 30.0;
        }
        long hours = DateUtils.diff(start, ganttStart, DateUnit.HOUR);
        return (double) hours / scale.getStep() * cw;
    }

    public double computeWidth(LocalDateTime start, LocalDateTime end, TimeScale scale) {
        long hours = DateUtils.diff(end, start, DateUnit.HOUR);
        return (double) hours / scale.getStep() * scale.getColumnWidth();
    }

    public double computeY(int rowIndex) {
        return options.getHeaderHeight() + options.getPadding() + (double) rowIndex * options.getRowHeight();
    }

    /**
     * Inverse of {@link #toGeometry}: pixels to columns to hours, rounded to whole hours.
     */
    public DateSpan fromGeometry(double x, double width, TimeScale scale, LocalDateTime ganttStart) {
        double cw = scale.getColumnWidth();
        long startHours = Math.round(x / cw * scale.getStep());
        LocalDateTime start = DateUtils.add(ganttStart, startHours, DateUnit.HOUR);
        long widthHours = Math.round(width / cw * scale.getStep());
        LocalDateTime end = DateUtils.add(start, widthHours, DateUnit.HOUR);
        return new DateSpan(start, end);
    }

    /**
     * Quantizes a drag delta to the nearest {@link TimeScale#snapUnit()}; exact halves round up.
     */
    public double snap(double dx, TimeScale scale) {
        double unit = scale.snapUnit();
        return Math.floor(dx / unit + 0.5) * unit;
    }

    /** Progress percentage shown by a progress rectangle of the given width, truncated. */
    public int progress(double progressWidth, double width) {
        if (width <= 0) {
            return 0;
        }
        int p = (int) (progressWidth / width * 100);
        return Math.max(0, Math.min(100, p));
    }
}
