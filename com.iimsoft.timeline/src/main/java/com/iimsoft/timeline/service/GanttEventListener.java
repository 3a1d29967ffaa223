package com.iimsoft.timeline.service;

import com.iimsoft.timeline.calendar.ViewMode;
import com.iimsoft.timeline.domain.Task;

import java.time.LocalDateTime;

/**
 * Callbacks fired by the chart. Every method has an empty default so callers implement only what they need.
 */
public interface GanttEventListener {

    /**
     * @param endInclusive the new exclusive end minus one second
     */
    default void onDateChange(Task task, LocalDateTime start, LocalDateTime endInclusive) {
    }

    default void onProgressChange(Task task, int progress) {
    }

    default void onViewChange(ViewMode mode) {
    }

    default void onClick(Task task) {
    }
}
