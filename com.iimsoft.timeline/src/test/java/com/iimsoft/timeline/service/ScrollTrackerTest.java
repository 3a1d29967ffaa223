package com.iimsoft.timeline.service;

import com.iimsoft.timeline.calendar.ViewMode;
import com.iimsoft.timeline.config.GanttOptions;
import com.iimsoft.timeline.domain.Task;
import com.iimsoft.timeline.util.Debouncer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ScrollTrackerTest {

    private static final LocalDateTime GANTT_START = LocalDateTime.of(2023, 11, 10, 0, 0);

    private final Debouncer debouncer = new Debouncer(ScrollTracker.DEBOUNCE_MILLIS);
    private final BarGeometryService geometryService = new BarGeometryService(new GanttOptions());
    private final ScrollTracker tracker = new ScrollTracker(geometryService, debouncer);
    private final TimeScale scale = new TimeScale(ViewMode.DAY);

    @AfterEach
    void close() {
        debouncer.close();
    }

    private static Task taskAt(LocalDateTime start) {
        Task task = new Task("t", "t", null, null);
        task.setStart(start);
        task.setEnd(start.plusDays(1));
        return task;
    }

    @Test
    void firstRenderScrollsToOneColumnBeforeOldestTask() {
        double left = tracker.restore(List.of(
                taskAt(LocalDateTime.of(2024, 1, 12, 0, 0)),
                taskAt(LocalDateTime.of(2024, 1, 10, 0, 0))), scale, GANTT_START);

        assertThat(left).isEqualTo(61 * 38 - 38);
    }

    @Test
    void neverScrollsBeforeTheChartStart() {
        assertThat(tracker.restore(List.of(taskAt(GANTT_START)), scale, GANTT_START)).isZero();
        assertThat(tracker.restore(List.of(), scale, GANTT_START)).isZero();
    }

    @Test
    void middleDateIsRecordedOnceScrollingSettles() throws InterruptedException {
        tracker.onScroll(500, scale, GANTT_START);
        tracker.onScroll(1000, scale, GANTT_START);
        assertThat(tracker.getScrollLeft()).isEqualTo(1000);

        Thread.sleep(300);

        // (1000 + 500) / 38 days of 24h, rounded to the hour
        assertThat(tracker.getMiddleDate()).isEqualTo(LocalDateTime.of(2023, 12, 19, 11, 0));
    }

    @Test
    void scaleChangeBeforeTheScrollSettlesIsIgnored() throws InterruptedException {
        tracker.onScroll(1000, scale, GANTT_START);
        scale.applyScale(ViewMode.MONTH);

        Thread.sleep(300);

        assertThat(tracker.getMiddleDate()).isEqualTo(LocalDateTime.of(2023, 12, 19, 11, 0));
    }

    @Test
    void closedTrackerRecordsNothing() throws InterruptedException {
        tracker.close();
        tracker.onScroll(1000, scale, GANTT_START);

        Thread.sleep(150);

        assertThat(tracker.isClosed()).isTrue();
        assertThat(tracker.getMiddleDate()).isNull();
    }

    @Test
    void restoreReturnsToTheRecordedMiddleDate() throws InterruptedException {
        tracker.onScroll(1000, scale, GANTT_START);
        Thread.sleep(300);

        double left = tracker.restore(List.of(taskAt(LocalDateTime.of(2024, 1, 10, 0, 0))), scale, GANTT_START);

        assertThat(left).isCloseTo(1000, within(1.0));
    }

    @Test
    void restoreFollowsTheMiddleDateAcrossViewModes() throws InterruptedException {
        tracker.onScroll(1000, scale, GANTT_START);
        Thread.sleep(300);

        TimeScale week = new TimeScale(ViewMode.WEEK);
        double left = tracker.restore(List.of(), week, GANTT_START);

        // middle date is 947h after the start, a week column is 140px
        assertThat(left).isCloseTo(947.0 / 168 * 140 - 500, within(0.001));
    }
}
