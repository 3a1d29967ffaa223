package com.iimsoft.timeline.service;

import com.iimsoft.timeline.calendar.ViewMode;
import com.iimsoft.timeline.config.GanttOptions;
import com.iimsoft.timeline.domain.Bar;
import com.iimsoft.timeline.domain.Task;
import com.iimsoft.timeline.render.Gesture;
import com.iimsoft.timeline.render.PointerEvent;
import com.iimsoft.timeline.render.ShapeHandle;
import com.iimsoft.timeline.render.SvgShapeRenderer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class GanttChartTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-20T10:00:00Z"));
    private final List<GanttChart> charts = new ArrayList<>();
    private SvgShapeRenderer renderer;

    @BeforeEach
    void setUp() {
        renderer = new SvgShapeRenderer();
    }

    @AfterEach
    void closeCharts() {
        charts.forEach(GanttChart::close);
    }

    private static Task task(String id, String start, String end, String... deps) {
        Task t = new Task(id, id, start, end);
        t.setDependencies(new ArrayList<>(List.of(deps)));
        return t;
    }

    private GanttChart chart(GanttOptions options, Task... tasks) {
        GanttChart chart = new GanttChart(renderer, new ArrayList<>(List.of(tasks)), options, clock);
        charts.add(chart);
        return chart;
    }

    @Test
    void rejectsMissingRenderer() {
        assertThatThrownBy(() -> new GanttChart(null, new ArrayList<>(), new GanttOptions(), clock))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNonSvgRoot() {
        SvgShapeRenderer notSvg = new SvgShapeRenderer() {
            @Override
            public ShapeHandle getRoot() {
                return () -> "g";
            }
        };

        assertThatThrownBy(() -> new GanttChart(notSvg, new ArrayList<>(), new GanttOptions(), clock))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("svg");
    }

    @Test
    void rendersLayersInOrder() {
        chart(new GanttOptions(), task("a", "2024-01-10", "2024-01-11"));

        assertThat(renderer.getChildren(renderer.getRoot()))
                .extracting(h -> renderer.getAttribute(h, "class"))
                .containsExactly("grid", "arrow", "progress", "bar", "details", "date");
    }

    @Test
    void rendersRowsBarsAndArrows() {
        GanttChart chart = chart(new GanttOptions(),
                task("a", "2024-01-10", "2024-01-11"),
                task("b", "2024-01-12", "2024-01-13", "a"),
                task("c", "2024-01-12", "2024-01-13", "a", "ghost"));

        assertThat(renderer.findByClass("grid-row")).hasSize(3);
        assertThat(renderer.findByClass("bar-wrapper")).hasSize(3);
        assertThat(chart.getArrows()).hasSize(2);
        assertThat(renderer.getChildren(chart.getLayer("arrow")))
                .hasSize(2)
                .allSatisfy(h -> assertThat(h.getKind()).isEqualTo("path"));
        assertThat(chart.getBar("a").getArrows()).hasSize(2);
        assertThat(chart.getBar("b").getArrows()).hasSize(1);
        assertThat(renderer.getAttribute(chart.getBar("b").getArrows().get(0).getShape(), "d"))
                .isEqualTo(chart.getBar("b").getArrows().get(0).getPath());
    }

    @Test
    void barGeometryFollowsDates() {
        GanttChart chart = chart(new GanttOptions(),
                task("a", "2024-01-10", "2024-01-11"),
                task("b", "2024-01-12", "2024-01-13"));

        assertThat(chart.getRange().getStart()).isEqualTo(LocalDateTime.of(2023, 11, 10, 0, 0));
        Bar b = chart.getBar("b");
        assertThat(b.getGeometry().getX()).isEqualTo(63 * 38);
        assertThat(b.getGeometry().getY()).isEqualTo(50 + 18 + 38);
        assertThat(b.getGeometry().getWidth()).isEqualTo(76);
    }

    @Test
    void dateOnlyEndIncludesTheLastDay() {
        GanttChart chart = chart(new GanttOptions(), task("a", "2024-01-10", "2024-01-12"));

        // 72h: the end date is drawn up to its midnight
        assertThat(chart.getBar("a").getGeometry().getWidth()).isEqualTo(3 * 38);
    }

    @Test
    void invalidTaskHasNoHandles() {
        GanttChart chart = chart(new GanttOptions(), task("a", "2024-01-10", null));

        Bar bar = chart.getBar("a");
        assertThat(bar.isInvalid()).isTrue();
        assertThat(renderer.hasClass(bar.getGeometry().getHandle(), "bar-invalid")).isTrue();
        assertThat(bar.getLeftHandle()).isNull();
        assertThat(bar.getProgressHandle()).isNull();
        assertThat(bar.getProgressGeometry()).isNull();
    }

    @Test
    void caretOnlyForTasksWithDependents() {
        GanttChart chart = chart(new GanttOptions(),
                task("a", "2024-01-10", "2024-01-11"),
                task("b", "2024-01-12", "2024-01-13", "a"));

        assertThat(chart.getBar("a").getCaret()).isNotNull();
        assertThat(chart.getBar("b").getCaret()).isNull();
    }

    @Test
    void todayIsHighlightedInDayViewOnly() {
        GanttChart chart = chart(new GanttOptions(), task("a", "2024-01-10", "2024-01-11"));

        List<ShapeHandle> highlight = renderer.findByClass("today-highlight");
        assertThat(highlight).hasSize(1);
        // 2024-01-20 is 71 days after 2023-11-10
        assertThat(renderer.getAttribute(highlight.get(0), "x")).isEqualTo(71.0 * 38);

        chart.changeViewMode(ViewMode.WEEK);
        assertThat(renderer.findByClass("today-highlight")).isEmpty();
    }

    @Test
    void hiddenTasksAreNotDrawn() {
        Task hidden = task("b", "2024-01-12", "2024-01-13", "a");
        hidden.setVisible(false);
        GanttChart chart = chart(new GanttOptions(), task("a", "2024-01-10", "2024-01-11"), hidden);

        assertThat(chart.getTasks()).hasSize(2);
        assertThat(chart.getVisibleTasks()).extracting(Task::getId).containsExactly("a");
        assertThat(chart.getBar("b")).isNull();
        assertThat(chart.getTask("b")).isSameAs(hidden);
        assertThat(chart.getArrows()).isEmpty();
    }

    @Test
    void changeViewModeFiresEvent() {
        GanttChart chart = chart(new GanttOptions(), task("a", "2024-01-10", "2024-01-11"));
        RecordingListener listener = new RecordingListener();
        chart.addListener(listener);

        chart.changeViewMode(ViewMode.MONTH);

        assertThat(listener.events).containsExactly("view_change Month");
        assertThat(chart.getScale().getColumnWidth()).isEqualTo(120);
        assertThat(chart.getRange().getStart()).isEqualTo(LocalDateTime.of(2023, 5, 10, 0, 0));
        assertThat(chart.getTicks()).isNotEmpty();
    }

    @Test
    void removedListenerHearsNothing() {
        GanttChart chart = chart(new GanttOptions(), task("a", "2024-01-10", "2024-01-11"));
        RecordingListener listener = new RecordingListener();
        chart.addListener(listener);
        chart.removeListener(listener);

        chart.changeViewMode(ViewMode.WEEK);

        assertThat(listener.events).isEmpty();
        assertThat(renderer.getChildren(chart.getLayer("bar"))).hasSize(1);
    }

    @Test
    void zoomStepsThroughModesAndStopsAtTheEnds() {
        GanttOptions options = new GanttOptions();
        options.setViewMode(ViewMode.HALF_DAY);
        GanttChart chart = chart(options, task("a", "2024-01-10", "2024-01-11"));
        RecordingListener listener = new RecordingListener();
        chart.addListener(listener);

        chart.zoom(1);
        chart.zoom(1);
        assertThat(chart.getOptions().getViewMode()).isEqualTo(ViewMode.QUARTER_DAY);

        chart.zoom(-1);
        chart.zoom(-1);
        assertThat(chart.getOptions().getViewMode()).isEqualTo(ViewMode.DAY);
        assertThat(listener.events).containsExactly(
                "view_change Quarter Day", "view_change Half Day", "view_change Day");
    }

    @Test
    void optionsAreCopied() {
        GanttOptions options = new GanttOptions();
        GanttChart chart = chart(options, task("a", "2024-01-10", "2024-01-11"));

        chart.changeViewMode(ViewMode.YEAR);

        assertThat(options.getViewMode()).isEqualTo(ViewMode.DAY);
    }

    @Test
    void initialScrollIsOneColumnBeforeOldestTask() {
        GanttChart chart = chart(new GanttOptions(),
                task("a", "2024-01-12", "2024-01-13"),
                task("b", "2024-01-10", "2024-01-11"));

        assertThat(chart.getScrollTracker().getScrollLeft()).isEqualTo(61 * 38 - 38);
        assertThat(renderer.getAttribute(renderer.getRoot(), "data-scroll-left")).isEqualTo(61.0 * 38 - 38);
    }

    @Test
    void scrollIsRestoredAfterRerender() throws InterruptedException {
        GanttChart chart = chart(new GanttOptions(), task("a", "2024-01-10", "2024-01-11"));

        renderer.dispatch(renderer.getRoot(), Gesture.SCROLL, new PointerEvent(1000, 0));
        Thread.sleep(300);
        assertThat(chart.getScrollTracker().getMiddleDate()).isNotNull();

        chart.render();

        assertThat(chart.getScrollTracker().getScrollLeft()).isCloseTo(1000, within(1.0));
    }

    @Test
    void viewChangeRightAfterScrollKeepsTheScrolledDate() throws InterruptedException {
        GanttChart chart = chart(new GanttOptions(), task("a", "2024-01-10", "2024-01-11"));

        renderer.dispatch(renderer.getRoot(), Gesture.SCROLL, new PointerEvent(1000, 0));
        chart.changeViewMode(ViewMode.MONTH);
        Thread.sleep(300);

        // middle of the Day viewport: 1500px = 947h after 2023-11-10
        assertThat(chart.getScrollTracker().getMiddleDate()).isEqualTo(LocalDateTime.of(2023, 12, 19, 11, 0));
    }

    @Test
    void closeStopsScrollTracking() throws InterruptedException {
        GanttChart chart = chart(new GanttOptions(), task("a", "2024-01-10", "2024-01-11"));

        chart.close();
        renderer.dispatch(renderer.getRoot(), Gesture.SCROLL, new PointerEvent(1000, 0));
        Thread.sleep(150);

        assertThat(chart.getScrollTracker().isClosed()).isTrue();
        assertThat(chart.getScrollTracker().getMiddleDate()).isNull();
        assertThat(chart.getScrollTracker().getScrollLeft()).isEqualTo(1000);
    }

    @Test
    void refreshReplacesTasks() {
        GanttChart chart = chart(new GanttOptions(), task("a", "2024-01-10", "2024-01-11"));

        chart.refresh(List.of(task("x", "2024-02-01", "2024-02-02"), task("y", "2024-02-03", "2024-02-04", "x")));

        assertThat(chart.getBar("a")).isNull();
        assertThat(chart.getBars()).hasSize(2);
        assertThat(chart.getGraph().descendants("x")).containsExactly("y");
    }

    @Test
    void clickSelectsAndGridClickUnselects() {
        GanttChart chart = chart(new GanttOptions(), task("a", "2024-01-10", "2024-01-11"));
        Bar bar = chart.getBar("a");

        renderer.dispatch(bar.getGeometry().getHandle(), Gesture.CLICK, new PointerEvent(0, 0));
        assertThat(renderer.hasClass(bar.getGroup(), "active")).isTrue();

        renderer.dispatch(renderer.findByClass("grid-row").get(0), Gesture.CLICK, new PointerEvent(0, 0));
        assertThat(renderer.hasClass(bar.getGroup(), "active")).isFalse();
    }

    @Test
    void gridDragPansTheChart() {
        GanttChart chart = chart(new GanttOptions(), task("a", "2024-01-10", "2024-01-11"));
        double before = chart.getScrollTracker().getScrollLeft();
        ShapeHandle row = renderer.findByClass("grid-row").get(0);

        renderer.dispatch(row, Gesture.PRESS, new PointerEvent(500, 80));
        renderer.dispatch(renderer.getRoot(), Gesture.MOVE, new PointerEvent(480, 80));
        renderer.dispatch(renderer.getRoot(), Gesture.RELEASE, new PointerEvent(480, 80));

        assertThat(chart.getScrollTracker().getScrollLeft()).isEqualTo(before + 30);
        assertThat(chart.getInteraction().getState()).isEqualTo(InteractionState.IDLE);
    }

    @Test
    void exportableSvg() {
        chart(new GanttOptions(), task("a", "2024-01-10", "2024-01-11"));

        String svg = renderer.toSvg();

        assertThat(svg).contains("class=\"grid-background\"", "class=\"bar-label\"", "class=\"lower-text\"");
    }
}
