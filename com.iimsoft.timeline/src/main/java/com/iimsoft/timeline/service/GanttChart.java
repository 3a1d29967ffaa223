package com.iimsoft.timeline.service;

import com.iimsoft.timeline.calendar.DateUnit;
import com.iimsoft.timeline.calendar.DateUtils;
import com.iimsoft.timeline.calendar.ViewMode;
import com.iimsoft.timeline.config.GanttOptions;
import com.iimsoft.timeline.domain.ArrowPath;
import com.iimsoft.timeline.domain.AxisTick;
import com.iimsoft.timeline.domain.Bar;
import com.iimsoft.timeline.domain.GanttRange;
import com.iimsoft.timeline.domain.Task;
import com.iimsoft.timeline.render.Gesture;
import com.iimsoft.timeline.render.PointerEvent;
import com.iimsoft.timeline.render.ShapeHandle;
import com.iimsoft.timeline.render.ShapeRenderer;
import com.iimsoft.timeline.util.Debouncer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.iimsoft.timeline.service.BarPainter.attrs;

/**
 * The chart: owns the tasks, the time scale and the bars drawn for them, and wires pointer gestures on the
 * drawing surface to {@link BarInteractionService}.
 *
 * <p>Every structural change (new tasks, collapse, view mode) goes through {@link #refresh(List)} or
 * {@link #changeViewMode(ViewMode)}, which re-normalize and redraw everything.
 *
 * <p>A chart owns a scroll debouncer thread; {@link #close()} releases it.
 */
public class GanttChart implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(GanttChart.class);

    static final String[] LAYERS = {"grid", "arrow", "progress", "bar", "details", "date"};
    /** Grid drag pans faster than the pointer. */
    static final double PAN_FACTOR = 1.5;
    /** Zooming out stops once columns are this narrow. */
    static final int MIN_ZOOM_COLUMN_WIDTH = 15;

    private final ShapeRenderer renderer;
    private final GanttOptions options;
    private final Clock clock;
    private final TaskNormalizer normalizer;
    private final DependencyGraph graph = new DependencyGraph();
    private final TimeScale scale;
    private final BarGeometryService geometryService;
    private final BarPainter painter;
    private final BarInteractionService interaction;
    private final ScrollTracker scrollTracker;
    private final List<GanttEventListener> listeners = new CopyOnWriteArrayList<>();

    private List<Task> tasks = Collections.emptyList();
    private List<Task> visibleTasks = Collections.emptyList();
    private final Map<String, Task> taskById = new LinkedHashMap<>();
    private final List<Bar> bars = new ArrayList<>();
    private final Map<String, Bar> barById = new LinkedHashMap<>();
    private final List<ArrowPath> arrows = new ArrayList<>();
    private final Map<String, ShapeHandle> layers = new LinkedHashMap<>();
    private GanttRange range;
    private List<AxisTick> ticks = Collections.emptyList();

    private boolean panning;
    private double panX;

    public GanttChart(ShapeRenderer renderer, List<Task> tasks, GanttOptions options) {
        this(renderer, tasks, options, Clock.systemDefaultZone());
    }

    /**
     * @throws IllegalArgumentException when the renderer has no usable "svg" root
     */
    public GanttChart(ShapeRenderer renderer, List<Task> tasks, GanttOptions options, Clock clock) {
        if (renderer == null) {
            throw new IllegalArgumentException("renderer must not be null");
        }
        ShapeHandle root = renderer.getRoot();
        if (root == null || !"svg".equals(root.getKind())) {
            throw new IllegalArgumentException("renderer root must be an svg shape, got "
                    + (root == null ? "null" : root.getKind()));
        }
        this.renderer = renderer;
        this.options = options == null ? new GanttOptions() : options.copy();
        this.clock = clock == null ? Clock.systemDefaultZone() : clock;
        this.normalizer = new TaskNormalizer(this.clock);
        this.scale = new TimeScale(this.options.getViewMode());
        this.geometryService = new BarGeometryService(this.options);
        this.painter = new BarPainter(renderer, this.options, new ArrowRouter(this.options));
        this.interaction = new BarInteractionService(this);
        this.scrollTracker = new ScrollTracker(geometryService, new Debouncer(ScrollTracker.DEBOUNCE_MILLIS));

        setupTasks(tasks == null ? new ArrayList<>() : tasks);
        bindRootEvents();
        changeViewMode(this.options.getViewMode());
    }

    void setupTasks(List<Task> newTasks) {
        NormalizedTasks normalized = normalizer.normalize(newTasks);
        tasks = normalized.getAllTasks();
        visibleTasks = normalized.getVisibleTasks();
        taskById.clear();
        for (Task task : tasks) {
            taskById.putIfAbsent(task.getId(), task);
        }
        graph.build(tasks);
        LOGGER.debug("{} tasks set up, {} visible", tasks.size(), visibleTasks.size());
    }

    /** Replaces the tasks and redraws in the current view mode. */
    public void refresh(List<Task> newTasks) {
        setupTasks(new ArrayList<>(newTasks));
        changeViewMode(options.getViewMode());
    }

    public void changeViewMode(ViewMode mode) {
        ViewMode target = mode == null ? options.getViewMode() : mode;
        options.setViewMode(target);
        scale.applyScale(target);
        range = TimeScale.computeRange(tasks, target, DateUtils.today(clock));
        render();
        for (GanttEventListener l : listeners) {
            l.onViewChange(target);
        }
    }

    /**
     * Positive zooms in (finer mode), negative zooms out. No-op at either end of the configured modes.
     */
    public void zoom(int direction) {
        List<ViewMode> modes = options.getViewModes();
        int i = modes.indexOf(options.getViewMode());
        if (i < 0 || direction == 0) {
            return;
        }
        int next = direction > 0 ? i - 1 : i + 1;
        if (next < 0 || next >= modes.size() || direction < 0 && scale.getColumnWidth() <= MIN_ZOOM_COLUMN_WIDTH) {
            LOGGER.debug("Zoom {} ignored at {}", direction, options.getViewMode());
            return;
        }
        changeViewMode(modes.get(next));
    }

    public void render() {
        renderer.clear();
        bars.clear();
        barById.clear();
        arrows.clear();
        layers.clear();

        for (String name : LAYERS) {
            layers.put(name, renderer.createShape("g", attrs("class", name), null));
        }
        ticks = AxisTickGenerator.axisTicks(range, scale, options.getHeaderHeight(), options.getLanguage());
        makeGrid();
        makeDates();
        makeBars();
        makeArrows();
        setWidth();
        double scrollLeft = scrollTracker.restore(tasks, scale, range.getStart());
        renderer.setAttribute(renderer.getRoot(), "data-scroll-left", scrollLeft);
    }

    private double gridWidth() {
        return ticks.size() * (double) scale.getColumnWidth();
    }

    private void makeGrid() {
        ShapeHandle grid = layers.get("grid");
        double width = gridWidth();
        double rowHeight = options.getRowHeight();
        double gridHeight = options.getHeaderHeight() + options.getPadding() + rowHeight * visibleTasks.size();

        renderer.createShape("rect", attrs("x", 0, "y", 0, "width", width, "height", gridHeight,
                "class", "grid-background"), grid);
        renderer.setAttribute(renderer.getRoot(), "height", gridHeight + options.getPadding() + 100);
        renderer.setAttribute(renderer.getRoot(), "width", "100%");

        ShapeHandle rows = renderer.createShape("g", attrs(), grid);
        ShapeHandle lines = renderer.createShape("g", attrs(), grid);
        double rowY = options.getHeaderHeight() + options.getPadding() / 2.0;
        for (Task task : visibleTasks) {
            ShapeHandle row = renderer.createShape("rect", attrs("x", 0, "y", rowY, "width", width,
                    "height", rowHeight, "data-row", task.getId(), "class", "grid-row"), rows);
            bindGridRow(row);
            renderer.createShape("line", attrs("x1", 0, "y1", rowY + rowHeight, "x2", width,
                    "y2", rowY + rowHeight, "class", "row-line"), lines);
            rowY += rowHeight;
        }

        ShapeHandle header = renderer.createShape("rect", attrs("x", 0, "y", 0, "width", width,
                "height", options.getHeaderHeight() + 10, "class", "grid-header"), layers.get("date"));
        renderer.listen(header, popupGesture(), (e, t) -> unselectAll());

        double tickY = options.getHeaderHeight() + options.getPadding() / 2.0;
        double tickHeight = rowHeight * visibleTasks.size();
        for (AxisTick tick : ticks) {
            renderer.createShape("path", attrs("d", "M " + ArrowRouter.n(tick.getGridX()) + " "
                            + ArrowRouter.n(tickY) + " v " + ArrowRouter.n(tickHeight),
                    "class", tick.isThick() ? "tick thick" : "tick"), grid);
        }

        if (scale.is(ViewMode.DAY)) {
            LocalDateTime today = DateUtils.today(clock);
            double x = DateUtils.diff(today, range.getStart(), DateUnit.HOUR) / (double) scale.getStep()
                    * scale.getColumnWidth();
            double height = rowHeight * visibleTasks.size() + options.getHeaderHeight() + options.getPadding() / 2.0;
            ShapeHandle highlight = renderer.createShape("rect", attrs("x", x, "y", 0,
                    "width", scale.getColumnWidth(), "height", height, "class", "today-highlight"), grid);
            bindGridRow(highlight);
        }
    }

    private void makeDates() {
        ShapeHandle dateLayer = layers.get("date");
        double width = gridWidth();
        for (AxisTick tick : ticks) {
            Map<String, Object> lower = attrs("x", tick.getLowerX(), "y", tick.getLowerY(), "class", "lower-text");
            lower.put(ShapeRenderer.TEXT, tick.getLowerText());
            renderer.createShape("text", lower, dateLayer);

            if (tick.hasUpperText()) {
                Map<String, Object> upper = attrs("x", tick.getUpperX(), "y", tick.getUpperY(),
                        "class", "upper-text");
                upper.put(ShapeRenderer.TEXT, tick.getUpperText());
                ShapeHandle text = renderer.createShape("text", upper, dateLayer);
                // 超出网格宽度的上行标签不显示
                if (renderer.getBoundingBox(text).getX2() > width) {
                    renderer.remove(text);
                }
            }
        }
    }

    private void makeBars() {
        ShapeHandle barLayer = layers.get("bar");
        for (Task task : visibleTasks) {
            Bar bar = painter.draw(task,
                    geometryService.toGeometry(task, task.getIndex(), scale, range.getStart()),
                    barLayer, graph.hasDescendants(task.getId()));
            bars.add(bar);
            barById.put(task.getId(), bar);
            bindBar(bar);
        }
    }

    private void makeArrows() {
        ShapeHandle arrowLayer = layers.get("arrow");
        for (Task task : visibleTasks) {
            Bar to = barById.get(task.getId());
            for (String dependencyId : task.getDependencies()) {
                Bar from = barById.get(dependencyId);
                if (from == null) {
                    LOGGER.debug("Skipping arrow {} -> {}: no visible bar for the dependency",
                            dependencyId, task.getId());
                    continue;
                }
                ArrowPath arrow = new ArrowPath(from, to);
                arrow.setShape(renderer.createShape("path", attrs("class", "arrow"), arrowLayer));
                painter.updateArrow(arrow);
                arrows.add(arrow);
            }
        }
        for (Bar bar : bars) {
            List<ArrowPath> own = new ArrayList<>();
            for (ArrowPath arrow : arrows) {
                if (arrow.touches(bar.getTask().getId())) {
                    own.add(arrow);
                }
            }
            bar.setArrows(own);
        }
    }

    private void setWidth() {
        renderer.setAttribute(renderer.getRoot(), "width", gridWidth());
    }

    private Gesture popupGesture() {
        try {
            return Gesture.fromName(options.getPopupTrigger());
        } catch (IllegalArgumentException e) {
            LOGGER.warn("Unknown popup_trigger '{}', using click", options.getPopupTrigger());
            return Gesture.CLICK;
        }
    }

    private void bindGridRow(ShapeHandle row) {
        renderer.listen(row, popupGesture(), (e, t) -> unselectAll());
        renderer.listen(row, Gesture.PRESS, (e, t) -> {
            panning = true;
            panX = e.getX();
        });
    }

    private void bindBar(Bar bar) {
        renderer.listen(bar.getGroup(), Gesture.PRESS, (e, t) -> interaction.press(bar, PressTarget.BODY, e));
        if (bar.getLeftHandle() != null) {
            renderer.listen(bar.getLeftHandle(), Gesture.PRESS,
                    (e, t) -> interaction.press(bar, PressTarget.LEFT_HANDLE, e));
            renderer.listen(bar.getRightHandle(), Gesture.PRESS,
                    (e, t) -> interaction.press(bar, PressTarget.RIGHT_HANDLE, e));
        }
        if (bar.getProgressHandle() != null) {
            renderer.listen(bar.getProgressHandle(), Gesture.PRESS,
                    (e, t) -> interaction.press(bar, PressTarget.PROGRESS_HANDLE, e));
        }
        if (bar.getCaret() != null) {
            renderer.listen(bar.getCaret(), Gesture.PRESS, (e, t) -> interaction.press(bar, PressTarget.CARET, e));
        }
        renderer.listen(bar.getGroup(), popupGesture(), (e, t) -> interaction.select(bar));
        renderer.listen(bar.getGroup(), Gesture.DOUBLE_CLICK, (e, t) -> interaction.doubleClick(bar));
    }

    // 根节点监听在 clear() 之后仍然保留，只绑定一次
    private void bindRootEvents() {
        ShapeHandle root = renderer.getRoot();
        renderer.listen(root, Gesture.MOVE, (e, t) -> {
            if (panning) {
                double dx = e.getX() - panX;
                panX = e.getX();
                scrollTracker.onScroll(Math.max(0, scrollTracker.getScrollLeft() - dx * PAN_FACTOR),
                        scale, range.getStart());
                return;
            }
            interaction.move(e);
        });
        renderer.listen(root, Gesture.RELEASE, (e, t) -> {
            panning = false;
            interaction.release(e);
        });
        renderer.listen(root, Gesture.SCROLL, (e, t) -> scrollTracker.onScroll(e.getX(), scale, range.getStart()));
    }

    /**
     * Stable re-sort of the visible bars by their current y. Row indexes follow the new order.
     *
     * @return bars whose row index changed
     */
    List<Bar> sortBars() {
        List<Bar> sorted = new ArrayList<>(bars);
        sorted.sort(Comparator.comparingDouble(b -> b.getGeometry().getY()));
        List<Bar> changed = new ArrayList<>();
        List<Task> visible = new ArrayList<>();
        for (int i = 0; i < sorted.size(); i++) {
            Bar bar = sorted.get(i);
            if (bar.getTask().getIndex() != i) {
                changed.add(bar);
            }
            bar.getTask().setIndex(i);
            visible.add(bar.getTask());
        }
        bars.clear();
        bars.addAll(sorted);

        // hidden tasks keep their slots in the full list
        List<Task> all = new ArrayList<>(tasks.size());
        int next = 0;
        for (Task task : tasks) {
            all.add(task.isVisible() ? visible.get(next++) : task);
        }
        tasks = all;
        visibleTasks = visible;
        return changed;
    }

    public void unselectAll() {
        for (Bar bar : bars) {
            painter.setActive(bar, false);
        }
    }

    public void addListener(GanttEventListener listener) {
        listeners.add(listener);
    }

    public void removeListener(GanttEventListener listener) {
        listeners.remove(listener);
    }

    void fireDateChange(Task task, LocalDateTime start, LocalDateTime endInclusive) {
        for (GanttEventListener l : listeners) {
            l.onDateChange(task, start, endInclusive);
        }
    }

    void fireProgressChange(Task task, int progress) {
        for (GanttEventListener l : listeners) {
            l.onProgressChange(task, progress);
        }
    }

    void fireClick(Task task) {
        for (GanttEventListener l : listeners) {
            l.onClick(task);
        }
    }

    /** Stops scroll tracking. The drawing stays as it is. */
    @Override
    public void close() {
        scrollTracker.close();
        LOGGER.debug("Chart closed");
    }

    public Task getTask(String id) {
        return taskById.get(id);
    }

    /** Bar of a visible task, null for hidden or unknown ids. */
    public Bar getBar(String id) {
        return barById.get(id);
    }

    public List<Task> getTasks() {
        return Collections.unmodifiableList(tasks);
    }

    public List<Task> getVisibleTasks() {
        return Collections.unmodifiableList(visibleTasks);
    }

    public List<Bar> getBars() {
        return Collections.unmodifiableList(bars);
    }

    public List<ArrowPath> getArrows() {
        return Collections.unmodifiableList(arrows);
    }

    public List<AxisTick> getTicks() {
        return ticks;
    }

    public ShapeHandle getLayer(String name) {
        return layers.get(name);
    }

    public ShapeRenderer getRenderer() {
        return renderer;
    }

    public GanttOptions getOptions() {
        return options;
    }

    public Clock getClock() {
        return clock;
    }

    public DependencyGraph getGraph() {
        return graph;
    }

    public TimeScale getScale() {
        return scale;
    }

    public GanttRange getRange() {
        return range;
    }

    public BarGeometryService getGeometryService() {
        return geometryService;
    }

    public BarPainter getPainter() {
        return painter;
    }

    public BarInteractionService getInteraction() {
        return interaction;
    }

    public ScrollTracker getScrollTracker() {
        return scrollTracker;
    }
}
