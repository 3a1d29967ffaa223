package com.iimsoft.timeline.app;

import com.iimsoft.timeline.calendar.ViewMode;
import com.iimsoft.timeline.config.GanttOptions;
import com.iimsoft.timeline.config.GanttOptionsLoader;
import com.iimsoft.timeline.domain.Task;
import com.iimsoft.timeline.render.SvgShapeRenderer;
import com.iimsoft.timeline.service.GanttChart;
import com.iimsoft.timeline.service.SvgExportService;
import com.iimsoft.timeline.util.TaskImportUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * Command line renderer:
 * - args[0]: task JSON file (array or { "tasks": [...] }); built-in demo tasks when missing or "-".
 * - args[1]: output SVG path, default timeline.svg.
 * - args[2]: view mode label ("Day", "Week", "Month", ...), default from the options.
 */
public class TimelineApp {

    private static final Logger LOGGER = LoggerFactory.getLogger(TimelineApp.class);

    static final String DEFAULT_OUTPUT = "timeline.svg";

    public static void main(String[] args) {
        String inputFile = args.length > 0 && !"-".equals(args[0]) ? args[0] : null;
        String outputFile = args.length > 1 ? args[1] : DEFAULT_OUTPUT;
        String viewMode = args.length > 2 ? args[2] : null;
        if (new TimelineApp().run(inputFile, outputFile, viewMode) == null) {
            System.exit(1);
        }
    }

    /**
     * @return the written file, null when loading or writing failed
     */
    public File run(String inputFile, String outputFile, String viewMode) {
        LOGGER.info("======================================");
        LOGGER.info("Timeline renderer");
        LOGGER.info("======================================");

        List<Task> tasks = loadTasks(inputFile);
        if (tasks == null) {
            return null;
        }

        GanttOptions options = GanttOptionsLoader.load();
        if (viewMode != null) {
            try {
                options.setViewMode(ViewMode.fromLabel(viewMode));
            } catch (IllegalArgumentException e) {
                LOGGER.warn("Unknown view mode '{}', keeping {}", viewMode, options.getViewMode());
            }
        }

        SvgShapeRenderer renderer = new SvgShapeRenderer();
        try (GanttChart chart = new GanttChart(renderer, tasks, options)) {
            LOGGER.info("Chart rendered: {} tasks ({} visible), {} arrows, view {}, range {}",
                    chart.getTasks().size(), chart.getVisibleTasks().size(), chart.getArrows().size(),
                    chart.getOptions().getViewMode(), chart.getRange());
            for (Task task : chart.getTasks()) {
                LOGGER.info("  {} [{} -> {}] progress {}%{}", task.getId(), task.getStart(), task.getEnd(),
                        task.getProgress(), task.isInvalid() ? " (invalid dates)" : "");
            }
            return SvgExportService.export(renderer, outputFile);
        } catch (IOException e) {
            LOGGER.error("Failed to write SVG: {}", outputFile, e);
            return null;
        }
    }

    private List<Task> loadTasks(String inputFile) {
        try {
            if (inputFile == null || inputFile.isEmpty()) {
                LOGGER.info("No input file specified. Using built-in demo tasks.");
                return TaskImportUtil.parseTasks(DEMO_TASKS);
            }
            return TaskImportUtil.loadTasks(inputFile);
        } catch (IOException e) {
            LOGGER.error("Error loading tasks from: {}", inputFile == null ? "demo data" : inputFile, e);
            return null;
        }
    }

    static final String DEMO_TASKS = """
            {
              "tasks": [
                { "id": "Task 1", "name": "Redesign website", "start": "2016-12-28", "end": "2016-12-31", "progress": 20 },
                { "id": "Task 2", "name": "Write new content", "start": "2016-12-28", "end": "2017-01-05",
                  "progress": 80, "dependencies": "Task 1" },
                { "id": "Task 3", "name": "Apply new styles", "start": "2016-12-31", "end": "2017-01-10",
                  "progress": 10, "dependencies": "Task 2" },
                { "id": "Task 4", "name": "Review", "start": "2017-01-05", "end": "2017-01-08",
                  "progress": 0, "dependencies": "Task 2, Task 3" },
                { "id": "Release", "name": "Release", "start": "2017-01-03", "end": "2017-01-12",
                  "progress": 0, "type": "project", "dependencies": [] },
                { "id": "Task 5", "name": "Deploy", "start": "2017-01-08", "end": "2017-01-09",
                  "progress": 0, "dependencies": "Release", "custom_class": "bar-milestone" },
                { "id": "Task 6", "name": "Go live!", "start": "2017-01-11", "end": "2017-01-11",
                  "progress": 0, "dependencies": "Task 5" }
              ]
            }
            """;
}
