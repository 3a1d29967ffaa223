package com.iimsoft.timeline.service;

import com.iimsoft.timeline.calendar.DateUnit;
import com.iimsoft.timeline.calendar.DateUtils;
import com.iimsoft.timeline.domain.Task;
import com.iimsoft.timeline.domain.TaskType;
import com.iimsoft.timeline.dto.TaskImportDTOs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 把原始任务整理成图表可用的形式：
 * - 起止时间总是存在（缺失或格式错误时按默认规则补齐，并标记 invalid）
 * - 依赖列表去空格、去重
 * - 缺少 id 时按 name 生成
 * - 只给可见任务分配行号
 *
 * 不抛异常：日期问题只体现为 invalid 标记。
 */
public class TaskNormalizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(TaskNormalizer.class);

    static final int DEFAULT_SPAN_DAYS = 2;
    static final int MAX_SPAN_YEARS = 10;
    private static final String ID_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";

    private final Clock clock;

    public TaskNormalizer(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public static Task fromRecord(TaskImportDTOs.TaskRecord r) {
        Task task = new Task(r.id, r.name, r.start, r.end);
        if (r.progress != null) {
            task.setProgress((int) Math.round(r.progress));
        }
        task.setDependencies(r.dependencies == null ? new ArrayList<>() : new ArrayList<>(r.dependencies));
        task.setType(TaskType.fromName(r.type));
        if (r.visible != null) {
            task.setVisible(r.visible);
        }
        if (r.collapsed != null) {
            task.setCollapsed(r.collapsed);
        }
        task.setCustomClass(r.customClass);
        task.setColor(r.color);
        return task;
    }

    public static List<Task> fromRecords(List<TaskImportDTOs.TaskRecord> records) {
        List<Task> tasks = new ArrayList<>();
        if (records == null) {
            return tasks;
        }
        for (TaskImportDTOs.TaskRecord r : records) {
            if (r != null) {
                tasks.add(fromRecord(r));
            }
        }
        return tasks;
    }

    public NormalizedTasks normalize(List<Task> tasks) {
        List<Task> all = new ArrayList<>();
        List<Task> visible = new ArrayList<>();
        for (Task task : tasks) {
            normalizeTask(task);
            all.add(task);
            if (task.isVisible()) {
                task.setIndex(visible.size());
                visible.add(task);
            } else {
                task.setIndex(-1);
            }
        }
        return new NormalizedTasks(all, visible);
    }

    void normalizeTask(Task task) {
        LocalDateTime start = tryParse(task, task.getRawStart(), "start");
        LocalDateTime end = tryParse(task, task.getRawEnd(), "end");

        if (start != null && end != null && DateUtils.diff(end, start, DateUnit.YEAR) > MAX_SPAN_YEARS) {
            LOGGER.warn("Task '{}' spans more than {} years, ignoring its end", task.getName(), MAX_SPAN_YEARS);
            end = null;
        }
        boolean startGiven = start != null;
        boolean endGiven = end != null;

        if (!startGiven && !endGiven) {
            start = DateUtils.today(clock);
            end = DateUtils.add(start, DEFAULT_SPAN_DAYS, DateUnit.DAY);
        } else if (!startGiven) {
            start = DateUtils.add(end, -DEFAULT_SPAN_DAYS, DateUnit.DAY);
        } else if (!endGiven) {
            end = DateUtils.add(start, DEFAULT_SPAN_DAYS, DateUnit.DAY);
        }

        // 只有日期的结束时间按“当天结束”处理，例如 2018-09-09 变成 2018-09-10 00:00
        if (endGiven && DateUtils.isMidnight(end)) {
            end = DateUtils.add(end, 24, DateUnit.HOUR);
        }

        if (!end.isAfter(start)) {
            LOGGER.warn("Task '{}' ends before it starts, deriving its end", task.getName());
            end = DateUtils.add(start, DEFAULT_SPAN_DAYS, DateUnit.DAY);
            endGiven = false;
        }

        task.setStart(start);
        task.setEnd(end);
        task.setInvalid(!startGiven || !endGiven);
        task.setDependencies(normalizeDependencies(task.getDependencies()));

        if (task.getId() == null || task.getId().isBlank()) {
            task.setId(generateId(task));
        }
    }

    private LocalDateTime tryParse(Task task, String text, String field) {
        try {
            return DateUtils.parse(text);
        } catch (IllegalArgumentException e) {
            LOGGER.warn("Task '{}' has a malformed {} date '{}', using the default", task.getName(), field, text);
            return null;
        }
    }

    static List<String> normalizeDependencies(List<String> raw) {
        Set<String> deps = new LinkedHashSet<>();
        if (raw != null) {
            for (String entry : raw) {
                if (entry == null) continue;
                for (String d : entry.split(",")) {
                    String id = d.trim();
                    if (!id.isEmpty()) deps.add(id);
                }
            }
        }
        return new ArrayList<>(deps);
    }

    static String generateId(Task task) {
        StringBuilder sb = new StringBuilder();
        ThreadLocalRandom random = ThreadLocalRandom.current();
        for (int i = 0; i < 10; i++) {
            sb.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return task.getName() + "_" + sb;
    }

    /**
     * Stores committed instants on the task, rewriting the raw text so that the next
     * {@link #normalize(List)} yields exactly the same start and end.
     */
    public static void writeBack(Task task, LocalDateTime start, LocalDateTime end) {
        task.setStart(start);
        task.setEnd(end);
        task.setRawStart(DateUtils.toString(start, true));
        if (DateUtils.isMidnight(end)) {
            // a date-only end is bumped to the following midnight on normalization
            task.setRawEnd(DateUtils.toString(DateUtils.add(end, -1, DateUnit.DAY), false));
        } else {
            task.setRawEnd(DateUtils.toString(end, true));
        }
    }
}
