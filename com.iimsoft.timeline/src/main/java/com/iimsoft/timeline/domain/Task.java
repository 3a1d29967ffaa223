package com.iimsoft.timeline.domain;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

// 图表里的一个任务：原始文本日期 + 归一化后的起止时间（end 不含）
public class Task {
    private String id;
    private String name;

    // 原始输入，可能为空或格式错误
    private String rawStart;
    private String rawEnd;

    // 归一化结果，TaskNormalizer 之后总是非空且 end > start
    private LocalDateTime start;
    private LocalDateTime end;

    private int progress;
    private List<String> dependencies = new ArrayList<>();
    private TaskType type = TaskType.PLAIN;
    private Boolean visible;
    private boolean collapsed;
    private boolean invalid;
    private int index = -1;

    private String customClass;
    private String color;

    public Task() {}
    public Task(String id, String name, String rawStart, String rawEnd) {
        this.id = id; this.name = name; this.rawStart = rawStart; this.rawEnd = rawEnd;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getRawStart() { return rawStart; }
    public void setRawStart(String rawStart) { this.rawStart = rawStart; }
    public String getRawEnd() { return rawEnd; }
    public void setRawEnd(String rawEnd) { this.rawEnd = rawEnd; }

    public LocalDateTime getStart() { return start; }
    public void setStart(LocalDateTime start) { this.start = start; }
    public LocalDateTime getEnd() { return end; }
    public void setEnd(LocalDateTime end) { this.end = end; }

    public int getProgress() { return progress; }
    public void setProgress(int progress) { this.progress = Math.max(0, Math.min(100, progress)); }

    public List<String> getDependencies() { return dependencies; }
    public void setDependencies(List<String> dependencies) {
        this.dependencies = dependencies == null ? new ArrayList<>() : dependencies;
    }

    public TaskType getType() { return type; }
    public void setType(TaskType type) { this.type = type == null ? TaskType.PLAIN : type; }

    /** 未设置视为可见 */
    public boolean isVisible() { return visible == null || visible; }
    public void setVisible(boolean visible) { this.visible = visible; }

    public boolean isCollapsed() { return collapsed; }
    public void setCollapsed(boolean collapsed) { this.collapsed = collapsed; }

    public boolean isInvalid() { return invalid; }
    public void setInvalid(boolean invalid) { this.invalid = invalid; }

    /** Row position within the visible tasks, -1 while hidden. */
    public int getIndex() { return index; }
    public void setIndex(int index) { this.index = index; }

    public String getCustomClass() { return customClass; }
    public void setCustomClass(String customClass) { this.customClass = customClass; }
    public String getColor() { return color; }
    public void setColor(String color) { this.color = color; }

    @Override
    public String toString() {
        return "Task{" + id + ", " + start + " -> " + end + "}";
    }
}
