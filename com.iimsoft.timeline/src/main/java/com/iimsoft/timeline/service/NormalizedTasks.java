package com.iimsoft.timeline.service;

import com.iimsoft.timeline.domain.Task;

import java.util.Collections;
import java.util.List;

/**
 * Result of {@link TaskNormalizer#normalize(List)}: every task, plus the visible ones in row order.
 */
public class NormalizedTasks {
    private final List<Task> allTasks;
    private final List<Task> visibleTasks;

    public NormalizedTasks(List<Task> allTasks, List<Task> visibleTasks) {
        this.allTasks = Collections.unmodifiableList(allTasks);
        this.visibleTasks = Collections.unmodifiableList(visibleTasks);
    }

    public List<Task> getAllTasks() {
        return allTasks;
    }

    public List<Task> getVisibleTasks() {
        return visibleTasks;
    }
}
