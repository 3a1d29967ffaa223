package com.iimsoft.timeline.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.iimsoft.timeline.domain.Task;
import com.iimsoft.timeline.dto.TaskImportDTOs;
import com.iimsoft.timeline.service.TaskNormalizer;

import java.io.File;
import java.io.IOException;
import java.util.List;

public class TaskImportUtil {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * 读取任务 JSON：既可以是任务数组，也可以是 { "tasks": [...] }。
     * 返回的任务还没有归一化，日期保留原始文本。
     */
    public static List<Task> loadTasks(String jsonPath) throws IOException {
        return loadTasks(new File(jsonPath));
    }

    public static List<Task> loadTasks(File file) throws IOException {
        if (!file.isFile()) {
            throw new IOException("任务文件不存在: " + file.getAbsolutePath());
        }
        return parseTasks(MAPPER.readTree(file));
    }

    public static List<Task> parseTasks(String json) throws IOException {
        return parseTasks(MAPPER.readTree(json));
    }

    private static List<Task> parseTasks(JsonNode node) throws IOException {
        List<TaskImportDTOs.TaskRecord> records;
        if (node != null && node.isArray()) {
            records = MAPPER.readerFor(new TypeReference<List<TaskImportDTOs.TaskRecord>>() {}).readValue(node);
        } else if (node != null && node.isObject()) {
            records = MAPPER.treeToValue(node, TaskImportDTOs.Root.class).tasks;
        } else {
            throw new IOException("任务 JSON 必须是数组或包含 tasks 的对象");
        }
        return TaskNormalizer.fromRecords(records);
    }
}
