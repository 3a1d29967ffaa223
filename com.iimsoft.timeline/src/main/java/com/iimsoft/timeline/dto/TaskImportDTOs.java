package com.iimsoft.timeline.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public class TaskImportDTOs {

    /** 可选的包装格式：{ "options": {...}, "tasks": [...] } */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Root {
        public List<TaskRecord> tasks;
    }

    /**
     * 原始任务记录，日期为文本，依赖既可以是 "a, b" 字符串也可以是数组。
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TaskRecord {
        public String id;
        public String name;
        public String start;
        public String end;
        public Double progress;
        @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
        public List<String> dependencies;
        public String type;       // null / "project" / "tag"
        public Boolean visible;
        public Boolean collapsed;
        @JsonProperty("custom_class")
        public String customClass;
        public String color;

        public TaskRecord() {}

        public TaskRecord(String id, String name, String start, String end) {
            this.id = id; this.name = name; this.start = start; this.end = end;
        }
    }
}
