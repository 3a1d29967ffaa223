package com.iimsoft.timeline.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;

/**
 * 图表配置加载。
 *
 * 配置来源（优先级从高到低）：
 * 1) JVM 参数：-Dtimeline.options=JSON
 * 2) 默认值（见 {@link GanttOptions}）
 *
 * JSON 格式错误时回退默认配置并记录 WARN，不让图表直接挂掉。
 */
public final class GanttOptionsLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(GanttOptionsLoader.class);

    /** JVM 参数 key */
    public static final String OPTIONS_JSON_PROPERTY = "timeline.options";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private GanttOptionsLoader() {
    }

    public static GanttOptions load() {
        return fromJson(System.getProperty(OPTIONS_JSON_PROPERTY));
    }

    public static GanttOptions fromJson(String json) {
        if (json == null || json.isBlank()) {
            return new GanttOptions();
        }
        try {
            return MAPPER.readValue(json, GanttOptions.class);
        } catch (IOException | IllegalArgumentException e) {
            LOGGER.warn("Invalid chart options, using defaults: {}", e.getMessage());
            return new GanttOptions();
        }
    }

    /**
     * Reads options from a JSON file. Unlike {@link #fromJson(String)} a missing or unreadable file is an error.
     */
    public static GanttOptions fromFile(File file) throws IOException {
        if (!file.isFile()) {
            throw new IOException("Options file not found: " + file.getAbsolutePath());
        }
        return MAPPER.readValue(file, GanttOptions.class);
    }
}
