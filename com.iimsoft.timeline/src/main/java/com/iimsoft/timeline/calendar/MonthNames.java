package com.iimsoft.timeline.calendar;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 月份名称表（按语言）。
 *
 * 数据来自 classpath 资源 {@value #RESOURCE}，首次使用时加载并缓存。
 * 未知语言回退到 {@value #DEFAULT_LANGUAGE}。
 */
public final class MonthNames {

    private static final Logger LOGGER = LoggerFactory.getLogger(MonthNames.class);

    public static final String DEFAULT_LANGUAGE = "en";
    static final String RESOURCE = "i18n/month-names.json";

    private static volatile Map<String, List<String>> namesByLanguage;
    // 每种未知语言只告警一次
    private static final Set<String> REPORTED_LANGUAGES = ConcurrentHashMap.newKeySet();

    private MonthNames() {
    }

    /**
     * @param month 1..12
     */
    public static String get(String language, int month) {
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("Month out of range: " + month);
        }
        Map<String, List<String>> names = getNamesByLanguage();
        List<String> list = language == null ? null : names.get(language);
        if (list == null) {
            if (REPORTED_LANGUAGES.add(String.valueOf(language))) {
                LOGGER.warn("No month names for language '{}', falling back to '{}'", language, DEFAULT_LANGUAGE);
            }
            list = names.get(DEFAULT_LANGUAGE);
        }
        return list.get(month - 1);
    }

    public static Set<String> languages() {
        return Collections.unmodifiableSet(getNamesByLanguage().keySet());
    }

    private static Map<String, List<String>> getNamesByLanguage() {
        Map<String, List<String>> local = namesByLanguage;
        if (local != null) {
            return local;
        }
        synchronized (MonthNames.class) {
            if (namesByLanguage == null) {
                namesByLanguage = load();
            }
            return namesByLanguage;
        }
    }

    private static Map<String, List<String>> load() {
        try (InputStream in = MonthNames.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource: " + RESOURCE);
            }
            Map<String, List<String>> names = new ObjectMapper()
                    .readValue(in, new TypeReference<Map<String, List<String>>>() {
                    });
            for (Map.Entry<String, List<String>> e : names.entrySet()) {
                if (e.getValue() == null || e.getValue().size() != 12) {
                    throw new IllegalStateException("Language '" + e.getKey() + "' must list 12 months");
                }
            }
            if (!names.containsKey(DEFAULT_LANGUAGE)) {
                throw new IllegalStateException("Default language '" + DEFAULT_LANGUAGE + "' is missing");
            }
            return Collections.unmodifiableMap(names);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read " + RESOURCE, e);
        }
    }
}
