package com.iimsoft.timeline.calendar;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Time-scale resolutions with their fixed grid column table.
 *
 * {@code step} is the number of hours one grid column stands for, {@code columnWidth} its width in pixels.
 */
public enum ViewMode {
    QUARTER_DAY("Quarter Day", 6, 38),
    HALF_DAY("Half Day", 12, 38),
    DAY("Day", 24, 38),
    WEEK("Week", 24 * 7, 140),
    MONTH("Month", 24 * 30, 120),
    YEAR("Year", 24 * 365, 120);

    private final String label;
    private final int step;
    private final int columnWidth;

    ViewMode(String label, int step, int columnWidth) {
        this.label = label;
        this.step = step;
        this.columnWidth = columnWidth;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public int getStep() {
        return step;
    }

    public int getColumnWidth() {
        return columnWidth;
    }

    /**
     * Accepts the display label ("Quarter Day") as well as the constant name ("QUARTER_DAY"), case-insensitive.
     */
    @JsonCreator
    public static ViewMode fromLabel(String value) {
        if (value == null) {
            throw new IllegalArgumentException("View mode must not be null");
        }
        String v = value.trim();
        for (ViewMode mode : values()) {
            if (mode.label.equalsIgnoreCase(v) || mode.name().equalsIgnoreCase(v)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown view mode: " + value);
    }

    @Override
    public String toString() {
        return label;
    }
}
