package com.iimsoft.timeline.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.iimsoft.timeline.calendar.ViewMode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Chart configuration. Property names follow the JSON keys ("bar_height", "view_mode", ...).
 * Unknown keys such as "custom_popup_html" are ignored, and so are "column_width" and "step": both
 * always come from the view mode.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GanttOptions {

    @JsonProperty("view_mode")
    private ViewMode viewMode = ViewMode.DAY;

    /** Zoom order, finest first. */
    @JsonProperty("view_modes")
    private List<ViewMode> viewModes = new ArrayList<>(Arrays.asList(ViewMode.values()));

    @JsonProperty("header_height")
    private int headerHeight = 50;

    @JsonProperty("bar_height")
    private int barHeight = 20;

    @JsonProperty("bar_corner_radius")
    private int barCornerRadius = 3;

    @JsonProperty("arrow_curve")
    private int arrowCurve = 5;

    @JsonProperty("padding")
    private int padding = 18;

    @JsonProperty("language")
    private String language = "en";

    @JsonProperty("sortable")
    private boolean sortable;

    /** Gesture that selects a bar, see {@link com.iimsoft.timeline.render.Gesture#fromName(String)}. */
    @JsonProperty("popup_trigger")
    private String popupTrigger = "click";

    public GanttOptions() {
    }

    public GanttOptions copy() {
        GanttOptions o = new GanttOptions();
        o.viewMode = viewMode;
        o.viewModes = new ArrayList<>(viewModes);
        o.headerHeight = headerHeight;
        o.barHeight = barHeight;
        o.barCornerRadius = barCornerRadius;
        o.arrowCurve = arrowCurve;
        o.padding = padding;
        o.language = language;
        o.sortable = sortable;
        o.popupTrigger = popupTrigger;
        return o;
    }

    public ViewMode getViewMode() {
        return viewMode;
    }

    public void setViewMode(ViewMode viewMode) {
        this.viewMode = viewMode;
    }

    public List<ViewMode> getViewModes() {
        return viewModes;
    }

    public void setViewModes(List<ViewMode> viewModes) {
        this.viewModes = viewModes;
    }

    public int getHeaderHeight() {
        return headerHeight;
    }

    public void setHeaderHeight(int headerHeight) {
        this.headerHeight = headerHeight;
    }

    public int getBarHeight() {
        return barHeight;
    }

    public void setBarHeight(int barHeight) {
        this.barHeight = barHeight;
    }

    public int getBarCornerRadius() {
        return barCornerRadius;
    }

    public void setBarCornerRadius(int barCornerRadius) {
        this.barCornerRadius = barCornerRadius;
    }

    public int getArrowCurve() {
        return arrowCurve;
    }

    public void setArrowCurve(int arrowCurve) {
        this.arrowCurve = arrowCurve;
    }

    public int getPadding() {
        return padding;
    }

    public void setPadding(int padding) {
        this.padding = padding;
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }

    public boolean isSortable() {
        return sortable;
    }

    public void setSortable(boolean sortable) {
        this.sortable = sortable;
    }

    public String getPopupTrigger() {
        return popupTrigger;
    }

    public void setPopupTrigger(String popupTrigger) {
        this.popupTrigger = popupTrigger;
    }

    /** Height of one row: bar plus the padding below it. */
    public int getRowHeight() {
        return barHeight + padding;
    }
}
