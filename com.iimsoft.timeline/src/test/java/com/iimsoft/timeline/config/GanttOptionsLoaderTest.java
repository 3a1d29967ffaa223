package com.iimsoft.timeline.config;

import com.iimsoft.timeline.calendar.ViewMode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GanttOptionsLoaderTest {

    @AfterEach
    void clearProperty() {
        System.clearProperty(GanttOptionsLoader.OPTIONS_JSON_PROPERTY);
    }

    @Test
    void defaults() {
        GanttOptions o = GanttOptionsLoader.fromJson(null);

        assertThat(o.getViewMode()).isEqualTo(ViewMode.DAY);
        assertThat(o.getViewModes()).containsExactly(ViewMode.values());
        assertThat(o.getHeaderHeight()).isEqualTo(50);
        assertThat(o.getBarHeight()).isEqualTo(20);
        assertThat(o.getBarCornerRadius()).isEqualTo(3);
        assertThat(o.getArrowCurve()).isEqualTo(5);
        assertThat(o.getPadding()).isEqualTo(18);
        assertThat(o.getLanguage()).isEqualTo("en");
        assertThat(o.isSortable()).isFalse();
        assertThat(o.getPopupTrigger()).isEqualTo("click");
        assertThat(o.getRowHeight()).isEqualTo(38);
    }

    @Test
    void readsSnakeCaseKeysAndIgnoresUnknown() {
        GanttOptions o = GanttOptionsLoader.fromJson("{\"view_mode\": \"Week\", \"bar_height\": 30, "
                + "\"sortable\": true, \"language\": \"de\", \"custom_popup_html\": \"<b/>\"}");

        assertThat(o.getViewMode()).isEqualTo(ViewMode.WEEK);
        assertThat(o.getBarHeight()).isEqualTo(30);
        assertThat(o.isSortable()).isTrue();
        assertThat(o.getLanguage()).isEqualTo("de");
        assertThat(o.getRowHeight()).isEqualTo(48);
    }

    @Test
    void scaleKeysDoNotOverrideTheViewMode() {
        GanttOptions o = GanttOptionsLoader.fromJson(
                "{\"column_width\": 99, \"step\": 5, \"date_format\": \"DD/MM\", \"view_mode\": \"Week\"}");

        assertThat(o.getViewMode()).isEqualTo(ViewMode.WEEK);
        assertThat(o.getViewMode().getColumnWidth()).isEqualTo(140);
        assertThat(o.getViewMode().getStep()).isEqualTo(24 * 7);
        assertThat(o.getRowHeight()).isEqualTo(38);
    }

    @Test
    void malformedJsonFallsBackToDefaults() {
        assertThat(GanttOptionsLoader.fromJson("{ not json").getViewMode()).isEqualTo(ViewMode.DAY);
        assertThat(GanttOptionsLoader.fromJson("{\"view_mode\": \"Fortnight\"}").getViewMode())
                .isEqualTo(ViewMode.DAY);
    }

    @Test
    void loadReadsSystemProperty() {
        System.setProperty(GanttOptionsLoader.OPTIONS_JSON_PROPERTY, "{\"view_mode\": \"Month\"}");

        assertThat(GanttOptionsLoader.load().getViewMode()).isEqualTo(ViewMode.MONTH);
    }

    @Test
    void fromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("options.json");
        Files.writeString(file, "{\"padding\": 10, \"view_modes\": [\"Day\", \"Week\"]}", StandardCharsets.UTF_8);

        GanttOptions o = GanttOptionsLoader.fromFile(file.toFile());

        assertThat(o.getPadding()).isEqualTo(10);
        assertThat(o.getViewModes()).containsExactly(ViewMode.DAY, ViewMode.WEEK);
        assertThatThrownBy(() -> GanttOptionsLoader.fromFile(new File(dir.toFile(), "missing.json")))
                .isInstanceOf(IOException.class);
    }

    @Test
    void copyIsIndependent() {
        GanttOptions o = new GanttOptions();
        GanttOptions copy = o.copy();

        copy.setViewMode(ViewMode.YEAR);
        copy.getViewModes().clear();

        assertThat(o.getViewMode()).isEqualTo(ViewMode.DAY);
        assertThat(o.getViewModes()).hasSize(6);
    }
}
