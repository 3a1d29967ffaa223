package com.iimsoft.timeline.service;

import com.iimsoft.timeline.render.ShapeRenderer;
import com.iimsoft.timeline.render.SvgShapeRenderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SvgExportServiceTest {

    @Test
    void writesUtf8Svg(@TempDir Path dir) throws IOException {
        SvgShapeRenderer renderer = new SvgShapeRenderer();
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put(ShapeRenderer.TEXT, "Январь");
        renderer.createShape("text", attrs, null);

        File out = SvgExportService.export(renderer, dir.resolve("nested/chart.svg").toString());

        String svg = Files.readString(out.toPath(), StandardCharsets.UTF_8);
        assertThat(svg).startsWith("<?xml version=\"1.0\" encoding=\"UTF-8\"?>");
        assertThat(svg).contains("<text>Январь</text>");
    }

    @Test
    void directoryTargetIsRejected(@TempDir Path dir) {
        assertThatThrownBy(() -> SvgExportService.export(new SvgShapeRenderer(), dir.toString()))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("目录");
    }
}
