package com.iimsoft.timeline.app;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class TimelineAppTest {

    @Test
    void rendersDemoTasks(@TempDir Path dir) throws IOException {
        File out = new TimelineApp().run(null, dir.resolve("demo.svg").toString(), "Week");

        assertThat(out).isFile();
        String svg = Files.readString(out.toPath(), StandardCharsets.UTF_8);
        assertThat(svg).contains("data-id=\"Task 1\"", "class=\"arrow\"", "Redesign website");
    }

    @Test
    void rendersTaskFile(@TempDir Path dir) throws IOException {
        Path input = dir.resolve("tasks.json");
        Files.writeString(input, "[{\"id\": \"a\", \"name\": \"Alpha\", \"start\": \"2024-01-10\", \"end\": \"2024-01-11\"}]",
                StandardCharsets.UTF_8);

        File out = new TimelineApp().run(input.toString(), dir.resolve("out.svg").toString(), "nonsense");

        assertThat(out).isFile();
        assertThat(Files.readString(out.toPath(), StandardCharsets.UTF_8)).contains("Alpha");
    }

    @Test
    void missingInputFails(@TempDir Path dir) {
        assertThat(new TimelineApp().run(dir.resolve("missing.json").toString(),
                dir.resolve("out.svg").toString(), null)).isNull();
    }
}
