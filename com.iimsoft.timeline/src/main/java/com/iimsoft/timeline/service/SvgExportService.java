package com.iimsoft.timeline.service;

import com.iimsoft.timeline.render.SvgShapeRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;

public class SvgExportService {

    private static final Logger LOGGER = LoggerFactory.getLogger(SvgExportService.class);

    /**
     * 把渲染结果写成 SVG 文件（UTF-8）。相对路径按当前工作目录解析，已存在的文件会被覆盖。
     *
     * @return 实际写入的文件
     */
    public static File export(SvgShapeRenderer renderer, String svgPath) throws IOException {
        File file = new File(svgPath);
        if (!file.isAbsolute()) {
            file = new File(System.getProperty("user.dir"), svgPath);
        }
        if (file.isDirectory()) {
            throw new IOException("目标路径是目录: " + file.getAbsolutePath());
        }
        File parent = file.getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            throw new IOException("无法创建目录: " + parent.getAbsolutePath());
        }
        try (BufferedWriter writer = new BufferedWriter(
                new OutputStreamWriter(new FileOutputStream(file), StandardCharsets.UTF_8))) {
            writer.write("<?xml version=\"1.0\" encoding=\"UTF-8\"?>");
            writer.write(System.lineSeparator());
            writer.write(renderer.toSvg());
            writer.flush();
        }
        LOGGER.info("SVG written to {}", file.getAbsolutePath());
        return file;
    }
}
