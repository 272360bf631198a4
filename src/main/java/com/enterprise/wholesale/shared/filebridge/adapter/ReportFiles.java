package com.enterprise.wholesale.shared.filebridge.adapter;

import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.WritableResource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Helpers for the CSV reports the jobs write next to their tables.
 */
public final class ReportFiles {

    private ReportFiles() {}

    /** Resource for {@code fileName} under {@code outputDir}, creating the directory if needed. */
    public static WritableResource reportFile(String outputDir, String fileName) {
        Path dir = Path.of(outputDir);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create report directory " + dir, e);
        }
        return new FileSystemResource(dir.resolve(fileName));
    }

    /** Alternating field name and header name pairs, in column order. */
    public static Map<String, String> columns(String... pairs) {
        if (pairs.length % 2 != 0) {
            throw new IllegalArgumentException("columns need field/header pairs, got " + pairs.length + " names");
        }
        Map<String, String> columns = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            columns.put(pairs[i], pairs[i + 1]);
        }
        return columns;
    }
}
