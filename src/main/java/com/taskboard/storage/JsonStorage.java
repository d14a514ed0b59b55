package com.taskboard.storage;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class JsonStorage {

    private static final ObjectMapper mapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static <T> List<T> readJsonList(Path path, Class<T[]> clazz) throws IOException {
        if (!Files.exists(path)) {
            return Collections.emptyList();
        }
        T[] items = mapper.readValue(path.toFile(), clazz);
        if (items == null || items.length == 0) {
            return Collections.emptyList();
        }
        return Arrays.asList(items);
    }

    /**
     * Writes to a sibling temp file first and then replaces the target, so a failed write
     * leaves the previous file intact.
     */
    public static void writeJsonList(Path path, List<?> data) throws IOException {
        Path parent = path.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), data);
        Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
    }
}
