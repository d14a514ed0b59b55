package com.taskboard.storage;

import com.taskboard.AppLogger;
import com.taskboard.errors.StorageException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Rows kept in memory and mirrored to a single JSON array file. With a null data
 * directory the store is memory only and {@link #persist()} does nothing.
 */
public abstract class JsonFileStore<T> {

    private final String name;
    private final Path storagePath;
    private final Class<T[]> arrayType;
    protected final Map<String, T> rows = new ConcurrentHashMap<>();

    protected JsonFileStore(String name, Path dataDirectory, String fileName, Class<T[]> arrayType) {
        this.name = name;
        this.storagePath = dataDirectory != null ? dataDirectory.resolve(fileName) : null;
        this.arrayType = arrayType;
        loadFromDisk();
    }

    protected abstract String keyOf(T row);

    public Optional<T> find(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(rows.get(key));
    }

    public List<T> all() {
        return new ArrayList<>(rows.values());
    }

    protected List<T> where(Predicate<T> filter) {
        return rows.values().stream().filter(filter).collect(Collectors.toList());
    }

    /**
     * Insert or replace the row and write the file. On a failed write the previous
     * in-memory state is put back before the exception propagates.
     */
    public T save(T row) {
        String key = keyOf(row);
        T previous = rows.put(key, row);
        try {
            persist();
        } catch (StorageException e) {
            if (previous != null) {
                rows.put(key, previous);
            } else {
                rows.remove(key);
            }
            throw e;
        }
        return row;
    }

    public boolean delete(String key) {
        T removed = rows.remove(key);
        if (removed == null) {
            return false;
        }
        try {
            persist();
        } catch (StorageException e) {
            rows.put(key, removed);
            throw e;
        }
        return true;
    }

    /**
     * Remove every row matching the filter in one write.
     */
    public List<T> deleteWhere(Predicate<T> filter) {
        List<T> removed = where(filter);
        if (removed.isEmpty()) {
            return removed;
        }
        for (T row : removed) {
            rows.remove(keyOf(row));
        }
        try {
            persist();
        } catch (StorageException e) {
            for (T row : removed) {
                rows.put(keyOf(row), row);
            }
            throw e;
        }
        return removed;
    }

    /**
     * In-memory put without writing; callers follow up with {@link #persist()}.
     */
    public void put(T row) {
        rows.put(keyOf(row), row);
    }

    public void evict(T row) {
        rows.remove(keyOf(row));
    }

    public void restore(T row) {
        rows.put(keyOf(row), row);
    }

    public synchronized void persist() {
        if (storagePath == null) {
            return;
        }
        try {
            JsonStorage.writeJsonList(storagePath, new ArrayList<>(rows.values()));
        } catch (Exception e) {
            logWarning("Failed to save to " + storagePath + ": " + e.getMessage());
            throw new StorageException("Failed to save " + name + " to " + storagePath, e);
        }
    }

    private void loadFromDisk() {
        if (storagePath == null) {
            return;
        }
        if (!Files.exists(storagePath)) {
            log("No storage found at " + storagePath + "; starting empty.");
            return;
        }
        try {
            List<T> stored = JsonStorage.readJsonList(storagePath, arrayType);
            for (T row : stored) {
                String key = keyOf(row);
                if (key != null && !key.isBlank()) {
                    rows.put(key, row);
                }
            }
            log("Loaded " + stored.size() + " row(s) from " + storagePath);
        } catch (Exception e) {
            throw new StorageException("Failed to load " + name + " from " + storagePath, e);
        }
    }

    protected void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[" + name + "] " + message);
        } else {
            System.out.println("[" + name + "] " + message);
        }
    }

    protected void logWarning(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[" + name + "] " + message);
        } else {
            System.out.println("[" + name + "] " + message);
        }
    }
}
