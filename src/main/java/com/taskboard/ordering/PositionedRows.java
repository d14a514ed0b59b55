package com.taskboard.ordering;

import java.util.List;

/**
 * Adapter exposing a store's rows as items grouped into ordered containers.
 */
public interface PositionedRows<T> {

    String idOf(T row);

    String containerOf(T row);

    int positionOf(T row);

    /**
     * Rows currently in the container, ordered by position.
     */
    List<T> rowsIn(String container);

    /**
     * Set the row's container and position in memory, adding it if absent.
     */
    void place(T row, String container, int position);

    void evict(T row);

    void restore(T row);

    /**
     * Write the current in-memory state. Throws {@link com.taskboard.errors.StorageException} on failure.
     */
    void persist();
}
