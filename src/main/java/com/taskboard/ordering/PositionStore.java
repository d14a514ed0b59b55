package com.taskboard.ordering;

import com.taskboard.AppLogger;
import com.taskboard.errors.StorageException;
import com.taskboard.errors.ValidationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Keeps positions dense and zero-based within each container.
 *
 * Every operation validates first, then shifts neighbours and writes the moved row under the
 * container lock(s), then persists. Move and remove read the row's container before locking and
 * retry when it changed by the time the locks are held. If persisting fails the in-memory rows are put back to
 * their previous container and position and the {@link StorageException} propagates.
 */
public class PositionStore<T> {

    // lock key for rows that are not in any container
    private static final String UNCONTAINED = "\u0000none";

    private final String name;
    private final PositionedRows<T> rows;
    private final ContainerLocks locks = new ContainerLocks();

    public PositionStore(String name, PositionedRows<T> rows) {
        this.name = name;
        this.rows = rows;
    }

    /**
     * Insert a row. A null position appends.
     *
     * @return the assigned position
     */
    public int insert(T row, String container, Integer desiredPosition) {
        Objects.requireNonNull(container, "container");
        return locks.withLocks(Collections.singletonList(container), () -> {
            List<T> current = without(rows.rowsIn(container), row);
            int size = current.size();
            int position = desiredPosition == null ? size : desiredPosition;
            checkRange(position, size);

            Undo undo = new Undo();
            for (T other : current) {
                if (rows.positionOf(other) >= position) {
                    undo.record(other);
                    rows.place(other, container, rows.positionOf(other) + 1);
                }
            }
            undo.recordInsert(row);
            rows.place(row, container, position);
            commit(undo);
            return position;
        });
    }

    /**
     * Move a row to a position in the target container, which may be its current one.
     * Within the same container a position equal to the size means "last".
     *
     * @return the final position
     */
    public int move(T row, String targetContainer, int desiredPosition) {
        Objects.requireNonNull(targetContainer, "targetContainer");
        while (true) {
            String source = rows.containerOf(row);
            List<String> keys = targetContainer.equals(source)
                ? Collections.singletonList(targetContainer)
                : Arrays.asList(lockKey(source), targetContainer);
            Integer result = locks.withLocks(keys, () -> {
                if (!Objects.equals(source, rows.containerOf(row))) {
                    return null;
                }
                if (targetContainer.equals(source)) {
                    return moveWithin(row, targetContainer, desiredPosition);
                }
                return moveAcross(row, source, targetContainer, desiredPosition);
            });
            if (result != null) {
                return result;
            }
            // the row changed container before the locks were taken
        }
    }

    /**
     * Remove a row from its container and close the gap. A row without a container is just evicted.
     */
    public void remove(T row) {
        while (true) {
            String container = rows.containerOf(row);
            Boolean removed = locks.withLocks(Collections.singletonList(lockKey(container)), () -> {
                if (!Objects.equals(container, rows.containerOf(row))) {
                    return null;
                }
                if (container == null) {
                    evictUncontained(row);
                } else {
                    removeFrom(row, container);
                }
                return Boolean.TRUE;
            });
            if (removed != null) {
                return;
            }
        }
    }

    private void evictUncontained(T row) {
        rows.evict(row);
        try {
            rows.persist();
        } catch (StorageException e) {
            rows.restore(row);
            throw e;
        }
    }

    private void removeFrom(T row, String container) {
        int removedAt = rows.positionOf(row);
        Undo undo = new Undo();
        undo.recordRemoval(row);
        rows.evict(row);
        for (T other : without(rows.rowsIn(container), row)) {
            if (rows.positionOf(other) > removedAt) {
                undo.record(other);
                rows.place(other, container, rows.positionOf(other) - 1);
            }
        }
        commit(undo);
    }

    private static String lockKey(String container) {
        return container != null ? container : UNCONTAINED;
    }

    private int moveWithin(T row, String container, int desiredPosition) {
        List<T> current = without(rows.rowsIn(container), row);
        int size = current.size() + 1;
        checkRange(desiredPosition, size);
        int target = Math.min(desiredPosition, size - 1);
        int old = rows.positionOf(row);
        if (target == old) {
            return old;
        }

        Undo undo = new Undo();
        for (T other : current) {
            int p = rows.positionOf(other);
            if (target > old && p > old && p <= target) {
                undo.record(other);
                rows.place(other, container, p - 1);
            } else if (target < old && p >= target && p < old) {
                undo.record(other);
                rows.place(other, container, p + 1);
            }
        }
        undo.record(row);
        rows.place(row, container, target);
        commit(undo);
        return target;
    }

    private int moveAcross(T row, String source, String target, int desiredPosition) {
        List<T> destination = without(rows.rowsIn(target), row);
        checkRange(desiredPosition, destination.size());

        Undo undo = new Undo();
        if (source != null) {
            int old = rows.positionOf(row);
            for (T other : without(rows.rowsIn(source), row)) {
                if (rows.positionOf(other) > old) {
                    undo.record(other);
                    rows.place(other, source, rows.positionOf(other) - 1);
                }
            }
        }
        for (T other : destination) {
            if (rows.positionOf(other) >= desiredPosition) {
                undo.record(other);
                rows.place(other, target, rows.positionOf(other) + 1);
            }
        }
        undo.record(row);
        rows.place(row, target, desiredPosition);
        commit(undo);
        return desiredPosition;
    }

    private void checkRange(int position, int size) {
        if (position < 0 || position > size) {
            throw new ValidationException("Position " + position + " is out of range 0.." + size);
        }
    }

    private List<T> without(List<T> list, T row) {
        String id = rows.idOf(row);
        List<T> result = new ArrayList<>(list.size());
        for (T other : list) {
            if (!rows.idOf(other).equals(id)) {
                result.add(other);
            }
        }
        return result;
    }

    private void commit(Undo undo) {
        try {
            rows.persist();
        } catch (StorageException e) {
            undo.rollback();
            logWarning("Rolled back " + name + " reorder after failed write: " + e.getMessage());
            throw e;
        }
    }

    private void logWarning(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[PositionStore] " + message);
        } else {
            System.out.println("[PositionStore] " + message);
        }
    }

    /**
     * Previous placement of every row touched by one operation.
     */
    private class Undo {
        private final List<T> touched = new ArrayList<>();
        private final List<String> containers = new ArrayList<>();
        private final List<Integer> positions = new ArrayList<>();
        private T inserted;
        private T removed;

        void record(T row) {
            touched.add(row);
            containers.add(rows.containerOf(row));
            positions.add(rows.positionOf(row));
        }

        void recordInsert(T row) {
            inserted = row;
        }

        void recordRemoval(T row) {
            removed = row;
        }

        void rollback() {
            for (int i = touched.size() - 1; i >= 0; i--) {
                rows.place(touched.get(i), containers.get(i), positions.get(i));
            }
            if (inserted != null) {
                rows.evict(inserted);
            }
            if (removed != null) {
                rows.restore(removed);
            }
        }
    }
}
