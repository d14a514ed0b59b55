package com.taskboard.ordering;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per container key. Multiple keys are always acquired in sorted order.
 */
public class ContainerLocks {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <R> R withLocks(Collection<String> containers, Supplier<R> action) {
        List<ReentrantLock> acquired = new ArrayList<>();
        try {
            for (String container : new TreeSet<>(containers)) {
                ReentrantLock lock = locks.computeIfAbsent(container, key -> new ReentrantLock());
                lock.lock();
                acquired.add(lock);
            }
            return action.get();
        } finally {
            for (int i = acquired.size() - 1; i >= 0; i--) {
                acquired.get(i).unlock();
            }
        }
    }
}
