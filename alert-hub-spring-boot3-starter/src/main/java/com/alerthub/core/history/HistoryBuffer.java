package com.alerthub.core.history;

import com.alerthub.model.Alert;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * 有界告警历史, 超出容量时淘汰最旧记录
 * 非线程安全, 调用方持有管道锁
 */
public class HistoryBuffer {

    private final int capacity;

    private final Deque<Alert> entries;

    public HistoryBuffer(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("history capacity must be >= 1, got " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    public void append(Alert alert) {
        entries.addLast(alert);
        while (entries.size() > capacity) {
            entries.removeFirst();
        }
    }

    /**
     * 返回时间戳不早于 since 的记录, 由旧到新
     */
    public List<Alert> query(Instant since) {
        return entries.stream()
                .filter(a -> !a.getTimestamp().isBefore(since))
                .toList();
    }

    public int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

    public void clear() {
        entries.clear();
    }
}
