package com.colorcorrection.service.batch;

import com.colorcorrection.exception.AdmissionConflictException;
import com.colorcorrection.model.BatchStatus;
import com.colorcorrection.model.ItemProgress;
import com.colorcorrection.model.ItemResult;
import com.colorcorrection.model.ItemStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Progress of the current (or last) batch.
 *
 * All fields are guarded by one lock. Item statuses only move forward
 * (PENDING → QUEUED → COMPLETED/FAILED) and each terminal transition bumps
 * exactly one counter, so {@code completed + failed} never exceeds the item
 * count no matter how many workers report at once.
 *
 * {@link #reset} is the admission point: it refuses to start a batch while
 * another one is active.
 */
@Component
@Slf4j
public class BatchState {

    private final ReentrantLock lock = new ReentrantLock();

    private String batchId = "";
    private boolean active;
    private final Map<Integer, ItemProgress> items = new LinkedHashMap<>();
    private final List<ItemResult> results = new ArrayList<>();
    private int completed;
    private int failed;

    /**
     * Starts tracking a new batch, with every item PENDING.
     *
     * @throws AdmissionConflictException if a batch is active; nothing is changed
     */
    public void reset(String batchId, List<Integer> indices, List<String> filenames) {
        if (indices.size() != filenames.size()) {
            throw new IllegalArgumentException("Got " + indices.size() + " indices but " + filenames.size() + " filenames");
        }
        lock.lock();
        try {
            if (active) {
                throw new AdmissionConflictException(this.batchId);
            }
            this.batchId = batchId;
            this.active = true;
            this.completed = 0;
            this.failed = 0;
            items.clear();
            results.clear();
            for (int i = 0; i < indices.size(); i++) {
                int index = indices.get(i);
                items.put(index, new ItemProgress(index, filenames.get(i), ItemStatus.PENDING, null));
            }
        } finally {
            lock.unlock();
        }
    }

    public void updateStatus(int index, ItemStatus status) {
        updateStatus(index, status, null);
    }

    public void updateStatus(int index, ItemStatus status, String error) {
        lock.lock();
        try {
            transition(index, status, error);
        } finally {
            lock.unlock();
        }
    }

    public void addResult(ItemResult result) {
        lock.lock();
        try {
            results.add(result);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records the outcome of one item: the result (on success) and the
     * terminal status are written together.
     */
    public void completeItem(ItemResult result) {
        lock.lock();
        try {
            if (result.success()) {
                if (transition(result.index(), ItemStatus.COMPLETED, null)) {
                    results.add(result);
                }
            } else {
                transition(result.index(), ItemStatus.FAILED, result.error());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Fails every item that has not reached a terminal status.
     *
     * @return number of items failed by this call
     */
    public int failPending(String reason) {
        lock.lock();
        try {
            int count = 0;
            for (ItemProgress item : List.copyOf(items.values())) {
                if (!item.status().isTerminal() && transition(item.imageIndex(), ItemStatus.FAILED, reason)) {
                    count++;
                }
            }
            return count;
        } finally {
            lock.unlock();
        }
    }

    public boolean isActive() {
        lock.lock();
        try {
            return active;
        } finally {
            lock.unlock();
        }
    }

    public void markComplete() {
        lock.lock();
        try {
            active = false;
        } finally {
            lock.unlock();
        }
    }

    public String batchId() {
        lock.lock();
        try {
            return batchId;
        } finally {
            lock.unlock();
        }
    }

    public BatchStatus getStatus() {
        lock.lock();
        try {
            return new BatchStatus(batchId, active, items.size(), completed, failed,
                    List.copyOf(items.values()), results.size());
        } finally {
            lock.unlock();
        }
    }

    public List<ItemResult> results() {
        lock.lock();
        try {
            return List.copyOf(results);
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock
    private boolean transition(int index, ItemStatus status, String error) {
        ItemProgress current = items.get(index);
        if (current == null) {
            log.debug("Ignoring status {} for unknown item {}", status, index);
            return false;
        }
        if (current.status().isTerminal() || status.ordinal() < current.status().ordinal()) {
            log.debug("Ignoring transition {} -> {} for item {}", current.status(), status, index);
            return false;
        }
        items.put(index, new ItemProgress(index, current.filename(), status, error));
        if (status == ItemStatus.COMPLETED) {
            completed++;
        } else if (status == ItemStatus.FAILED) {
            failed++;
        }
        return true;
    }
}
