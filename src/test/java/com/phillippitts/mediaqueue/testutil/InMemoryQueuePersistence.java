package com.phillippitts.mediaqueue.testutil;

import com.phillippitts.mediaqueue.domain.Job;
import com.phillippitts.mediaqueue.service.persistence.QueuePersistence;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Keeps the last saved snapshot in memory. An optional listener sees every snapshot as it is
 * saved, on the saving thread.
 */
public class InMemoryQueuePersistence implements QueuePersistence {

    private volatile List<Job> saved = List.of();
    private final AtomicInteger saveCount = new AtomicInteger();
    private volatile Consumer<List<Job>> onSave = jobs -> { };

    public InMemoryQueuePersistence() {
    }

    public InMemoryQueuePersistence(List<Job> initial) {
        this.saved = List.copyOf(initial);
    }

    @Override
    public void save(List<Job> jobs) {
        saved = List.copyOf(jobs);
        saveCount.incrementAndGet();
        onSave.accept(saved);
    }

    public void onSave(Consumer<List<Job>> listener) {
        this.onSave = listener;
    }

    @Override
    public List<Job> load() {
        return saved;
    }

    public List<Job> saved() {
        return saved;
    }

    public int saveCount() {
        return saveCount.get();
    }
}
