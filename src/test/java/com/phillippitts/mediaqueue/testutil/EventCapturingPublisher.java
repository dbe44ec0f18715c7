package com.phillippitts.mediaqueue.testutil;

import com.phillippitts.mediaqueue.service.events.JobFinishedEvent;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test double for ApplicationEventPublisher that captures events for verification.
 *
 * <p>Thread-safe implementation using CopyOnWriteArrayList for concurrent test scenarios.
 */
public class EventCapturingPublisher implements ApplicationEventPublisher {
    private final List<Object> events = new CopyOnWriteArrayList<>();

    @Override
    public void publishEvent(ApplicationEvent event) {
        events.add(event);
    }

    @Override
    public void publishEvent(Object event) {
        events.add(event);
    }

    public List<JobFinishedEvent> jobFinishedEvents() {
        return events.stream()
                .filter(e -> e instanceof JobFinishedEvent)
                .map(e -> (JobFinishedEvent) e)
                .toList();
    }

    public void clear() {
        events.clear();
    }
}
