package com.phillippitts.mediaqueue.service.health;

import com.phillippitts.mediaqueue.domain.OutboxSnapshot;
import com.phillippitts.mediaqueue.domain.QueueSummary;
import com.phillippitts.mediaqueue.service.engine.QueueEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class QueueHealthIndicatorTest {

    private QueueEngine engine;
    private QueueHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        engine = mock(QueueEngine.class);
        when(engine.summary()).thenReturn(new QueueSummary(2, 1, 5, 0, 0));
        when(engine.isRunning()).thenReturn(true);
        indicator = new QueueHealthIndicator(engine);
    }

    @Test
    void upWhenNoIngestEntryIsAbandoned() {
        when(engine.ingestSnapshot()).thenReturn(new OutboxSnapshot(2, 1, 0));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("running", true)
                .containsEntry("ingestPending", 2)
                .containsEntry("ingestErrors", 1)
                .containsEntry("ingestAbandoned", 0);
    }

    @Test
    void degradedWhenAnEntryWasAbandoned() {
        when(engine.ingestSnapshot()).thenReturn(new OutboxSnapshot(1, 1, 1));

        Health health = indicator.health();

        assertThat(health.getStatus().getCode()).isEqualTo("DEGRADED");
        assertThat(health.getDetails()).containsEntry("ingestAbandoned", 1);
    }
}
