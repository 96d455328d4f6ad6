package com.delta.marketloader.ingest.service;

import com.delta.marketloader.ingest.model.ProcessRunView;
import com.delta.marketloader.ingest.model.RunState;
import com.delta.marketloader.ingest.persistence.LoaderJdbcRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

@SpringBootTest
@ActiveProfiles("test")
class ProcessTrackerTest {

    @Autowired
    private ProcessTracker tracker;

    @Autowired
    private LoaderJdbcRepository repository;

    @Autowired
    private ProcessRunLifecycleRunner lifecycleRunner;

    private static String processName(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    @Test
    void secondStartWhileRunningIsRejected() {
        String process = processName("tracker");
        long runId = tracker.start(process);

        assertThatThrownBy(() -> tracker.start(process))
            .isInstanceOfSatisfying(ActiveLoadRunException.class, e -> assertEquals(runId, e.getActiveRunId()));

        tracker.complete(runId, RunState.SUCCESS, 3, 0, 1, "cache_hits=2");
        long next = tracker.start(process);
        assertNotEquals(runId, next);
        tracker.complete(next, RunState.FAILED, 0, 1, 0, null);
    }

    @Test
    void completionIsVisibleThroughFindAndRecent() {
        String process = processName("tracker");
        long runId = tracker.start(process);
        tracker.complete(runId, RunState.COMPLETED_WITH_ERRORS, 4, 1, 0, "cache_hits=0");

        ProcessRunView run = tracker.find(runId).orElseThrow();
        assertEquals(RunState.COMPLETED_WITH_ERRORS, run.state());
        assertEquals(4, run.succeededCount());
        assertThat(run.finishedAt()).isNotNull();
        assertThat(tracker.recent(process, 10)).extracting(ProcessRunView::id).containsExactly(runId);
    }

    @Test
    void completingWithRunningStateIsRejected() {
        assertThatThrownBy(() -> tracker.complete(1L, RunState.RUNNING, 0, 0, 0, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void startupCleanupFailsAbandonedRuns() throws Exception {
        String process = processName("abandoned");
        long abandoned = repository.insertProcessRun(process, Instant.now().minus(Duration.ofHours(6)));

        lifecycleRunner.run(null);

        ProcessRunView run = tracker.find(abandoned).orElseThrow();
        assertEquals(RunState.FAILED, run.state());
        assertEquals(ProcessRunLifecycleRunner.ABORTED_NOTE, run.notes());
        long restarted = tracker.start(process);
        assertThat(restarted).isPositive();
        tracker.complete(restarted, RunState.SUCCESS, 0, 0, 0, null);
    }
}
