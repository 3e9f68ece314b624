package com.phiguard.application;

import com.phiguard.config.PhiGuardProperties;
import com.phiguard.domain.model.RotationJob;
import com.phiguard.domain.model.RotationStatus;
import com.phiguard.support.RotationFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RotationJobRunnerTest {

    private RotationFixture fixture;
    private PhiGuardProperties properties;
    private RotationJobRunner runner;

    @BeforeEach
    void setUp() {
        fixture = new RotationFixture();
        properties = new PhiGuardProperties();
        properties.getRotation().setBatchSize(2);
        runner = new RotationJobRunner(fixture.orchestrator, properties);
    }

    @Test
    void each_tick_advances_one_batch() {
        fixture.seedClients(5);
        RotationJob job = fixture.orchestrator.start("v2", false, "ops");

        runner.tick();
        assertEquals(RotationStatus.RUNNING, fixture.orchestrator.status(job.getId()).getStatus());
        assertEquals(2L, fixture.orchestrator.status(job.getId()).getCheckpoint().getCursor());

        runner.tick();
        runner.tick();
        runner.tick();

        RotationJob current = fixture.orchestrator.status(job.getId());
        assertTrue(current.isExhausted());
        assertEquals(RotationStatus.RUNNING, current.getStatus());
        assertEquals(5, current.getCheckpoint().getMigrated());
    }

    @Test
    void auto_complete_finishes_an_exhausted_job() {
        properties.getRotation().setAutoComplete(true);
        fixture.seedClients(3);
        RotationJob job = fixture.orchestrator.start("v2", false, "ops");

        runner.tick();
        runner.tick();

        assertEquals(RotationStatus.COMPLETED, fixture.orchestrator.status(job.getId()).getStatus());
        assertEquals(0, fixture.fields.countByKeyVersion("v1"));
    }

    @Test
    void disabled_runner_does_nothing() {
        properties.getRotation().setRunnerEnabled(false);
        fixture.seedClients(3);
        RotationJob job = fixture.orchestrator.start("v2", false, "ops");

        runner.tick();

        assertEquals(RotationStatus.PENDING, fixture.orchestrator.status(job.getId()).getStatus());
    }

    @Test
    void paused_jobs_are_left_alone_and_errors_do_not_escape() {
        fixture.seedClients(4);
        RotationJob job = fixture.orchestrator.start("v2", false, "ops");
        runner.tick();
        fixture.orchestrator.pause(job.getId());

        runner.tick();
        assertEquals(2L, fixture.orchestrator.status(job.getId()).getCheckpoint().getCursor());

        fixture.orchestrator.resume(job.getId());
        fixture.fields.setBeforeCompareAndSet(id -> {
            throw new IllegalStateException("database unavailable");
        });
        assertDoesNotThrow(() -> runner.tick());
        assertEquals(2L, fixture.orchestrator.status(job.getId()).getCheckpoint().getCursor());
    }
}
