package com.devcrew.orchestrator.service;

import com.devcrew.orchestrator.model.SystemStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background driver for the loaded workflow, enabled with
 * {@code devcrew.autorun.enabled=true}.
 *
 * Each tick advances the workflow by a single step while the system is
 * initializing or running. A paused, completed or failed workflow is left
 * alone until someone calls run() again.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(prefix = "devcrew.autorun", name = "enabled", havingValue = "true")
public class WorkflowAutoRunner {

    private static final Logger log = LoggerFactory.getLogger(WorkflowAutoRunner.class);

    private final Orchestrator orchestrator;

    public WorkflowAutoRunner(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Scheduled(fixedDelayString = "${devcrew.autorun.delay-ms:2000}")
    public void tick() {
        if (orchestrator.currentProjectId() == null) {
            return;
        }
        SystemStatus status = orchestrator.currentStatus();
        if (status != SystemStatus.INITIALIZING && status != SystemStatus.RUNNING) {
            return;
        }
        try {
            orchestrator.run(1);
        } catch (Exception e) {
            log.error("Unhandled error while stepping project {}: {}",
                    orchestrator.currentProjectId(), e.getMessage(), e);
        }
    }
}
