package com.architecture.memory.archstage.scheduler;

import com.architecture.memory.archstage.service.ChangesetCommandService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Removes discarded changesets past their retention and temp files left by interrupted writes.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ChangesetCleanupScheduler {

    private final ChangesetCommandService commandService;

    @Scheduled(fixedRateString = "${archstage.cleanup-interval-ms:3600000}")
    public void cleanupChangesets() {
        log.debug("Running changeset cleanup...");
        try {
            int removed = commandService.cleanup();
            if (removed > 0) {
                log.info("Changeset cleanup completed: {} item(s) removed", removed);
            }
        } catch (Exception e) {
            log.error("Changeset cleanup failed: {}", e.getMessage(), e);
        }
    }
}
