package com.taskforge.coordination.service;

import com.taskforge.coordination.api.StreamingIngestService;
import com.taskforge.stream.TaskStreamHub;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class StaleSessionSweeper {

    private final StreamingIngestService streamingIngestService;
    private final TaskStreamHub taskStreamHub;

    @Scheduled(initialDelayString = "${taskforge.streaming.sweep-interval:5m}",
            fixedDelayString = "${taskforge.streaming.sweep-interval:5m}")
    public void sweep() {
        try {
            streamingIngestService.reclaimStaleSessions();
        } catch (RuntimeException ex) {
            log.error("Stale streaming session sweep failed", ex);
        }
        try {
            taskStreamHub.pruneRooms();
        } catch (RuntimeException ex) {
            log.error("Task stream room pruning failed", ex);
        }
    }
}
