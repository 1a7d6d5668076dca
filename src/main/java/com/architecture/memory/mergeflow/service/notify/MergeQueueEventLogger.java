package com.architecture.memory.mergeflow.service.notify;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Writes every queue event to the log. Runs off the publishing thread.
 */
@Component
@Slf4j
public class MergeQueueEventLogger {

    @Async
    @EventListener
    public void onQueueEvent(MergeQueueEvent event) {
        log.info("Merge queue {} in repository {}: PR #{} {}", event.getType(), event.getRepositoryId(),
                event.getPrNumber(), event.getMessage() != null ? event.getMessage() : "");
    }
}
