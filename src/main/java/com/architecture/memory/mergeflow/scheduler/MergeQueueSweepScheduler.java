package com.architecture.memory.mergeflow.scheduler;

import com.architecture.memory.mergeflow.dto.queue.MergeQueueConfig;
import com.architecture.memory.mergeflow.model.MergeQueueItem;
import com.architecture.memory.mergeflow.model.TrackedRepository;
import com.architecture.memory.mergeflow.repository.TrackedRepositoryRepository;
import com.architecture.memory.mergeflow.service.notify.MergeQueueEvent;
import com.architecture.memory.mergeflow.service.notify.QueueNotificationBroadcaster;
import com.architecture.memory.mergeflow.service.queue.MergeQueueConfigService;
import com.architecture.memory.mergeflow.service.queue.MergeQueueProcessor;
import com.architecture.memory.mergeflow.service.queue.MergeQueueStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Runs one merge queue pass per tracked repository at a fixed delay and reports items that
 * have waited longer than their repository's {@code maxWaitTimeMinutes}.
 * Off unless {@code mergeflow.queue.sweep.enabled} is true.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "mergeflow.queue.sweep.enabled", havingValue = "true")
public class MergeQueueSweepScheduler {

    private final TrackedRepositoryRepository trackedRepositoryRepository;
    private final MergeQueueProcessor queueProcessor;
    private final MergeQueueConfigService configService;
    private final MergeQueueStore queueStore;
    private final QueueNotificationBroadcaster notificationBroadcaster;

    @Scheduled(fixedDelayString = "${mergeflow.queue.sweep.interval-ms:60000}")
    public void sweep() {
        log.debug("Running merge queue sweep...");
        int processed = 0;
        for (TrackedRepository repository : trackedRepositoryRepository.findAll()) {
            try {
                queueProcessor.processQueue(repository.getOwner(), repository.getName(), repository.getId());
                reportStaleItems(repository.getId());
                processed++;
            } catch (Exception e) {
                log.error("Merge queue sweep failed for {}: {}", repository.getFullName(), e.getMessage(), e);
            }
        }
        log.debug("Merge queue sweep completed for {} repositories", processed);
    }

    int reportStaleItems(String repositoryId) {
        MergeQueueConfig config = configService.getConfig(repositoryId);
        LocalDateTime now = LocalDateTime.now();
        int stale = 0;
        for (MergeQueueItem item : queueStore.findQueue(repositoryId)) {
            if (item.getAddedAt() == null) continue;
            long waited = Duration.between(item.getAddedAt(), now).toMinutes();
            if (waited >= config.getMaxWaitTimeMinutes()) {
                stale++;
                notificationBroadcaster.publish(MergeQueueEvent.builder()
                        .type(MergeQueueEvent.Type.STALE)
                        .repositoryId(repositoryId)
                        .prNumber(item.getPrNumber())
                        .status(item.getStatus())
                        .message("Waiting for " + waited + " minutes")
                        .occurredAt(now)
                        .build());
            }
        }
        if (stale > 0) {
            log.info("{} merge queue item(s) in repository {} exceeded {} minutes", stale, repositoryId,
                    config.getMaxWaitTimeMinutes());
        }
        return stale;
    }
}
