package com.architecture.memory.mergeflow.service.notify;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Hands queue events to Spring's event bus so delivery transports can subscribe with {@code @EventListener}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ApplicationEventQueueNotificationBroadcaster implements QueueNotificationBroadcaster {

    private final ApplicationEventPublisher eventPublisher;

    @Override
    public void publish(MergeQueueEvent event) {
        try {
            eventPublisher.publishEvent(event);
        } catch (RuntimeException e) {
            log.warn("Failed to publish {} event for PR #{} in repository {}: {}",
                    event.getType(), event.getPrNumber(), event.getRepositoryId(), e.getMessage());
        }
    }
}
