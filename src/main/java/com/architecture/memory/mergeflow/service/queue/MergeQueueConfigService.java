package com.architecture.memory.mergeflow.service.queue;

import com.architecture.memory.mergeflow.dto.queue.MergeQueueConfig;
import com.architecture.memory.mergeflow.dto.queue.MergeQueueConfigUpdate;
import com.architecture.memory.mergeflow.exception.ValidationException;
import com.architecture.memory.mergeflow.model.MergeQueueSettings;
import com.architecture.memory.mergeflow.repository.MergeQueueSettingsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * Per-repository merge queue policy. Only overridden values are persisted.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MergeQueueConfigService {

    private final MergeQueueSettingsRepository settingsRepository;

    /**
     * Effective config of a repository. Falls back to the defaults when nothing is stored
     * or the store cannot be read.
     */
    public MergeQueueConfig getConfig(String repositoryId) {
        try {
            return settingsRepository.findById(repositoryId)
                    .map(MergeQueueConfigService::applyOverrides)
                    .orElseGet(MergeQueueConfig::defaults);
        } catch (DataAccessException e) {
            log.warn("Could not load merge queue config for repository {}, using defaults: {}",
                    repositoryId, e.getMessage());
            return MergeQueueConfig.defaults();
        }
    }

    public MergeQueueConfig setConfig(String repositoryId, MergeQueueConfigUpdate update) {
        validate(update);

        MergeQueueSettings settings = settingsRepository.findById(repositoryId)
                .orElseGet(() -> MergeQueueSettings.builder().repositoryId(repositoryId).build());

        if (update.getEnabled() != null) settings.setEnabled(update.getEnabled());
        if (update.getAutoMergeEnabled() != null) settings.setAutoMergeEnabled(update.getAutoMergeEnabled());
        if (update.getRequireApprovals() != null) settings.setRequireApprovals(update.getRequireApprovals());
        if (update.getRequireChecks() != null) settings.setRequireChecks(update.getRequireChecks());
        if (update.getRequireUpToDate() != null) settings.setRequireUpToDate(update.getRequireUpToDate());
        if (update.getCheckConflicts() != null) settings.setCheckConflicts(update.getCheckConflicts());
        if (update.getAutoResolveConflicts() != null) settings.setAutoResolveConflicts(update.getAutoResolveConflicts());
        if (update.getMergeMethod() != null) settings.setMergeMethod(update.getMergeMethod());
        if (update.getBatchSize() != null) settings.setBatchSize(update.getBatchSize());
        if (update.getMaxWaitTimeMinutes() != null) settings.setMaxWaitTimeMinutes(update.getMaxWaitTimeMinutes());
        if (update.getBlockingPolicy() != null) settings.setBlockingPolicy(update.getBlockingPolicy());
        settings.setUpdatedAt(LocalDateTime.now());

        MergeQueueSettings saved = settingsRepository.save(settings);
        log.info("Updated merge queue config for repository {}", repositoryId);
        return applyOverrides(saved);
    }

    private static void validate(MergeQueueConfigUpdate update) {
        if (update == null) {
            throw new ValidationException("Config update must not be empty");
        }
        checkRange("requireApprovals", update.getRequireApprovals(), 0, 10);
        checkRange("batchSize", update.getBatchSize(), 1, 10);
        checkRange("maxWaitTimeMinutes", update.getMaxWaitTimeMinutes(), 5, 1440);
    }

    private static void checkRange(String field, Integer value, int min, int max) {
        if (value != null && (value < min || value > max)) {
            throw new ValidationException(field + " must be between " + min + " and " + max);
        }
    }

    static MergeQueueConfig applyOverrides(MergeQueueSettings settings) {
        MergeQueueConfig.MergeQueueConfigBuilder config = MergeQueueConfig.defaults().toBuilder();
        if (settings.getEnabled() != null) config.enabled(settings.getEnabled());
        if (settings.getAutoMergeEnabled() != null) config.autoMergeEnabled(settings.getAutoMergeEnabled());
        if (settings.getRequireApprovals() != null) config.requireApprovals(settings.getRequireApprovals());
        if (settings.getRequireChecks() != null) config.requireChecks(settings.getRequireChecks());
        if (settings.getRequireUpToDate() != null) config.requireUpToDate(settings.getRequireUpToDate());
        if (settings.getCheckConflicts() != null) config.checkConflicts(settings.getCheckConflicts());
        if (settings.getAutoResolveConflicts() != null) config.autoResolveConflicts(settings.getAutoResolveConflicts());
        if (settings.getMergeMethod() != null) config.mergeMethod(settings.getMergeMethod());
        if (settings.getBatchSize() != null) config.batchSize(settings.getBatchSize());
        if (settings.getMaxWaitTimeMinutes() != null) config.maxWaitTimeMinutes(settings.getMaxWaitTimeMinutes());
        if (settings.getBlockingPolicy() != null) config.blockingPolicy(settings.getBlockingPolicy());
        return config.build();
    }
}
