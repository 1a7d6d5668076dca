package com.architecture.memory.mergeflow.repository;

import com.architecture.memory.mergeflow.model.MergeQueueSettings;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface MergeQueueSettingsRepository extends MongoRepository<MergeQueueSettings, String> {
}
