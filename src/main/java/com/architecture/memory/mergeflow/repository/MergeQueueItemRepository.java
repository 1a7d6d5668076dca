package com.architecture.memory.mergeflow.repository;

import com.architecture.memory.mergeflow.model.MergeQueueItem;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface MergeQueueItemRepository extends MongoRepository<MergeQueueItem, String> {

    List<MergeQueueItem> findByRepositoryId(String repositoryId, Sort sort);

    Optional<MergeQueueItem> findByRepositoryIdAndPrNumber(String repositoryId, int prNumber);

    long deleteByRepositoryIdAndPrNumber(String repositoryId, int prNumber);
}
