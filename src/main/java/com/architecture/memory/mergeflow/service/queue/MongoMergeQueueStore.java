package com.architecture.memory.mergeflow.service.queue;

import com.architecture.memory.mergeflow.model.MergeQueueItem;
import com.architecture.memory.mergeflow.repository.MergeQueueItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merge queue kept in the {@code merge_queue_items} collection. The unique index on
 * (repositoryId, prNumber) settles concurrent inserts and {@code @Version} guards updates.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MongoMergeQueueStore implements MergeQueueStore {

    private static final int MAX_UPDATE_ATTEMPTS = 3;

    private static final Sort QUEUE_SORT = Sort.by(Sort.Order.desc("priority"),
            Sort.Order.asc("addedAt"), Sort.Order.asc("prNumber"));

    private final MergeQueueItemRepository itemRepository;

    @Override
    public Optional<MergeQueueItem> find(String repositoryId, int prNumber) {
        return itemRepository.findByRepositoryIdAndPrNumber(repositoryId, prNumber);
    }

    @Override
    public List<MergeQueueItem> findQueue(String repositoryId) {
        return itemRepository.findByRepositoryId(repositoryId, QUEUE_SORT);
    }

    @Override
    public boolean insertIfAbsent(MergeQueueItem item) {
        if (find(item.getRepositoryId(), item.getPrNumber()).isPresent()) {
            return false;
        }
        try {
            itemRepository.insert(item);
            return true;
        } catch (DuplicateKeyException e) {
            log.debug("PR #{} was queued concurrently in repository {}", item.getPrNumber(), item.getRepositoryId());
            return false;
        }
    }

    @Override
    public Optional<MergeQueueItem> update(String repositoryId, int prNumber, Consumer<MergeQueueItem> change) {
        for (int attempt = 1; ; attempt++) {
            Optional<MergeQueueItem> current = find(repositoryId, prNumber);
            if (current.isEmpty()) {
                return Optional.empty();
            }
            MergeQueueItem item = current.get();
            change.accept(item);
            try {
                return Optional.of(itemRepository.save(item));
            } catch (OptimisticLockingFailureException e) {
                if (attempt >= MAX_UPDATE_ATTEMPTS) {
                    throw e;
                }
                log.debug("Concurrent update of PR #{} in repository {}, retrying", prNumber, repositoryId);
            }
        }
    }

    @Override
    public boolean remove(String repositoryId, int prNumber) {
        return itemRepository.deleteByRepositoryIdAndPrNumber(repositoryId, prNumber) > 0;
    }
}
