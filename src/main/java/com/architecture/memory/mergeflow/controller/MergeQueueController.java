package com.architecture.memory.mergeflow.controller;

import com.architecture.memory.mergeflow.dto.queue.AddToQueueRequest;
import com.architecture.memory.mergeflow.dto.queue.ConflictingPR;
import com.architecture.memory.mergeflow.dto.queue.MergeQueueConfig;
import com.architecture.memory.mergeflow.dto.queue.MergeQueueConfigUpdate;
import com.architecture.memory.mergeflow.dto.queue.QueueAddition;
import com.architecture.memory.mergeflow.dto.queue.QueueOperationResult;
import com.architecture.memory.mergeflow.dto.queue.QueueProcessingResult;
import com.architecture.memory.mergeflow.dto.queue.QueueStats;
import com.architecture.memory.mergeflow.exception.ResourceNotFoundException;
import com.architecture.memory.mergeflow.model.MergeQueueItem;
import com.architecture.memory.mergeflow.model.TrackedRepository;
import com.architecture.memory.mergeflow.repository.TrackedRepositoryRepository;
import com.architecture.memory.mergeflow.service.queue.MergeQueueConfigService;
import com.architecture.memory.mergeflow.service.queue.MergeQueueService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for a repository's merge queue, addressed as {owner}/{repo}.
 */
@RestController
@RequestMapping("/api/repositories/{owner}/{repo}/merge-queue")
@RequiredArgsConstructor
@Slf4j
public class MergeQueueController {

    private final MergeQueueService mergeQueueService;
    private final MergeQueueConfigService configService;
    private final TrackedRepositoryRepository trackedRepositoryRepository;

    @GetMapping
    public ResponseEntity<List<MergeQueueItem>> getQueue(@PathVariable String owner, @PathVariable String repo) {
        log.info("Listing merge queue of {}/{}", owner, repo);
        TrackedRepository repository = resolveRepository(owner, repo);
        return ResponseEntity.ok(mergeQueueService.getQueue(repository.getId()));
    }

    @PostMapping
    public ResponseEntity<MergeQueueItem> addToQueue(@PathVariable String owner, @PathVariable String repo,
                                                     @Valid @RequestBody AddToQueueRequest request) {
        log.info("Adding PR #{} to merge queue of {}/{}", request.getPrNumber(), owner, repo);
        TrackedRepository repository = resolveRepository(owner, repo);
        QueueAddition addition = mergeQueueService.addToQueue(owner, repo, repository.getId(),
                request.getPrNumber(), request.getPriority());
        return ResponseEntity.status(addition.isCreated() ? HttpStatus.CREATED : HttpStatus.OK).body(addition.getItem());
    }

    @DeleteMapping("/{prNumber}")
    public ResponseEntity<QueueOperationResult> removeFromQueue(@PathVariable String owner, @PathVariable String repo,
                                                                @PathVariable int prNumber) {
        log.info("Removing PR #{} from merge queue of {}/{}", prNumber, owner, repo);
        TrackedRepository repository = resolveRepository(owner, repo);
        QueueOperationResult result = mergeQueueService.removeFromQueue(repository.getId(), prNumber);
        return result.isSuccess()
                ? ResponseEntity.ok(result)
                : ResponseEntity.status(HttpStatus.NOT_FOUND).body(result);
    }

    @GetMapping("/config")
    public ResponseEntity<MergeQueueConfig> getConfig(@PathVariable String owner, @PathVariable String repo) {
        TrackedRepository repository = resolveRepository(owner, repo);
        return ResponseEntity.ok(configService.getConfig(repository.getId()));
    }

    @PatchMapping("/config")
    public ResponseEntity<MergeQueueConfig> updateConfig(@PathVariable String owner, @PathVariable String repo,
                                                         @Valid @RequestBody MergeQueueConfigUpdate update) {
        log.info("Updating merge queue config of {}/{}", owner, repo);
        TrackedRepository repository = resolveRepository(owner, repo);
        return ResponseEntity.ok(configService.setConfig(repository.getId(), update));
    }

    @PostMapping("/process")
    public ResponseEntity<QueueProcessingResult> processQueue(@PathVariable String owner, @PathVariable String repo) {
        log.info("Processing merge queue of {}/{}", owner, repo);
        TrackedRepository repository = resolveRepository(owner, repo);
        return ResponseEntity.ok(mergeQueueService.processQueue(owner, repo, repository.getId()));
    }

    @GetMapping("/{prNumber}/conflicts")
    public ResponseEntity<List<ConflictingPR>> getConflicts(@PathVariable String owner, @PathVariable String repo,
                                                            @PathVariable int prNumber) {
        TrackedRepository repository = resolveRepository(owner, repo);
        return ResponseEntity.ok(mergeQueueService.getConflictingPRs(owner, repo, repository.getId(), prNumber));
    }

    @PostMapping("/{prNumber}/rebase")
    public ResponseEntity<QueueOperationResult> rebase(@PathVariable String owner, @PathVariable String repo,
                                                       @PathVariable int prNumber) {
        log.info("Rebasing PR #{} in merge queue of {}/{}", prNumber, owner, repo);
        TrackedRepository repository = resolveRepository(owner, repo);
        QueueOperationResult result = mergeQueueService.rebaseAndRetry(owner, repo, repository.getId(), prNumber);
        if (result.isSuccess()) {
            return ResponseEntity.ok(result);
        }
        HttpStatus status = result.getMessage() != null && result.getMessage().contains("not found")
                ? HttpStatus.NOT_FOUND
                : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(result);
    }

    @GetMapping("/stats")
    public ResponseEntity<QueueStats> getStats(@PathVariable String owner, @PathVariable String repo) {
        TrackedRepository repository = resolveRepository(owner, repo);
        return ResponseEntity.ok(mergeQueueService.getQueueStats(repository.getId()));
    }

    private TrackedRepository resolveRepository(String owner, String repo) {
        String fullName = TrackedRepository.fullName(owner, repo);
        return trackedRepositoryRepository.findByFullName(fullName)
                .orElseThrow(() -> new ResourceNotFoundException("Repository", fullName));
    }
}
