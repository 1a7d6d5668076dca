package com.architecture.memory.mergeflow.repository;

import com.architecture.memory.mergeflow.model.PRWorkflow;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface PRWorkflowRepository extends MongoRepository<PRWorkflow, String> {

    // Active workflows in creation order; the graph relies on this order
    List<PRWorkflow> findByRepositoryIdAndStatusNotInOrderByCreatedAtAsc(String repositoryId, Collection<String> statuses);

}
