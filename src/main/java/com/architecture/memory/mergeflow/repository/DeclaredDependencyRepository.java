package com.architecture.memory.mergeflow.repository;

import com.architecture.memory.mergeflow.model.DeclaredDependency;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DeclaredDependencyRepository extends MongoRepository<DeclaredDependency, String> {

    List<DeclaredDependency> findByRepositoryId(String repositoryId);
}
