package com.architecture.memory.mergeflow.repository;

import com.architecture.memory.mergeflow.model.TrackedRepository;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface TrackedRepositoryRepository extends MongoRepository<TrackedRepository, String> {

    Optional<TrackedRepository> findByFullName(String fullName);
}
