package com.nfltrends.api.repository;

import com.nfltrends.api.model.GameDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

/**
 * Read-only repository for games. Filtered queries go through {@link MongoRecordStore}.
 */
@Repository
public interface GameReadRepository extends MongoRepository<GameDocument, String> {
}
