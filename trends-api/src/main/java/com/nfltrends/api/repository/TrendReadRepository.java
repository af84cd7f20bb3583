package com.nfltrends.api.repository;

import com.nfltrends.api.model.TrendDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TrendReadRepository extends MongoRepository<TrendDocument, String> {
}
