package com.nfltrends.api.repository;

import com.nfltrends.api.model.WeeklyTrendDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface WeeklyTrendReadRepository extends MongoRepository<WeeklyTrendDocument, String> {
}
