package com.nfltrends.api.repository;

import com.nfltrends.api.model.UpcomingGameDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Read-only repository for the upcoming games snapshot.
 */
@Repository
public interface UpcomingGameReadRepository extends MongoRepository<UpcomingGameDocument, String> {

    List<UpcomingGameDocument> findAllByOrderByDateAscIdStringAsc();
}
