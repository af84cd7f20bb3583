package com.nfltrends.api.repository;

import com.nfltrends.query.execute.RecordStore;
import com.nfltrends.query.ordinal.CategoricalOrdinal;
import com.nfltrends.query.predicate.Predicate;
import com.nfltrends.query.sort.SortDirection;
import com.nfltrends.query.sort.SortKey;
import com.nfltrends.query.sort.SortSpec;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationOperation;
import org.springframework.data.mongodb.core.query.Query;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link RecordStore} over one MongoDB collection.
 * <p>
 * Plain sorts run as a find with sort, skip and limit. Sorts on categorical columns run as an
 * aggregation that adds each column's ordinal (null and unmatched sentinels included), sorts on
 * it and removes the helper fields again.
 */
public class MongoRecordStore<T> implements RecordStore<T> {

    private static final Logger log = LoggerFactory.getLogger(MongoRecordStore.class);
    private static final String ORDINAL_PREFIX = "_ordinal_";

    private final MongoTemplate mongoTemplate;
    private final CriteriaTranslator translator;
    private final Class<T> type;
    private final String collection;

    public MongoRecordStore(MongoTemplate mongoTemplate, CriteriaTranslator translator, Class<T> type, String collection) {
        this.mongoTemplate = mongoTemplate;
        this.translator = translator;
        this.type = type;
        this.collection = collection;
    }

    @Override
    public List<T> find(Predicate predicate, SortSpec sort, int limit, int offset) {
        if (!sort.hasCategoricalKeys()) {
            Query query = translator.toQuery(predicate)
                    .with(toSort(sort))
                    .skip(offset)
                    .limit(limit);
            log.debug("Find on {}: {}", collection, query);
            return mongoTemplate.find(query, type, collection);
        }
        Aggregation aggregation = Aggregation.newAggregation(ordinalSortPipeline(predicate, sort, limit, offset));
        log.debug("Aggregate on {}: {}", collection, aggregation);
        return mongoTemplate.aggregate(aggregation, collection, type).getMappedResults();
    }

    @Override
    public long count(Predicate predicate) {
        return mongoTemplate.count(translator.toQuery(predicate), type, collection);
    }

    List<AggregationOperation> ordinalSortPipeline(Predicate predicate, SortSpec sort, int limit, int offset) {
        List<AggregationOperation> stages = new ArrayList<>();
        translator.toCriteria(predicate).ifPresent(criteria -> stages.add(Aggregation.match(criteria)));

        Document ordinals = new Document();
        Document sortDocument = new Document();
        List<String> helperFields = new ArrayList<>();
        for (SortKey key : sort.keys()) {
            int direction = key.direction() == SortDirection.DESC ? -1 : 1;
            String field = CriteriaTranslator.mongoField(key.field());
            if (key.isCategorical()) {
                String helper = ORDINAL_PREFIX + key.field();
                ordinals.append(helper, ordinalSwitch(field, key.ordinal()));
                sortDocument.append(helper, direction);
                helperFields.add(helper);
            } else {
                sortDocument.append(field, direction);
            }
        }

        stages.add(context -> new Document("$addFields", ordinals));
        stages.add(context -> new Document("$sort", sortDocument));
        stages.add(Aggregation.skip((long) offset));
        stages.add(Aggregation.limit(limit));
        stages.add(context -> new Document("$unset", helperFields));
        return stages;
    }

    static Document ordinalSwitch(String field, CategoricalOrdinal ordinal) {
        String path = "$" + field;
        List<Document> branches = new ArrayList<>();
        branches.add(new Document("case", new Document("$in", List.of(new Document("$type", path), List.of("null", "missing"))))
                .append("then", ordinal.nullOrdinal()));
        for (String label : ordinal.labels()) {
            branches.add(new Document("case", new Document("$eq", List.of(path, label)))
                    .append("then", ordinal.ordinalOf(label)));
        }
        return new Document("$switch", new Document("branches", branches)
                .append("default", ordinal.unmatchedOrdinal()));
    }

    private static Sort toSort(SortSpec sort) {
        List<Sort.Order> orders = new ArrayList<>();
        for (SortKey key : sort.keys()) {
            String field = CriteriaTranslator.mongoField(key.field());
            orders.add(key.direction() == SortDirection.DESC ? Sort.Order.desc(field) : Sort.Order.asc(field));
        }
        return Sort.by(orders);
    }
}
