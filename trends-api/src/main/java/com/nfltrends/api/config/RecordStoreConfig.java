package com.nfltrends.api.config;

import com.nfltrends.api.model.GameDocument;
import com.nfltrends.api.model.TrendDocument;
import com.nfltrends.api.model.WeeklyTrendDocument;
import com.nfltrends.api.repository.CriteriaTranslator;
import com.nfltrends.api.repository.MongoRecordStore;
import com.nfltrends.query.execute.RecordStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

@Configuration
public class RecordStoreConfig {

    @Bean
    public RecordStore<GameDocument> gameStore(MongoTemplate mongoTemplate, CriteriaTranslator translator) {
        return new MongoRecordStore<>(mongoTemplate, translator, GameDocument.class, "games");
    }

    @Bean
    public RecordStore<TrendDocument> trendStore(MongoTemplate mongoTemplate, CriteriaTranslator translator) {
        return new MongoRecordStore<>(mongoTemplate, translator, TrendDocument.class, "trends");
    }

    @Bean
    public RecordStore<WeeklyTrendDocument> weeklyTrendStore(MongoTemplate mongoTemplate, CriteriaTranslator translator) {
        return new MongoRecordStore<>(mongoTemplate, translator, WeeklyTrendDocument.class, "weekly_trends");
    }
}
