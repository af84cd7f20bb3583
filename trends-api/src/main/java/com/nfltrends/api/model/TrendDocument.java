package com.nfltrends.api.model;

/**
 * Historical betting trend over every matching game since a given season.
 */
@org.springframework.data.mongodb.core.mapping.Document(collection = "trends")
public class TrendDocument extends BaseTrendDocument {
}
