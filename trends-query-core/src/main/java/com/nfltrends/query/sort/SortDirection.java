package com.nfltrends.query.sort;

public enum SortDirection {
    ASC,
    DESC
}
