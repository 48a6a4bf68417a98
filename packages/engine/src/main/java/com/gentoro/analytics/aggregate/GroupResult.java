package com.gentoro.analytics.aggregate;

/** One group of a {@link AggregationEngine#groupReduce} result. */
public record GroupResult(GroupKey key, double value) {}
