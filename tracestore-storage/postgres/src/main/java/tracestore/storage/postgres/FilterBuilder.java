/*
 * Copyright The tracestore Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.storage.postgres;

import java.util.ArrayList;
import java.util.List;
import org.jooq.Comparator;
import org.jooq.Field;
import tracestore.storage.TraceQuery;

import static tracestore.storage.postgres.Schema.OPERATION;
import static tracestore.storage.postgres.Schema.SERVICE;
import static tracestore.storage.postgres.Schema.SPAN;

/**
 * Accumulates predicates combined with AND. Only criteria that are present add a predicate, so an
 * empty query builds a filter that matches every span.
 *
 * <p>Columns are qualified by the aliases {@link Schema#SPAN}, {@link Schema#SERVICE} and {@link
 * Schema#OPERATION}: the query using the filter must join those tables.
 */
final class FilterBuilder {

  /**
   * Adds predicates in this order: service, operation, start time bounds then duration bounds.
   * Tags aren't span columns, so they are joined by {@link SelectTraceIds}.
   */
  static SpanFilter build(TraceQuery query) {
    FilterBuilder builder = new FilterBuilder();
    if (query.serviceName() != null) {
      builder.and(SERVICE.serviceName, Comparator.EQUALS, query.serviceName());
    }
    if (query.operationName() != null) {
      builder.and(OPERATION.operationName, Comparator.EQUALS, query.operationName());
    }
    if (query.startTimeMin() != null) {
      builder.and(SPAN.startTime, Comparator.GREATER_OR_EQUAL, query.startTimeMin());
    }
    if (query.startTimeMax() != null) {
      builder.and(SPAN.startTime, Comparator.LESS_OR_EQUAL, query.startTimeMax());
    }
    if (query.durationMin() != null) {
      builder.and(SPAN.duration, Comparator.GREATER_OR_EQUAL, query.durationMin());
    }
    if (query.durationMax() != null) {
      builder.and(SPAN.duration, Comparator.LESS_OR_EQUAL, query.durationMax());
    }
    return builder.build();
  }

  final List<SpanFilter.Predicate<?>> predicates = new ArrayList<>();

  <T> FilterBuilder and(Field<T> column, Comparator comparator, T value) {
    if (column == null) throw new NullPointerException("column == null");
    if (comparator == null) throw new NullPointerException("comparator == null");
    if (value == null) throw new NullPointerException("value of " + column.getName() + " == null");
    predicates.add(new SpanFilter.Predicate<>(column, comparator, value));
    return this;
  }

  SpanFilter build() {
    return new SpanFilter(predicates);
  }
}
