/*
 * Copyright The tracestore Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.storage.postgres;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import org.jooq.Condition;
import org.jooq.Cursor;
import org.jooq.DSLContext;
import org.jooq.Record2;
import org.jooq.Table;
import tracestore.TraceId;
import tracestore.storage.TraceQuery;

import static tracestore.storage.postgres.Schema.OPERATION;
import static tracestore.storage.postgres.Schema.SERVICE;
import static tracestore.storage.postgres.Schema.SPAN;

/**
 * Finds IDs of traces with at least one span matching the query, most recent span first.
 *
 * <p>The join yields one row per matching span, not per trace, so rows are deduplicated by trace
 * ID here. To avoid starving the result when a few traces own most matching spans, up to {@link
 * #OVER_FETCH} times {@link TraceQuery#limit()} rows are read.
 */
final class SelectTraceIds implements Function<DSLContext, Set<TraceId>> {
  static final int OVER_FETCH = 100;

  final Schema schema;
  final TraceQuery query;
  final SpanFilter filter;

  SelectTraceIds(Schema schema, TraceQuery query) {
    this.schema = schema;
    this.query = query;
    this.filter = FilterBuilder.build(query);
  }

  @Override public Set<TraceId> apply(DSLContext context) {
    int limit = query.limit();
    Set<TraceId> result = new LinkedHashSet<>();
    try (Cursor<Record2<Long, Long>> cursor = context
      .select(SPAN.traceIdHigh, SPAN.traceIdLow)
      .from(table())
      .where(filter.condition())
      .orderBy(SPAN.startTime.desc(), SPAN.id.desc())
      .limit((long) limit * OVER_FETCH)
      .fetchLazy()) {
      for (Record2<Long, Long> record : cursor) {
        long low = record.value2(), high = record.value1() != null ? record.value1() : 0L;
        // when not strict, only the lower bits identify a trace, unless they are all zero
        if (!schema.strictTraceId && low != 0L) high = 0L;
        result.add(TraceId.create(high, low));
        if (result.size() == limit) break;
      }
    }
    return Collections.unmodifiableSet(result);
  }

  /** Joins names so the filter can use them, and one aliased tags table per tag. */
  Table<?> table() {
    Table<?> table = SPAN.table
      .join(OPERATION.table).on(OPERATION.id.eq(SPAN.operationId))
      .join(SERVICE.table).on(SERVICE.id.eq(SPAN.serviceId));

    int i = 0;
    for (Map.Entry<String, String> tag : query.tags().entrySet()) {
      Schema.SpanTags tagTable = new Schema.SpanTags("t" + i++);
      Condition on = tagTable.spanId.eq(SPAN.id).and(tagTable.tagKey.eq(tag.getKey()));
      if (!tag.getValue().isEmpty()) on = on.and(tagTable.tagValue.eq(tag.getValue()));
      table = table.join(tagTable.table).on(on);
    }
    return table;
  }

  @Override public String toString() {
    return "SelectTraceIds{query=" + query + "}";
  }
}
