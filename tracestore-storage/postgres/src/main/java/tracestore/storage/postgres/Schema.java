/*
 * Copyright The tracestore Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.storage.postgres;

import javax.sql.DataSource;
import org.jooq.Condition;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import tracestore.TraceId;

import static org.jooq.impl.DSL.field;
import static org.jooq.impl.DSL.name;
import static org.jooq.impl.DSL.table;

/**
 * Tables read by this module, and which optional ones exist. Each table type can be aliased, so
 * that a query can join the same table twice.
 */
final class Schema {
  static final Spans SPAN = new Spans("span");
  static final Services SERVICE = new Services("service");
  static final Operations OPERATION = new Operations("operation");
  static final SpanRefs SPAN_REF = new SpanRefs("span_ref");
  static final SpanTags SPAN_TAG = new SpanTags("span_tag");

  static final class Services {
    final Table<Record> table;
    final Field<Long> id;
    final Field<String> serviceName;

    Services(String alias) {
      table = table(name("services")).as(alias);
      id = field(name(alias, "id"), Long.class);
      serviceName = field(name(alias, "service_name"), String.class);
    }
  }

  static final class Operations {
    final Table<Record> table;
    final Field<Long> id;
    final Field<String> operationName;

    Operations(String alias) {
      table = table(name("operations")).as(alias);
      id = field(name(alias, "id"), Long.class);
      operationName = field(name(alias, "operation_name"), String.class);
    }
  }

  static final class Spans {
    final Table<Record> table;
    final Field<Long> id, traceIdLow, traceIdHigh, operationId, serviceId, startTime, duration;
    final Field<String> processId, processTags;

    Spans(String alias) {
      table = table(name("spans")).as(alias);
      id = field(name(alias, "id"), Long.class);
      traceIdLow = field(name(alias, "trace_id_low"), Long.class);
      traceIdHigh = field(name(alias, "trace_id_high"), Long.class);
      operationId = field(name(alias, "operation_id"), Long.class);
      serviceId = field(name(alias, "service_id"), Long.class);
      processId = field(name(alias, "process_id"), String.class);
      processTags = field(name(alias, "process_tags"), String.class);
      startTime = field(name(alias, "start_time"), Long.class);
      duration = field(name(alias, "duration"), Long.class);
    }

    /** When not strict, only the lower 64 bits of the trace ID are compared. */
    Condition traceIdCondition(TraceId traceId, boolean strictTraceId) {
      Condition low = traceIdLow.eq(traceId.low());
      return strictTraceId ? traceIdHigh.eq(traceId.high()).and(low) : low;
    }
  }

  /** {@code span_id} references {@code child_span_id}: the former is the parent of the edge. */
  static final class SpanRefs {
    final Table<Record> table;
    final Field<Long> id, spanId, childSpanId;

    SpanRefs(String alias) {
      table = table(name("span_refs")).as(alias);
      id = field(name(alias, "id"), Long.class);
      spanId = field(name(alias, "span_id"), Long.class);
      childSpanId = field(name(alias, "child_span_id"), Long.class);
    }
  }

  static final class SpanTags {
    final Table<Record> table;
    final Field<Long> spanId;
    final Field<String> tagKey, tagValue;

    SpanTags(String alias) {
      table = table(name("span_tags")).as(alias);
      spanId = field(name(alias, "span_id"), Long.class);
      tagKey = field(name(alias, "tag_key"), String.class);
      tagValue = field(name(alias, "tag_value"), String.class);
    }
  }

  final boolean hasSpanTags;
  final boolean strictTraceId;

  Schema(DataSource datasource, DSLContexts context, boolean strictTraceId) {
    hasSpanTags = HasSpanTags.test(datasource, context);
    this.strictTraceId = strictTraceId;
  }

  /** Returns the default value if the result was null */
  static <T> T orDefault(Record record, Field<T> field, T defaultValue) {
    T result = record.get(field);
    return result != null ? result : defaultValue;
  }
}
