/*
 * Copyright The tracestore Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.storage.postgres;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.jooq.DSLContext;
import org.jooq.Record;
import tracestore.Process;
import tracestore.Span;
import tracestore.SpanRef;
import tracestore.Trace;
import tracestore.TraceId;

import static java.util.stream.Collectors.groupingBy;
import static tracestore.storage.postgres.Schema.OPERATION;
import static tracestore.storage.postgres.Schema.SERVICE;
import static tracestore.storage.postgres.Schema.SPAN;
import static tracestore.storage.postgres.Schema.SPAN_REF;
import static tracestore.storage.postgres.Schema.SPAN_TAG;
import static tracestore.storage.postgres.Schema.orDefault;

/**
 * Loads the spans of one trace with their operation and service names, outbound references and
 * tags, ordered by start time. The process map gets one entry per distinct process ID: the first
 * span seen with a process ID decides its service and tags.
 */
final class SelectTrace implements Function<DSLContext, Trace> {
  final Schema schema;
  final TraceId traceId;

  SelectTrace(Schema schema, TraceId traceId) {
    this.schema = schema;
    this.traceId = traceId;
  }

  @Override public Trace apply(DSLContext context) {
    List<? extends Record> spanRecords = context
      .select(SPAN.id, SPAN.traceIdHigh, SPAN.traceIdLow, SPAN.processId, SPAN.processTags,
        SPAN.startTime, SPAN.duration, OPERATION.operationName, SERVICE.serviceName)
      .from(SPAN.table)
      .leftJoin(OPERATION.table).on(OPERATION.id.eq(SPAN.operationId))
      .leftJoin(SERVICE.table).on(SERVICE.id.eq(SPAN.serviceId))
      .where(SPAN.traceIdCondition(traceId, schema.strictTraceId))
      .orderBy(SPAN.startTime.asc(), SPAN.id.asc())
      .fetch();

    Trace.Builder result = Trace.newBuilder(traceId);
    if (spanRecords.isEmpty() || DataSourceCall.isCanceled(context)) return result.build();

    List<Long> spanIds = new ArrayList<>(spanRecords.size());
    for (Record r : spanRecords) spanIds.add(r.get(SPAN.id));

    Map<Long, List<SpanRef>> references = selectReferences(context, spanIds);
    if (DataSourceCall.isCanceled(context)) return result.build(); // discarded by the call
    Map<Long, List<Record>> tags =
      schema.hasSpanTags ? selectTags(context, spanIds) : Collections.emptyMap();

    for (Record r : spanRecords) {
      long spanId = r.get(SPAN.id);
      String processId = orDefault(r, SPAN.processId, "");
      String serviceName = orDefault(r, SERVICE.serviceName, "");

      Span.Builder span = Span.newBuilder()
        .id(spanId)
        .traceId(TraceId.create(orDefault(r, SPAN.traceIdHigh, 0L), r.get(SPAN.traceIdLow)))
        .operationName(r.get(OPERATION.operationName))
        .serviceName(serviceName)
        .processId(processId)
        .startTime(orDefault(r, SPAN.startTime, 0L))
        .duration(orDefault(r, SPAN.duration, 0L));
      for (SpanRef ref : references.getOrDefault(spanId, Collections.emptyList())) {
        span.addReference(ref);
      }
      for (Record tag : tags.getOrDefault(spanId, Collections.emptyList())) {
        span.putTag(tag.get(SPAN_TAG.tagKey), orDefault(tag, SPAN_TAG.tagValue, ""));
      }
      result.addSpan(span.build());

      if (!result.hasProcess(processId)) {
        result.putProcess(processId, Process.create(serviceName, processTags(r, spanId)));
      }
    }
    return result.build();
  }

  static Map<Long, List<SpanRef>> selectReferences(DSLContext context, List<Long> spanIds) {
    return context
      .select(SPAN_REF.id, SPAN_REF.spanId, SPAN_REF.childSpanId)
      .from(SPAN_REF.table)
      .where(SPAN_REF.spanId.in(spanIds))
      .orderBy(SPAN_REF.id.asc())
      .stream()
      .collect(groupingBy(
        r -> r.get(SPAN_REF.spanId),
        LinkedHashMap::new,
        Collectors.mapping(
          r -> SpanRef.create(r.get(SPAN_REF.id), r.get(SPAN_REF.childSpanId)),
          Collectors.toList()))); // LinkedHashMap preserves order while grouping
  }

  static Map<Long, List<Record>> selectTags(DSLContext context, List<Long> spanIds) {
    return context
      .select(SPAN_TAG.spanId, SPAN_TAG.tagKey, SPAN_TAG.tagValue)
      .from(SPAN_TAG.table)
      .where(SPAN_TAG.spanId.in(spanIds))
      .orderBy(SPAN_TAG.spanId.asc(), SPAN_TAG.tagKey.asc())
      .stream()
      .collect(groupingBy(
        r -> r.get(SPAN_TAG.spanId),
        LinkedHashMap::new,
        Collectors.mapping(r -> (Record) r, Collectors.toList())));
  }

  static Map<String, String> processTags(Record r, long spanId) {
    try {
      return ProcessTags.parse(r.get(SPAN.processTags));
    } catch (IOException e) {
      throw new UncheckedIOException("malformed process_tags in span " + spanId, e);
    }
  }

  @Override public String toString() {
    return "SelectTrace{traceId=" + traceId + "}";
  }
}
