/*
 * Copyright The tracestore Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.storage.postgres;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import tracestore.DependencyLink;
import tracestore.Trace;
import tracestore.TraceId;
import tracestore.storage.SpanReader;
import tracestore.storage.TraceQuery;
import zipkin2.Call;
import zipkin2.internal.Nullable;

final class PostgresSpanReader implements SpanReader {

  final DataSourceCall.Factory dataSourceCallFactory;
  final Schema schema;
  final boolean searchEnabled;
  final int maxConcurrentTraceFetches;
  final DataSourceCall<List<String>> getServiceNamesCall;

  PostgresSpanReader(PostgresStorage storage, Schema schema) {
    this.dataSourceCallFactory = storage.dataSourceCallFactory;
    this.schema = schema;
    this.searchEnabled = storage.searchEnabled;
    this.maxConcurrentTraceFetches = storage.maxConcurrentTraceFetches;
    this.getServiceNamesCall = dataSourceCallFactory.create(new SelectServiceNames());
  }

  @Override public Call<List<String>> getServiceNames() {
    if (!searchEnabled) return Call.emptyList();
    return getServiceNamesCall.clone();
  }

  @Override public Call<List<String>> getOperationNames(@Nullable String serviceName) {
    if (!searchEnabled) return Call.emptyList();
    if (serviceName != null && serviceName.isEmpty()) serviceName = null;
    return dataSourceCallFactory.create(new SelectOperationNames(serviceName));
  }

  @Override public Call<Trace> getTrace(TraceId traceId) {
    if (traceId == null) throw new NullPointerException("traceId == null");
    return dataSourceCallFactory.create(new SelectTrace(schema, traceId));
  }

  @Override public Call<Set<TraceId>> findTraceIds(TraceQuery query) {
    checkQuery(query);
    if (!searchEnabled) return Call.create(Collections.emptySet());
    return dataSourceCallFactory.create(new SelectTraceIds(schema, query));
  }

  @Override public Call<List<Trace>> findTraces(TraceQuery query) {
    checkQuery(query);
    if (!searchEnabled) return Call.emptyList();
    return new FindTraces(dataSourceCallFactory, schema, query, maxConcurrentTraceFetches);
  }

  void checkQuery(TraceQuery query) {
    if (query == null) throw new NullPointerException("query == null");
    if (!query.tags().isEmpty() && !schema.hasSpanTags) {
      throw new IllegalArgumentException(
        "span_tags doesn't exist, so tags can't be queried: " + query.tagsString());
    }
  }

  @Override public Call<List<DependencyLink>> getDependencies(long endTs, long lookback) {
    if (endTs <= 0) throw new IllegalArgumentException("endTs <= 0");
    if (lookback <= 0) throw new IllegalArgumentException("lookback <= 0");

    // a lookback past the epoch means all time
    long begin = endTs - Math.min(lookback, endTs);
    return dataSourceCallFactory.create(new AggregateDependencies(begin * 1000, endTs * 1000));
  }
}
