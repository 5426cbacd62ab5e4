/*
 * Copyright The tracestore Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.storage;

import java.util.List;
import java.util.Set;
import tracestore.DependencyLink;
import tracestore.Span;
import tracestore.Trace;
import tracestore.TraceId;
import zipkin2.Call;
import zipkin2.internal.Nullable;

/**
 * Queries spans already committed by the write path. Nothing here mutates storage.
 *
 * <p>Note: This is not considered a user-level Api, rather an Spi that can be used to bind
 * user-level abstractions such as futures or observables. Input errors propagate when the call is
 * created, storage errors when it is executed.
 */
public interface SpanReader {

  /** Retrieves all service names, sorted lexicographically. Empty names are never returned. */
  Call<List<String>> getServiceNames();

  /**
   * Retrieves all operation names, sorted lexicographically. Empty names are never returned.
   *
   * @param serviceName when present, only operations recorded by this service
   */
  Call<List<String>> getOperationNames(@Nullable String serviceName);

  /**
   * Retrieves all spans of a trace, ordered by {@link Span#startTime()}. When the trace isn't in
   * storage, the result is {@linkplain Trace#isEmpty() empty}.
   */
  Call<Trace> getTrace(TraceId traceId);

  /**
   * Like {@link #getTrace(TraceId)}, except parses the ID from 16 or 32 lower-hex characters.
   *
   * @see TraceId#fromHex(String)
   */
  default Call<Trace> getTrace(String hexTraceId) {
    return getTrace(TraceId.fromHex(hexTraceId));
  }

  /**
   * Retrieves at most {@link TraceQuery#limit()} distinct IDs of traces that have a span matching
   * the query, most recent first.
   */
  Call<Set<TraceId>> findTraceIds(TraceQuery query);

  /**
   * Retrieves the traces whose IDs {@link #findTraceIds(TraceQuery)} returns, each with spans
   * ordered by {@link Span#startTime()}.
   *
   * <p>If a trace fails to load, the call fails with a {@link PartialResultException} holding the
   * traces loaded before it.
   */
  Call<List<Trace>> findTraces(TraceQuery query);

  /**
   * Returns dependency links derived from span references whose parent span started in the
   * interval (endTs - lookback) to endTs, or empty if there are none.
   *
   * @param endTs only return links from spans that started on or before this epoch millisecond.
   * @param lookback only return links from spans that started on or after endTs - lookback
   * milliseconds.
   */
  Call<List<DependencyLink>> getDependencies(long endTs, long lookback);
}
