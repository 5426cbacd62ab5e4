/*
 * Copyright The tracestore Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.storage.postgres;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;
import tracestore.Trace;
import tracestore.TraceId;
import tracestore.storage.PartialResultException;
import tracestore.storage.TraceQuery;
import zipkin2.Call;
import zipkin2.Callback;

/**
 * Looks up trace IDs matching a query, then loads each trace on its own connection.
 *
 * <p>When {@link #maxConcurrency} is more than one, up to that many traces load at the same time
 * on the executor. Only the thread running this call writes results. The first failure cancels
 * pending loads and fails the call with a {@link PartialResultException} holding the traces
 * loaded so far.
 *
 * <p>{@link #enqueue(Callback)} also runs on the executor, so it needs more threads than {@link
 * #maxConcurrency} to make progress.
 */
final class FindTraces extends Call.Base<List<Trace>> {
  static final Logger LOG = Logger.getLogger(FindTraces.class.getName());

  final DataSourceCall.Factory dataSourceCallFactory;
  final Schema schema;
  final TraceQuery query;
  final int maxConcurrency;
  final AtomicReference<Call<Set<TraceId>>> traceIdsCall = new AtomicReference<>();
  final Collection<Future<Trace>> pending = new ArrayList<>();

  FindTraces(DataSourceCall.Factory dataSourceCallFactory, Schema schema, TraceQuery query,
    int maxConcurrency) {
    this.dataSourceCallFactory = dataSourceCallFactory;
    this.schema = schema;
    this.query = query;
    this.maxConcurrency = maxConcurrency;
  }

  @Override protected List<Trace> doExecute() throws IOException {
    Call<Set<TraceId>> idsCall = dataSourceCallFactory.create(new SelectTraceIds(schema, query));
    traceIdsCall.set(idsCall);
    if (isCanceled()) throw new IOException("Canceled");
    Set<TraceId> traceIds = idsCall.execute();

    LOG.log(Level.FINE, "loading {0} traces for {1}", new Object[] {traceIds.size(), query});
    Map<TraceId, Trace> traces = maxConcurrency > 1 && traceIds.size() > 1
      ? loadConcurrently(traceIds)
      : loadSequentially(traceIds);
    return new ArrayList<>(traces.values());
  }

  Map<TraceId, Trace> loadSequentially(Set<TraceId> traceIds) throws IOException {
    Map<TraceId, Trace> result = new LinkedHashMap<>();
    for (TraceId traceId : traceIds) {
      if (isCanceled()) throw canceled(result);
      Trace trace;
      try {
        trace = selectTrace(traceId).execute();
      } catch (IOException | RuntimeException e) {
        throw partialResult(traceId, result, e);
      }
      if (!trace.isEmpty()) result.put(traceId, trace);
    }
    if (isCanceled()) throw canceled(result);
    return result;
  }

  Map<TraceId, Trace> loadConcurrently(Set<TraceId> traceIds) throws IOException {
    CompletionService<Trace> completion =
      new ExecutorCompletionService<>(dataSourceCallFactory.executor);
    Map<Future<Trace>, TraceId> inFlight = new LinkedHashMap<>();
    Map<TraceId, Trace> loaded = new LinkedHashMap<>();
    Iterator<TraceId> remaining = traceIds.iterator();
    try {
      while (remaining.hasNext() || !inFlight.isEmpty()) {
        while (remaining.hasNext() && inFlight.size() < maxConcurrency) {
          if (isCanceled()) throw canceled(inOrder(traceIds, loaded));
          TraceId traceId = remaining.next();
          Call<Trace> call = selectTrace(traceId);
          Future<Trace> future = completion.submit(call::execute);
          inFlight.put(future, traceId);
          synchronized (pending) {
            pending.add(future);
          }
        }

        Future<Trace> done;
        try {
          done = completion.take();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw canceled(inOrder(traceIds, loaded));
        }
        TraceId traceId = inFlight.remove(done);
        if (isCanceled()) throw canceled(inOrder(traceIds, loaded));
        try {
          Trace trace = done.get();
          if (!trace.isEmpty()) loaded.put(traceId, trace);
        } catch (ExecutionException e) {
          throw partialResult(traceId, inOrder(traceIds, loaded), e.getCause());
        } catch (CancellationException | InterruptedException e) {
          throw canceled(inOrder(traceIds, loaded));
        }
      }
    } finally {
      for (Future<Trace> future : inFlight.keySet()) future.cancel(false);
    }
    if (isCanceled()) throw canceled(loaded);
    return inOrder(traceIds, loaded);
  }

  Call<Trace> selectTrace(TraceId traceId) {
    return dataSourceCallFactory.create(new SelectTrace(schema, traceId));
  }

  /** Results arrive in completion order, but are returned in trace ID order. */
  static Map<TraceId, Trace> inOrder(Set<TraceId> traceIds, Map<TraceId, Trace> loaded) {
    Map<TraceId, Trace> result = new LinkedHashMap<>();
    for (TraceId traceId : traceIds) {
      Trace trace = loaded.get(traceId);
      if (trace != null) result.put(traceId, trace);
    }
    return result;
  }

  PartialResultException partialResult(TraceId traceId, Map<TraceId, Trace> loaded,
    Throwable cause) {
    return new PartialResultException("failed loading trace " + traceId + " for " + query
      + " after loading " + loaded.size() + " traces", new ArrayList<>(loaded.values()), cause);
  }

  IOException canceled(Map<TraceId, Trace> loaded) {
    LOG.log(Level.FINE, "canceled {0} after loading {1} traces",
      new Object[] {query, loaded.size()});
    return new IOException("Canceled");
  }

  @Override protected void doEnqueue(Callback<List<Trace>> callback) {
    dataSourceCallFactory.executor.execute(() -> {
      try {
        callback.onSuccess(doExecute());
      } catch (Throwable t) {
        propagateIfFatal(t);
        callback.onError(t);
      }
    });
  }

  @Override protected void doCancel() {
    Call<Set<TraceId>> idsCall = traceIdsCall.get();
    if (idsCall != null) idsCall.cancel();
    synchronized (pending) {
      for (Future<Trace> future : pending) future.cancel(false);
    }
  }

  @Override public String toString() {
    return "FindTraces{query=" + query + ", maxConcurrency=" + maxConcurrency + "}";
  }

  @Override public Call<List<Trace>> clone() {
    return new FindTraces(dataSourceCallFactory, schema, query, maxConcurrency);
  }
}
