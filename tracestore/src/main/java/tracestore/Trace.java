/*
 * Copyright The tracestore Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All spans sharing one {@link TraceId}, and the processes that reported them.
 *
 * <p>The {@link #processMap() process map} has one entry per distinct {@link Span#processId()},
 * never one per span.
 */
//@Immutable
public final class Trace implements Serializable {
  private static final long serialVersionUID = 0L;

  public static Builder newBuilder(TraceId traceId) {
    if (traceId == null) throw new NullPointerException("traceId == null");
    return new Builder(traceId);
  }

  /** Returns a trace with no spans, used when a trace ID isn't in storage. */
  public static Trace empty(TraceId traceId) {
    return newBuilder(traceId).build();
  }

  public TraceId traceId() {
    return traceId;
  }

  /** Spans in the order they were added, which is usually ascending {@link Span#startTime()}. */
  public List<Span> spans() {
    return spans;
  }

  /** Process ID to process, in the order process IDs were first seen. */
  public Map<String, Process> processMap() {
    return processMap;
  }

  public boolean isEmpty() {
    return spans.isEmpty();
  }

  public static final class Builder {
    final TraceId traceId;
    final ArrayList<Span> spans = new ArrayList<>();
    final LinkedHashMap<String, Process> processMap = new LinkedHashMap<>();

    Builder(TraceId traceId) {
      this.traceId = traceId;
    }

    /** The span must share at least the lower 64 bits of this trace's ID. */
    public Builder addSpan(Span span) {
      if (span == null) throw new NullPointerException("span == null");
      if (traceId.low() != span.traceId().low()) {
        throw new IllegalArgumentException(
          "span " + span.id() + " is in trace " + span.traceId() + ", not " + traceId);
      }
      spans.add(span);
      return this;
    }

    /** Only the first process mapped to a process ID is kept. */
    public Builder putProcess(String processId, Process process) {
      if (processId == null) throw new NullPointerException("processId == null");
      if (process == null) throw new NullPointerException("process == null");
      processMap.putIfAbsent(processId, process);
      return this;
    }

    public boolean hasProcess(String processId) {
      return processMap.containsKey(processId);
    }

    public Trace build() {
      return new Trace(this);
    }
  }

  final TraceId traceId;
  final List<Span> spans;
  final Map<String, Process> processMap;

  Trace(Builder builder) {
    traceId = builder.traceId;
    spans = Collections.unmodifiableList(new ArrayList<>(builder.spans));
    processMap = Collections.unmodifiableMap(new LinkedHashMap<>(builder.processMap));
  }

  @Override public String toString() {
    return "Trace{traceId=" + traceId + ", spans=" + spans + ", processMap=" + processMap + "}";
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Trace)) return false;
    Trace that = (Trace) o;
    return traceId.equals(that.traceId)
      && spans.equals(that.spans)
      && processMap.equals(that.processMap);
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= traceId.hashCode();
    h *= 1000003;
    h ^= spans.hashCode();
    h *= 1000003;
    h ^= processMap.hashCode();
    return h;
  }
}
