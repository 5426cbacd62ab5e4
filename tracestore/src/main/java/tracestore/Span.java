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
 * A single timed unit of work within a trace, owned by one service and operation.
 *
 * <p>Timestamps and durations are in microseconds, like the rows they are read from.
 */
//@Immutable
public final class Span implements Serializable {
  private static final long serialVersionUID = 0L;

  public static Builder newBuilder() {
    return new Builder();
  }

  /** Storage identity of this span, unique across traces. */
  public long id() {
    return id;
  }

  /** The trace this span belongs to. */
  public TraceId traceId() {
    return traceId;
  }

  /** Name of the operation this span recorded, possibly empty. */
  public String operationName() {
    return operationName;
  }

  /** Name of the service that recorded this span, possibly empty. */
  public String serviceName() {
    return serviceName;
  }

  /**
   * Key into {@link Trace#processMap()}. Spans reported by the same process share this value.
   */
  public String processId() {
    return processId;
  }

  /** Epoch microseconds of the start of this span. */
  public long startTime() {
    return startTime;
  }

  /** Microseconds elapsed for this span. */
  public long duration() {
    return duration;
  }

  /** Outbound references, in storage order. */
  public List<SpanRef> references() {
    return references;
  }

  /** Span tags, empty when the store doesn't record them. */
  public Map<String, String> tags() {
    return tags;
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  public static final class Builder {
    long id;
    TraceId traceId;
    String operationName = "", serviceName = "", processId = "";
    long startTime, duration;
    ArrayList<SpanRef> references;
    LinkedHashMap<String, String> tags;

    Builder() {
    }

    Builder(Span source) {
      id = source.id;
      traceId = source.traceId;
      operationName = source.operationName;
      serviceName = source.serviceName;
      processId = source.processId;
      startTime = source.startTime;
      duration = source.duration;
      if (!source.references.isEmpty()) references = new ArrayList<>(source.references);
      if (!source.tags.isEmpty()) tags = new LinkedHashMap<>(source.tags);
    }

    public Builder id(long id) {
      this.id = id;
      return this;
    }

    public Builder traceId(TraceId traceId) {
      if (traceId == null) throw new NullPointerException("traceId == null");
      this.traceId = traceId;
      return this;
    }

    /** Null coerces to empty */
    public Builder operationName(String operationName) {
      this.operationName = operationName != null ? operationName : "";
      return this;
    }

    /** Null coerces to empty */
    public Builder serviceName(String serviceName) {
      this.serviceName = serviceName != null ? serviceName : "";
      return this;
    }

    /** Null coerces to empty */
    public Builder processId(String processId) {
      this.processId = processId != null ? processId : "";
      return this;
    }

    public Builder startTime(long startTime) {
      this.startTime = startTime;
      return this;
    }

    public Builder duration(long duration) {
      this.duration = duration;
      return this;
    }

    public Builder addReference(SpanRef reference) {
      if (reference == null) throw new NullPointerException("reference == null");
      if (references == null) references = new ArrayList<>();
      references.add(reference);
      return this;
    }

    public Builder putTag(String key, String value) {
      if (key == null) throw new NullPointerException("key == null");
      if (value == null) throw new NullPointerException("value of " + key + " == null");
      if (tags == null) tags = new LinkedHashMap<>();
      tags.put(key, value);
      return this;
    }

    public Span build() {
      if (traceId == null) throw new IllegalStateException("Missing: traceId");
      return new Span(this);
    }
  }

  final long id;
  final TraceId traceId;
  final String operationName, serviceName, processId;
  final long startTime, duration;
  final List<SpanRef> references;
  final Map<String, String> tags;

  Span(Builder builder) {
    id = builder.id;
    traceId = builder.traceId;
    operationName = builder.operationName;
    serviceName = builder.serviceName;
    processId = builder.processId;
    startTime = builder.startTime;
    duration = builder.duration;
    references = builder.references == null
      ? Collections.emptyList()
      : Collections.unmodifiableList(new ArrayList<>(builder.references));
    tags = builder.tags == null
      ? Collections.emptyMap()
      : Collections.unmodifiableMap(new LinkedHashMap<>(builder.tags));
  }

  @Override public String toString() {
    return "Span{"
      + "id=" + id
      + ", traceId=" + traceId
      + ", operationName=" + operationName
      + ", serviceName=" + serviceName
      + ", processId=" + processId
      + ", startTime=" + startTime
      + ", duration=" + duration
      + ", references=" + references
      + ", tags=" + tags
      + "}";
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Span)) return false;
    Span that = (Span) o;
    return id == that.id
      && traceId.equals(that.traceId)
      && operationName.equals(that.operationName)
      && serviceName.equals(that.serviceName)
      && processId.equals(that.processId)
      && startTime == that.startTime
      && duration == that.duration
      && references.equals(that.references)
      && tags.equals(that.tags);
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= (int) ((id >>> 32) ^ id);
    h *= 1000003;
    h ^= traceId.hashCode();
    h *= 1000003;
    h ^= operationName.hashCode();
    h *= 1000003;
    h ^= serviceName.hashCode();
    h *= 1000003;
    h ^= processId.hashCode();
    h *= 1000003;
    h ^= (int) ((startTime >>> 32) ^ startTime);
    h *= 1000003;
    h ^= (int) ((duration >>> 32) ^ duration);
    h *= 1000003;
    h ^= references.hashCode();
    h *= 1000003;
    h ^= tags.hashCode();
    return h;
  }
}
