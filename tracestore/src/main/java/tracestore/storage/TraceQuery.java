/*
 * Copyright The tracestore Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.storage;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import tracestore.Span;
import zipkin2.internal.Nullable;

/**
 * Invoking this request retrieves traces with at least one span matching all of the below filters.
 * Absent filters impose no constraint.
 *
 * <p>Time units of {@link #startTimeMin()}, {@link #startTimeMax()}, {@link #durationMin()} and
 * {@link #durationMax()} are microseconds, the grain of {@link Span#startTime()}.
 */
public final class TraceQuery {
  /** Used when {@link Builder#limit(int)} is not positive. */
  public static final int DEFAULT_LIMIT = 10;

  /**
   * When present, only include traces with a span from this service.
   *
   * @see SpanReader#getServiceNames()
   */
  @Nullable public String serviceName() {
    return serviceName;
  }

  /**
   * When present, only include traces with a span of this operation.
   *
   * @see SpanReader#getOperationNames(String)
   */
  @Nullable public String operationName() {
    return operationName;
  }

  /** When present, only include spans that started at or after this epoch microsecond. */
  @Nullable public Long startTimeMin() {
    return startTimeMin;
  }

  /** When present, only include spans that started at or before this epoch microsecond. */
  @Nullable public Long startTimeMax() {
    return startTimeMax;
  }

  /** When present, only include spans whose duration is at least this many microseconds. */
  @Nullable public Long durationMin() {
    return durationMin;
  }

  /** When present, only include spans whose duration is at most this many microseconds. */
  @Nullable public Long durationMax() {
    return durationMax;
  }

  /**
   * When a value is empty, include spans that have a tag with that key. Otherwise, include spans
   * that have this exact tag. Multiple entries are combined with AND.
   */
  public Map<String, String> tags() {
    return tags;
  }

  /** Maximum number of traces to return. Defaults to {@value #DEFAULT_LIMIT}. */
  public int limit() {
    return limit;
  }

  /**
   * Corresponds to query parameter "tags". Ex. "http.method=GET and error"
   *
   * @see Builder#parseTags(String)
   */
  @Nullable public String tagsString() {
    StringBuilder result = new StringBuilder();
    for (Iterator<Map.Entry<String, String>> i = tags.entrySet().iterator(); i.hasNext(); ) {
      Map.Entry<String, String> next = i.next();
      result.append(next.getKey());
      if (!next.getValue().isEmpty()) result.append('=').append(next.getValue());
      if (i.hasNext()) result.append(" and ");
    }
    return result.length() > 0 ? result.toString() : null;
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    String serviceName, operationName;
    Long startTimeMin, startTimeMax, durationMin, durationMax;
    Map<String, String> tags = new LinkedHashMap<>();
    int limit;

    Builder() {
    }

    Builder(TraceQuery source) {
      serviceName = source.serviceName;
      operationName = source.operationName;
      startTimeMin = source.startTimeMin;
      startTimeMax = source.startTimeMax;
      durationMin = source.durationMin;
      durationMax = source.durationMax;
      tags = new LinkedHashMap<>(source.tags);
      limit = source.limit;
    }

    /** @see TraceQuery#serviceName() */
    public Builder serviceName(@Nullable String serviceName) {
      this.serviceName = serviceName;
      return this;
    }

    /** @see TraceQuery#operationName() */
    public Builder operationName(@Nullable String operationName) {
      this.operationName = operationName;
      return this;
    }

    /** @see TraceQuery#startTimeMin() */
    public Builder startTimeMin(@Nullable Long startTimeMin) {
      this.startTimeMin = startTimeMin;
      return this;
    }

    /** @see TraceQuery#startTimeMax() */
    public Builder startTimeMax(@Nullable Long startTimeMax) {
      this.startTimeMax = startTimeMax;
      return this;
    }

    /** @see TraceQuery#durationMin() */
    public Builder durationMin(@Nullable Long durationMin) {
      this.durationMin = durationMin;
      return this;
    }

    /** @see TraceQuery#durationMax() */
    public Builder durationMax(@Nullable Long durationMax) {
      this.durationMax = durationMax;
      return this;
    }

    /** @see TraceQuery#tags() */
    public Builder tags(Map<String, String> tags) {
      if (tags == null) throw new NullPointerException("tags == null");
      for (Map.Entry<String, String> entry : tags.entrySet()) {
        if (entry.getKey() == null) throw new NullPointerException("key == null");
        if (entry.getValue() == null) {
          throw new NullPointerException("value of " + entry.getKey() + " == null");
        }
      }
      this.tags = new LinkedHashMap<>(tags);
      return this;
    }

    public Builder putTag(String key, String value) {
      if (key == null) throw new NullPointerException("key == null");
      if (value == null) throw new NullPointerException("value of " + key + " == null");
      tags.put(key, value);
      return this;
    }

    /**
     * Corresponds to query parameter "tags". Ex. "http.method=GET and error"
     *
     * @see TraceQuery#tagsString()
     */
    public Builder parseTags(@Nullable String tags) {
      if (tags == null || tags.isEmpty()) return this;
      Map<String, String> map = new LinkedHashMap<>();
      for (String tag : tags.split(" and ", 100)) {
        int idx = tag.indexOf('=');
        if (idx == -1) {
          map.put(tag, "");
        } else {
          map.put(tag.substring(0, idx), tag.substring(idx + 1));
        }
      }
      return tags(map);
    }

    /** Values less than one are replaced with {@link #DEFAULT_LIMIT}. */
    public Builder limit(int limit) {
      this.limit = limit;
      return this;
    }

    public TraceQuery build() {
      // remove any accidental empty strings or zero bounds: they mean "absent"
      tags.remove("");
      if ("".equals(serviceName)) serviceName = null;
      if ("".equals(operationName)) operationName = null;
      if (startTimeMin != null && startTimeMin <= 0) startTimeMin = null;
      if (startTimeMax != null && startTimeMax <= 0) startTimeMax = null;
      if (durationMin != null && durationMin <= 0) durationMin = null;
      if (durationMax != null && durationMax <= 0) durationMax = null;
      if (limit <= 0) limit = DEFAULT_LIMIT;

      if (startTimeMin != null && startTimeMax != null && startTimeMax < startTimeMin) {
        throw new IllegalArgumentException("startTimeMax < startTimeMin");
      }
      if (durationMin != null && durationMax != null && durationMax < durationMin) {
        throw new IllegalArgumentException("durationMax < durationMin");
      }

      return new TraceQuery(this);
    }
  }

  final String serviceName, operationName;
  final Long startTimeMin, startTimeMax, durationMin, durationMax;
  final Map<String, String> tags;
  final int limit;

  TraceQuery(Builder builder) {
    serviceName = builder.serviceName;
    operationName = builder.operationName;
    startTimeMin = builder.startTimeMin;
    startTimeMax = builder.startTimeMax;
    durationMin = builder.durationMin;
    durationMax = builder.durationMax;
    tags = builder.tags.isEmpty()
      ? Collections.emptyMap()
      : Collections.unmodifiableMap(new LinkedHashMap<>(builder.tags));
    limit = builder.limit;
  }

  @Override public String toString() {
    StringBuilder result = new StringBuilder("TraceQuery{");
    if (serviceName != null) result.append("serviceName=").append(serviceName).append(", ");
    if (operationName != null) result.append("operationName=").append(operationName).append(", ");
    if (startTimeMin != null) result.append("startTimeMin=").append(startTimeMin).append(", ");
    if (startTimeMax != null) result.append("startTimeMax=").append(startTimeMax).append(", ");
    if (durationMin != null) result.append("durationMin=").append(durationMin).append(", ");
    if (durationMax != null) result.append("durationMax=").append(durationMax).append(", ");
    if (!tags.isEmpty()) result.append("tags=").append(tagsString()).append(", ");
    return result.append("limit=").append(limit).append("}").toString();
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof TraceQuery)) return false;
    TraceQuery that = (TraceQuery) o;
    return equal(serviceName, that.serviceName)
      && equal(operationName, that.operationName)
      && equal(startTimeMin, that.startTimeMin)
      && equal(startTimeMax, that.startTimeMax)
      && equal(durationMin, that.durationMin)
      && equal(durationMax, that.durationMax)
      && tags.equals(that.tags)
      && limit == that.limit;
  }

  static boolean equal(Object a, Object b) {
    return a == null ? b == null : a.equals(b);
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= (serviceName == null) ? 0 : serviceName.hashCode();
    h *= 1000003;
    h ^= (operationName == null) ? 0 : operationName.hashCode();
    h *= 1000003;
    h ^= (startTimeMin == null) ? 0 : startTimeMin.hashCode();
    h *= 1000003;
    h ^= (startTimeMax == null) ? 0 : startTimeMax.hashCode();
    h *= 1000003;
    h ^= (durationMin == null) ? 0 : durationMin.hashCode();
    h *= 1000003;
    h ^= (durationMax == null) ? 0 : durationMax.hashCode();
    h *= 1000003;
    h ^= tags.hashCode();
    h *= 1000003;
    h ^= limit;
    return h;
  }
}
