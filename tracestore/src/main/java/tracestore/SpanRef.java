/*
 * Copyright The tracestore Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore;

import java.io.Serializable;

/**
 * A causal edge from the span that owns this reference to the span identified by {@link
 * #childSpanId()}. References are only used to derive service dependencies: trace structure comes
 * from the shared {@link TraceId}.
 */
//@Immutable
public final class SpanRef implements Serializable {
  private static final long serialVersionUID = 0L;

  public static SpanRef create(long id, long childSpanId) {
    return new SpanRef(id, childSpanId);
  }

  /** Storage identity of this reference */
  public long id() {
    return id;
  }

  /** Storage identity of the referenced span */
  public long childSpanId() {
    return childSpanId;
  }

  final long id, childSpanId;

  SpanRef(long id, long childSpanId) {
    this.id = id;
    this.childSpanId = childSpanId;
  }

  @Override public String toString() {
    return "SpanRef{id=" + id + ", childSpanId=" + childSpanId + "}";
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof SpanRef)) return false;
    SpanRef that = (SpanRef) o;
    return id == that.id && childSpanId == that.childSpanId;
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= (int) ((id >>> 32) ^ id);
    h *= 1000003;
    h ^= (int) ((childSpanId >>> 32) ^ childSpanId);
    return h;
  }
}
