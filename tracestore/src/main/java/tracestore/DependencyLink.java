/*
 * Copyright The tracestore Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore;

import java.io.Serializable;

/** Aggregated count of span references from one service to another. Not persisted. */
//@Immutable
public final class DependencyLink implements Serializable {
  private static final long serialVersionUID = 0L;

  public static Builder newBuilder() {
    return new Builder();
  }

  /** storage identity of the parent service (caller) */
  public long parentId() {
    return parentId;
  }

  /** parent service name (caller) */
  public String parent() {
    return parent;
  }

  /** storage identity of the child service (callee) */
  public long childId() {
    return childId;
  }

  /** child service name (callee) */
  public String child() {
    return child;
  }

  /** total references made from {@link #parent} to {@link #child} */
  public long callCount() {
    return callCount;
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  public static final class Builder {
    long parentId, childId, callCount;
    String parent, child;

    Builder() {
    }

    Builder(DependencyLink source) {
      parentId = source.parentId;
      parent = source.parent;
      childId = source.childId;
      child = source.child;
      callCount = source.callCount;
    }

    public Builder parent(long parentId, String parent) {
      if (parent == null) throw new NullPointerException("parent == null");
      this.parentId = parentId;
      this.parent = parent;
      return this;
    }

    public Builder child(long childId, String child) {
      if (child == null) throw new NullPointerException("child == null");
      this.childId = childId;
      this.child = child;
      return this;
    }

    public Builder callCount(long callCount) {
      this.callCount = callCount;
      return this;
    }

    public DependencyLink build() {
      String missing = "";
      if (parent == null) missing += " parent";
      if (child == null) missing += " child";
      if (!"".equals(missing)) throw new IllegalStateException("Missing :" + missing);
      return new DependencyLink(this);
    }
  }

  final long parentId, childId, callCount;
  final String parent, child;

  DependencyLink(Builder builder) {
    parentId = builder.parentId;
    parent = builder.parent;
    childId = builder.childId;
    child = builder.child;
    callCount = builder.callCount;
  }

  @Override public String toString() {
    return "DependencyLink{"
      + "parent=" + parent + "(" + parentId + ")"
      + ", child=" + child + "(" + childId + ")"
      + ", callCount=" + callCount
      + "}";
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof DependencyLink)) return false;
    DependencyLink that = (DependencyLink) o;
    return parentId == that.parentId
      && parent.equals(that.parent)
      && childId == that.childId
      && child.equals(that.child)
      && callCount == that.callCount;
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= (int) ((parentId >>> 32) ^ parentId);
    h *= 1000003;
    h ^= parent.hashCode();
    h *= 1000003;
    h ^= (int) ((childId >>> 32) ^ childId);
    h *= 1000003;
    h ^= child.hashCode();
    h *= 1000003;
    h ^= (int) ((callCount >>> 32) ^ callCount);
    return h;
  }
}
