/*
 * Copyright The tracestore Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.storage.postgres;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.jooq.Cursor;
import org.jooq.DSLContext;
import org.jooq.Record4;
import tracestore.DependencyLink;

import static tracestore.storage.postgres.Schema.SPAN_REF;

/**
 * Counts span references between services. Each side of an edge is resolved on its own: the
 * parent span to the parent service, and the child span to the child service.
 */
final class AggregateDependencies implements Function<DSLContext, List<DependencyLink>> {
  static final Schema.Spans PARENT_SPAN = new Schema.Spans("parent_span");
  static final Schema.Spans CHILD_SPAN = new Schema.Spans("child_span");
  static final Schema.Services PARENT_SERVICE = new Schema.Services("parent_service");
  static final Schema.Services CHILD_SERVICE = new Schema.Services("child_service");

  final long startTimeBegin, startTimeEnd;

  /** The window is in epoch microseconds and applies to the start time of the parent span. */
  AggregateDependencies(long startTimeBegin, long startTimeEnd) {
    this.startTimeBegin = startTimeBegin;
    this.startTimeEnd = startTimeEnd;
  }

  @Override public List<DependencyLink> apply(DSLContext context) {
    Map<ServicePair, long[]> callCounts = new LinkedHashMap<>();
    // Lazy fetching the cursor prevents us from buffering every edge in memory.
    try (Cursor<Record4<Long, String, Long, String>> cursor = context
      .select(PARENT_SERVICE.id, PARENT_SERVICE.serviceName,
        CHILD_SERVICE.id, CHILD_SERVICE.serviceName)
      .from(SPAN_REF.table)
      .join(PARENT_SPAN.table).on(PARENT_SPAN.id.eq(SPAN_REF.spanId))
      .join(PARENT_SERVICE.table).on(PARENT_SERVICE.id.eq(PARENT_SPAN.serviceId))
      .join(CHILD_SPAN.table).on(CHILD_SPAN.id.eq(SPAN_REF.childSpanId))
      .join(CHILD_SERVICE.table).on(CHILD_SERVICE.id.eq(CHILD_SPAN.serviceId))
      .where(PARENT_SPAN.startTime.between(startTimeBegin, startTimeEnd))
      .orderBy(SPAN_REF.id.asc())
      .fetchLazy()) {
      for (Record4<Long, String, Long, String> edge : cursor) {
        ServicePair pair = new ServicePair(
          edge.value1(), nullToEmpty(edge.value2()), edge.value3(), nullToEmpty(edge.value4()));
        callCounts.computeIfAbsent(pair, p -> new long[1])[0]++;
      }
    }

    List<DependencyLink> result = new ArrayList<>(callCounts.size());
    for (Map.Entry<ServicePair, long[]> entry : callCounts.entrySet()) {
      ServicePair pair = entry.getKey();
      result.add(DependencyLink.newBuilder()
        .parent(pair.parentId, pair.parent)
        .child(pair.childId, pair.child)
        .callCount(entry.getValue()[0])
        .build());
    }
    return result;
  }

  static String nullToEmpty(String value) {
    return value != null ? value : "";
  }

  static final class ServicePair {
    final long parentId, childId;
    final String parent, child;

    ServicePair(long parentId, String parent, long childId, String child) {
      this.parentId = parentId;
      this.parent = parent;
      this.childId = childId;
      this.child = child;
    }

    @Override public boolean equals(Object o) {
      if (o == this) return true;
      if (!(o instanceof ServicePair)) return false;
      ServicePair that = (ServicePair) o;
      return parentId == that.parentId && parent.equals(that.parent)
        && childId == that.childId && child.equals(that.child);
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
      return h;
    }
  }

  @Override public String toString() {
    return "AggregateDependencies{"
      + "startTimeBegin="
      + startTimeBegin
      + ", startTimeEnd="
      + startTimeEnd
      + '}';
  }
}
