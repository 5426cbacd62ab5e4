/*
 * Copyright The tracestore Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.storage;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class TraceQueryTest {
  TraceQuery.Builder queryBuilder = TraceQuery.newBuilder();

  @Test void defaults() {
    TraceQuery query = queryBuilder.build();

    assertThat(query.serviceName()).isNull();
    assertThat(query.operationName()).isNull();
    assertThat(query.startTimeMin()).isNull();
    assertThat(query.startTimeMax()).isNull();
    assertThat(query.durationMin()).isNull();
    assertThat(query.durationMax()).isNull();
    assertThat(query.tags()).isEmpty();
    assertThat(query.limit()).isEqualTo(TraceQuery.DEFAULT_LIMIT);
  }

  @Test void emptyStringsAreAbsent() {
    TraceQuery query = queryBuilder.serviceName("").operationName("").build();

    assertThat(query.serviceName()).isNull();
    assertThat(query.operationName()).isNull();
  }

  @Test void zeroBoundsAreAbsent() {
    TraceQuery query = queryBuilder
      .startTimeMin(0L).startTimeMax(0L).durationMin(0L).durationMax(0L).build();

    assertThat(query.startTimeMin()).isNull();
    assertThat(query.startTimeMax()).isNull();
    assertThat(query.durationMin()).isNull();
    assertThat(query.durationMax()).isNull();
  }

  @Test void limit_notPositiveUsesDefault() {
    assertThat(queryBuilder.limit(0).build().limit()).isEqualTo(10);
    assertThat(queryBuilder.limit(-3).build().limit()).isEqualTo(10);
    assertThat(queryBuilder.limit(3).build().limit()).isEqualTo(3);
  }

  @Test void durationMaxLessThanMin() {
    assertThatThrownBy(() -> queryBuilder.durationMin(100L).durationMax(99L).build())
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessage("durationMax < durationMin");
  }

  @Test void durationMaxEqualToMin() {
    TraceQuery query = queryBuilder.durationMin(100L).durationMax(100L).build();

    assertThat(query.durationMin()).isEqualTo(query.durationMax());
  }

  @Test void startTimeMaxLessThanMin() {
    assertThatThrownBy(() -> queryBuilder.startTimeMin(100L).startTimeMax(99L).build())
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessage("startTimeMax < startTimeMin");
  }

  @Test void parseTags() {
    TraceQuery query = queryBuilder.parseTags("http.method=GET and error").build();

    assertThat(query.tags())
      .containsExactly(entry("http.method", "GET"), entry("error", ""));
    assertThat(query.tagsString()).isEqualTo("http.method=GET and error");
  }

  @Test void parseTags_valueContainsEquals() {
    TraceQuery query = queryBuilder.parseTags("http.url=/foo?bar=baz").build();

    assertThat(query.tags()).containsExactly(entry("http.url", "/foo?bar=baz"));
  }

  @Test void tagsString_nullWhenEmpty() {
    assertThat(queryBuilder.build().tagsString()).isNull();
  }

  @Test void putTag_rejectsNullValue() {
    assertThatThrownBy(() -> queryBuilder.putTag("error", null))
      .isInstanceOf(NullPointerException.class)
      .hasMessage("value of error == null");
  }

  @Test void tags_rejectsNullValue() {
    Map<String, String> tags = new LinkedHashMap<>();
    tags.put("http.method", "GET");
    tags.put("error", null);

    assertThatThrownBy(() -> queryBuilder.tags(tags))
      .isInstanceOf(NullPointerException.class)
      .hasMessage("value of error == null");
  }

  @Test void toBuilder_roundTrips() {
    TraceQuery query = queryBuilder
      .serviceName("frontend")
      .operationName("get /")
      .startTimeMin(1L)
      .startTimeMax(2L)
      .durationMin(3L)
      .durationMax(4L)
      .putTag("error", "")
      .limit(5)
      .build();

    assertThat(query.toBuilder().build())
      .isEqualTo(query)
      .hasSameHashCodeAs(query);
  }

  @Test void toString_onlyIncludesPresentCriteria() {
    assertThat(queryBuilder.serviceName("frontend").durationMin(3L).build())
      .hasToString("TraceQuery{serviceName=frontend, durationMin=3, limit=10}");
  }
}
