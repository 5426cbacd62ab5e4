/*
 * Copyright The tracestore Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.storage.postgres;

import org.jooq.Comparator;
import org.jooq.DSLContext;
import org.jooq.SQLDialect;
import org.jooq.conf.ParamType;
import org.jooq.conf.Settings;
import org.junit.jupiter.api.Test;
import tracestore.storage.TraceQuery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static tracestore.storage.postgres.Schema.SPAN;

class FilterBuilderTest {
  DSLContext context = new DSLContexts(SQLDialect.POSTGRES,
    new Settings().withRenderSchema(false).withParamType(ParamType.INDEXED), null).renderOnly();

  @Test void emptyQuery_matchesAllSpans() {
    SpanFilter filter = FilterBuilder.build(TraceQuery.newBuilder().build());

    assertThat(filter.predicates()).isEmpty();
    assertThat(filter.bindValues(context)).isEmpty();
    assertThat(filter.sql(context)).doesNotContain("?");
  }

  @Test void predicateOrder() {
    SpanFilter filter = FilterBuilder.build(TraceQuery.newBuilder()
      .durationMax(400L)
      .durationMin(300L)
      .startTimeMax(200L)
      .startTimeMin(100L)
      .operationName("GET /")
      .serviceName("frontend")
      .build());

    assertThat(filter.predicates()).extracting(Object::toString).containsExactly(
      "service_name = frontend",
      "operation_name = GET /",
      "start_time >= 100",
      "start_time <= 200",
      "duration >= 300",
      "duration <= 400"
    );
    assertThat(filter.bindValues(context))
      .containsExactly("frontend", "GET /", 100L, 200L, 300L, 400L);
  }

  @Test void valuesAreBound() {
    SpanFilter filter = FilterBuilder.build(TraceQuery.newBuilder()
      .serviceName("x' or '1'='1")
      .build());

    assertThat(filter.sql(context))
      .contains("\"service\".\"service_name\" = ?")
      .doesNotContain("1'='1");
    assertThat(filter.bindValues(context)).containsExactly("x' or '1'='1");
  }

  @Test void durationBoundsAreNotInverted() {
    SpanFilter filter = FilterBuilder.build(TraceQuery.newBuilder()
      .durationMin(10L)
      .durationMax(20L)
      .build());

    assertThat(filter.sql(context))
      .containsSubsequence("\"span\".\"duration\" >= ?", "\"span\".\"duration\" <= ?");
    assertThat(filter.bindValues(context)).containsExactly(10L, 20L);
  }

  @Test void onlyPresentCriteria() {
    SpanFilter filter = FilterBuilder.build(TraceQuery.newBuilder()
      .operationName("GET /")
      .startTimeMax(200L)
      .build());

    assertThat(filter.predicates()).hasSize(2);
    assertThat(filter.bindValues(context)).containsExactly("GET /", 200L);
  }

  @Test void tagsAreNotSpanPredicates() {
    SpanFilter filter = FilterBuilder.build(TraceQuery.newBuilder().putTag("error", "").build());

    assertThat(filter.predicates()).isEmpty();
  }

  @Test void and_rejectsNullValue() {
    assertThatThrownBy(() -> new FilterBuilder().and(SPAN.duration, Comparator.EQUALS, null))
      .isInstanceOf(NullPointerException.class)
      .hasMessage("value of duration == null");
  }
}
