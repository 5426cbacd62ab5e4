/*
 * Copyright The tracestore Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.storage.postgres;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.sql.SQLException;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import javax.sql.DataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import tracestore.Trace;
import tracestore.TraceId;
import tracestore.storage.PartialResultException;
import tracestore.storage.SpanReader;
import tracestore.storage.TraceQuery;
import zipkin2.Call;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.spy;
import static tracestore.storage.postgres.TestObjects.BACKEND_ID;
import static tracestore.storage.postgres.TestObjects.FRONTEND_ID;
import static tracestore.storage.postgres.TestObjects.GET_ROOT_ID;
import static tracestore.storage.postgres.TestObjects.QUERY_ID;
import static tracestore.storage.postgres.TestObjects.TODAY_MICROS;
import static tracestore.storage.postgres.TestObjects.writeCatalog;

class FindTracesTest {
  @RegisterExtension static H2Extension h2 = new H2Extension("find_traces");

  ExecutorService executor = Executors.newFixedThreadPool(4);
  TraceQuery query = TraceQuery.newBuilder().build();

  static TraceId traceId(long i) {
    return TraceId.create(0L, i);
  }

  @BeforeEach void writeTraces() {
    h2.clear();
    writeCatalog(h2.rows());
    // trace 5 is the most recent, so it is loaded first
    for (long i = 1; i <= 5; i++) {
      h2.rows()
        .span(i * 10, traceId(i), GET_ROOT_ID, FRONTEND_ID, "p1", "{\"trace\":" + i + "}",
          TODAY_MICROS + i * 1000, 100L)
        .span(i * 10 + 1, traceId(i), QUERY_ID, BACKEND_ID, "p2", null,
          TODAY_MICROS + i * 1000 + 1, 50L)
        .ref(i, i * 10, i * 10 + 1);
    }
  }

  @AfterEach void shutdownExecutor() {
    executor.shutdownNow();
  }

  @Test void sequential() throws IOException {
    SpanReader reader = h2.computeStorageBuilder().build().spanReader();

    List<Trace> traces = reader.findTraces(query).execute();

    assertThat(traces).extracting(Trace::traceId)
      .containsExactly(traceId(5), traceId(4), traceId(3), traceId(2), traceId(1));
    for (Trace trace : traces) {
      assertThat(trace.spans()).hasSize(2);
      assertThat(trace.spans().get(0).startTime()).isLessThan(trace.spans().get(1).startTime());
      assertThat(trace.processMap()).hasSize(2);
    }
  }

  /** Loading traces at the same time doesn't change the result or its order. */
  @Test void concurrent_sameAsSequential() throws IOException {
    SpanReader sequential = h2.computeStorageBuilder().build().spanReader();
    SpanReader concurrent = h2.computeStorageBuilder()
      .executor(executor)
      .maxConcurrentTraceFetches(3)
      .build().spanReader();

    assertThat(concurrent.findTraces(query).execute())
      .isEqualTo(sequential.findTraces(query).execute());
  }

  @Test void criteriaDriven_spansInStartTimeOrder() throws IOException {
    SpanReader reader = h2.computeStorageBuilder().build().spanReader();

    List<Trace> traces =
      reader.findTraces(query.toBuilder().serviceName("backend").limit(2).build()).execute();

    assertThat(traces).hasSize(2);
    for (Trace trace : traces) {
      assertThat(trace.spans()).isSortedAccordingTo(
        (a, b) -> Long.compare(a.startTime(), b.startTime()));
    }
  }

  @Test void noMatches() throws IOException {
    SpanReader reader = h2.computeStorageBuilder().build().spanReader();

    assertThat(reader.findTraces(query.toBuilder().serviceName("db").build()).execute())
      .isEmpty();
  }

  @Test void sequential_failureReportsPartialResult() {
    // the third most recent trace can't be read
    h2.rows().span(1000L, traceId(3), GET_ROOT_ID, FRONTEND_ID, "p9", "not json",
      TODAY_MICROS, 1L);
    SpanReader reader = h2.computeStorageBuilder().build().spanReader();

    PartialResultException e = catchThrowableOfType(
      () -> reader.findTraces(query).execute(), PartialResultException.class);

    assertThat(e).hasMessageContaining("failed loading trace " + traceId(3));
    assertThat(e.getCause()).isInstanceOf(UncheckedIOException.class);
    assertThat(e.partialResult())
      .extracting(t -> ((Trace) t).traceId())
      .containsExactly(traceId(5), traceId(4));
  }

  @Test void concurrent_failureReportsPartialResult() {
    h2.rows().span(1000L, traceId(3), GET_ROOT_ID, FRONTEND_ID, "p9", "not json",
      TODAY_MICROS, 1L);
    SpanReader reader = h2.computeStorageBuilder()
      .executor(executor)
      .maxConcurrentTraceFetches(2)
      .build().spanReader();

    PartialResultException e = catchThrowableOfType(
      () -> reader.findTraces(query).execute(), PartialResultException.class);

    assertThat(e).hasMessageContaining("failed loading trace " + traceId(3));
    assertThat(e.getCause()).isInstanceOf(UncheckedIOException.class);
    // the traces loaded before the failure depend on completion order
    assertThat(e.partialResult()).allSatisfy(t -> assertThat(t).isInstanceOf(Trace.class));
    assertThat(e.partialResult()).hasSizeLessThanOrEqualTo(4);
  }

  @Test void connectionFailureReportsPartialResult() throws SQLException {
    DataSource datasource = spy(h2.datasource);
    AtomicInteger connections = new AtomicInteger();
    SpanReader reader = h2.computeStorageBuilder().datasource(datasource).build().spanReader();
    // first connection finds trace IDs, then one connection per trace
    doAnswer(invocation -> {
      if (connections.incrementAndGet() == 3) throw new SQLException("pool exhausted");
      return invocation.callRealMethod();
    }).when(datasource).getConnection();

    PartialResultException e = catchThrowableOfType(
      () -> reader.findTraces(query).execute(), PartialResultException.class);

    assertThat(e.getCause())
      .isInstanceOf(IOException.class)
      .hasCauseInstanceOf(SQLException.class);
    assertThat(e.partialResult()).hasSize(1);
  }

  @Test void cancel_stopsFurtherFetches() throws SQLException {
    DataSource datasource = spy(h2.datasource);
    AtomicInteger connections = new AtomicInteger();
    AtomicReference<Call<List<Trace>>> call = new AtomicReference<>();
    SpanReader reader = h2.computeStorageBuilder().datasource(datasource).build().spanReader();
    doAnswer(invocation -> {
      if (connections.incrementAndGet() == 3) call.get().cancel();
      return invocation.callRealMethod();
    }).when(datasource).getConnection();

    call.set(reader.findTraces(query));

    assertThatThrownBy(() -> call.get().execute())
      .isInstanceOf(IOException.class)
      .hasMessage("Canceled");
    // the fetch in flight completed, but no other started
    assertThat(connections).hasValue(3);
  }

  @Test void clone_executesAgain() throws IOException {
    Call<List<Trace>> call = h2.computeStorageBuilder().build().spanReader().findTraces(query);

    assertThat(call.execute()).hasSize(5);
    assertThat(call.clone().execute()).hasSize(5);
  }

  @Test void toString_includesQuery() {
    Call<List<Trace>> call = h2.computeStorageBuilder().build().spanReader().findTraces(query);

    assertThat(call).hasToString("FindTraces{query=TraceQuery{limit=10}, maxConcurrency=1}");
  }
}
