/*
 * Copyright The tracestore Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.storage.postgres;

import java.sql.SQLException;
import java.util.Iterator;
import java.util.List;
import org.jooq.Cursor;
import org.jooq.DSLContext;
import org.jooq.Record1;
import org.jooq.ResultQuery;
import org.jooq.SQLDialect;
import org.jooq.exception.DataAccessException;
import org.jooq.impl.DSL;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import tracestore.storage.PartialResultException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static tracestore.storage.postgres.Schema.SERVICE;

class SelectNamesTest {
  DSLContext context = DSL.using(SQLDialect.POSTGRES);
  DataAccessException error =
    new DataAccessException("connection reset", new SQLException("connection reset", "08006"));

  /** Reads the given names, then fails with {@link #error}. */
  SelectNames failingAfter(String... names) {
    return new SelectNames() {
      @Override @SuppressWarnings("unchecked")
      ResultQuery<Record1<String>> query(DSLContext context) {
        Iterator<String> remaining = List.of(names).iterator();
        Cursor<Record1<String>> cursor = mock(Cursor.class);
        when(cursor.iterator()).thenReturn(new Iterator<Record1<String>>() {
          @Override public boolean hasNext() {
            return true;
          }

          @Override public Record1<String> next() {
            if (!remaining.hasNext()) throw error;
            return context.newRecord(SERVICE.serviceName).values(remaining.next());
          }
        });
        ResultQuery<Record1<String>> query = mock(ResultQuery.class);
        when(query.fetchLazy()).thenReturn(cursor);
        return query;
      }

      @Override public String toString() {
        return "SelectServiceNames{}";
      }
    };
  }

  @Test void failureBeforeAnyName_isUnchanged() {
    Throwable thrown = catchThrowable(() -> failingAfter().apply(context));

    assertThat(thrown).isSameAs(error);
  }

  @Test void failureAfterNames_reportsPartialResult() {
    PartialResultException e = catchThrowableOfType(
      () -> failingAfter("backend", "", "db").apply(context), PartialResultException.class);

    assertThat(e)
      .hasMessage("SelectServiceNames{} failed after reading 2 names");
    assertThat(e.getCause()).isSameAs(error);
    Assertions.<Object>assertThat(e.partialResult()).containsExactly("backend", "db");
  }

  /** Only empty names were read, so there is nothing partial to report. */
  @Test void failureAfterOnlyEmptyNames_isUnchanged() {
    Throwable thrown = catchThrowable(() -> failingAfter("").apply(context));

    assertThat(thrown).isSameAs(error);
  }
}
