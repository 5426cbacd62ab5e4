/*
 * Copyright The tracestore Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.storage.postgres;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.jooq.Cursor;
import org.jooq.DSLContext;
import org.jooq.Record1;
import org.jooq.ResultQuery;
import tracestore.storage.PartialResultException;

/**
 * Reads a sorted column of names lazily. If reading fails part way, the names read so far are
 * reported in a {@link PartialResultException}.
 */
abstract class SelectNames implements Function<DSLContext, List<String>> {

  abstract ResultQuery<Record1<String>> query(DSLContext context);

  @Override public List<String> apply(DSLContext context) {
    List<String> result = new ArrayList<>();
    try (Cursor<Record1<String>> cursor = query(context).fetchLazy()) {
      for (Record1<String> record : cursor) {
        String name = record.value1();
        if (name != null && !name.isEmpty()) result.add(name);
      }
    } catch (RuntimeException e) {
      if (result.isEmpty()) throw e;
      throw new PartialResultException(
        this + " failed after reading " + result.size() + " names", result, e);
    }
    return result;
  }
}
