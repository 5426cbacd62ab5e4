/*
 * Copyright The tracestore Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.storage.postgres;

import org.jooq.DSLContext;
import org.jooq.Record1;
import org.jooq.ResultQuery;

import static tracestore.storage.postgres.Schema.SERVICE;

final class SelectServiceNames extends SelectNames {

  @Override ResultQuery<Record1<String>> query(DSLContext context) {
    return context
      .selectDistinct(SERVICE.serviceName)
      .from(SERVICE.table)
      .where(SERVICE.serviceName.notEqual(""))
      .orderBy(SERVICE.serviceName.asc());
  }

  @Override public String toString() {
    return "SelectServiceNames{}";
  }
}
