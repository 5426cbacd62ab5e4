/*
 * Copyright The tracestore Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.storage.postgres;

import org.jooq.DSLContext;
import org.jooq.Record1;
import org.jooq.ResultQuery;
import zipkin2.internal.Nullable;

import static tracestore.storage.postgres.Schema.OPERATION;
import static tracestore.storage.postgres.Schema.SERVICE;
import static tracestore.storage.postgres.Schema.SPAN;

/** Lists all operation names, or only those with a span from the given service. */
final class SelectOperationNames extends SelectNames {
  @Nullable final String serviceName;

  SelectOperationNames(@Nullable String serviceName) {
    this.serviceName = serviceName;
  }

  @Override ResultQuery<Record1<String>> query(DSLContext context) {
    if (serviceName == null) {
      return context
        .selectDistinct(OPERATION.operationName)
        .from(OPERATION.table)
        .where(OPERATION.operationName.notEqual(""))
        .orderBy(OPERATION.operationName.asc());
    }
    return context
      .selectDistinct(OPERATION.operationName)
      .from(OPERATION.table)
      .join(SPAN.table).on(SPAN.operationId.eq(OPERATION.id))
      .join(SERVICE.table).on(SERVICE.id.eq(SPAN.serviceId))
      .where(SERVICE.serviceName.eq(serviceName))
      .and(OPERATION.operationName.notEqual(""))
      .orderBy(OPERATION.operationName.asc());
  }

  @Override public String toString() {
    return "SelectOperationNames{serviceName=" + serviceName + "}";
  }
}
