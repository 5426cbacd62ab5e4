/*
 * Copyright The tracestore Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.storage.postgres;

import java.sql.Connection;
import org.jooq.DSLContext;
import org.jooq.ExecuteListenerProvider;
import org.jooq.SQLDialect;
import org.jooq.conf.Settings;
import org.jooq.impl.DSL;
import org.jooq.impl.DefaultConfiguration;
import zipkin2.internal.Nullable;

/** Binds a borrowed connection to the configured dialect, settings and listeners. */
final class DSLContexts {
  final SQLDialect dialect;
  private final Settings settings;
  private final ExecuteListenerProvider listenerProvider;

  DSLContexts(SQLDialect dialect, Settings settings,
    @Nullable ExecuteListenerProvider listenerProvider) {
    this.dialect = dialect;
    this.settings = settings;
    this.listenerProvider = listenerProvider;
  }

  DSLContext get(Connection conn) {
    DefaultConfiguration configuration = new DefaultConfiguration();
    configuration.set(conn).set(dialect).set(settings);
    if (listenerProvider != null) configuration.set(listenerProvider);
    return DSL.using(configuration);
  }

  /** A context that can render, but not execute, queries. */
  DSLContext renderOnly() {
    return DSL.using(dialect, settings);
  }
}
