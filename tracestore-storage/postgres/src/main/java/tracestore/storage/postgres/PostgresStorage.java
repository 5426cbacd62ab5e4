/*
 * Copyright The tracestore Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.storage.postgres;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.Executor;
import javax.sql.DataSource;
import org.jooq.ExecuteListenerProvider;
import org.jooq.SQLDialect;
import org.jooq.conf.Settings;
import tracestore.storage.SpanReader;
import tracestore.storage.StorageComponent;
import zipkin2.CheckResult;
import zipkin2.internal.Nullable;

import static tracestore.storage.postgres.Schema.SPAN;

/**
 * Reads traces from a relational store holding {@code services}, {@code operations}, {@code
 * spans} and {@code span_refs} tables, and optionally {@code span_tags}.
 *
 * <p>The connection pool and executor are supplied by the caller, and not closed by {@link
 * #close()}.
 */
public final class PostgresStorage extends StorageComponent {
  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder extends StorageComponent.Builder {
    boolean strictTraceId = true, searchEnabled = true;
    int maxConcurrentTraceFetches = 1;
    private DataSource datasource;
    private Settings settings = new Settings().withRenderSchema(false);
    private SQLDialect dialect = SQLDialect.POSTGRES;
    private ExecuteListenerProvider listenerProvider;
    private Executor executor;

    @Override public Builder strictTraceId(boolean strictTraceId) {
      this.strictTraceId = strictTraceId;
      return this;
    }

    @Override public Builder searchEnabled(boolean searchEnabled) {
      this.searchEnabled = searchEnabled;
      return this;
    }

    public Builder datasource(DataSource datasource) {
      if (datasource == null) throw new NullPointerException("datasource == null");
      this.datasource = datasource;
      return this;
    }

    public Builder settings(Settings settings) {
      if (settings == null) throw new NullPointerException("settings == null");
      this.settings = settings;
      return this;
    }

    /** Defaults to {@link SQLDialect#POSTGRES}. Tests use {@link SQLDialect#H2}. */
    public Builder dialect(SQLDialect dialect) {
      if (dialect == null) throw new NullPointerException("dialect == null");
      this.dialect = dialect;
      return this;
    }

    public Builder listenerProvider(@Nullable ExecuteListenerProvider listenerProvider) {
      this.listenerProvider = listenerProvider;
      return this;
    }

    /** Runs {@code enqueue} callbacks, and trace loads when fetching more than one at a time. */
    public Builder executor(Executor executor) {
      if (executor == null) throw new NullPointerException("executor == null");
      this.executor = executor;
      return this;
    }

    /**
     * How many traces {@link SpanReader#findTraces} loads at the same time, each on its own
     * connection. Defaults to 1, which loads them one after another on the calling thread.
     */
    public Builder maxConcurrentTraceFetches(int maxConcurrentTraceFetches) {
      if (maxConcurrentTraceFetches < 1) {
        throw new IllegalArgumentException("maxConcurrentTraceFetches < 1");
      }
      this.maxConcurrentTraceFetches = maxConcurrentTraceFetches;
      return this;
    }

    @Override public PostgresStorage build() {
      return new PostgresStorage(this);
    }

    Builder() {
    }
  }

  static {
    System.setProperty("org.jooq.no-logo", "true");
  }

  final DataSource datasource;
  final DataSourceCall.Factory dataSourceCallFactory;
  final DSLContexts context;
  final boolean strictTraceId, searchEnabled;
  final int maxConcurrentTraceFetches;
  volatile Schema schema;

  PostgresStorage(PostgresStorage.Builder builder) {
    datasource = builder.datasource;
    if (datasource == null) throw new NullPointerException("datasource == null");
    Executor executor = builder.executor;
    if (executor == null) throw new NullPointerException("executor == null");
    context = new DSLContexts(builder.dialect, builder.settings, builder.listenerProvider);
    dataSourceCallFactory = new DataSourceCall.Factory(datasource, context, executor);
    strictTraceId = builder.strictTraceId;
    searchEnabled = builder.searchEnabled;
    maxConcurrentTraceFetches = builder.maxConcurrentTraceFetches;
  }

  /** Returns the connection pool in use by this storage component. */
  public DataSource datasource() {
    return datasource;
  }

  /** Lazy to avoid eager I/O */
  Schema schema() {
    if (schema == null) {
      synchronized (this) {
        if (schema == null) {
          schema = new Schema(datasource, context, strictTraceId);
        }
      }
    }
    return schema;
  }

  @Override public SpanReader spanReader() {
    return new PostgresSpanReader(this, schema());
  }

  @Override public CheckResult check() {
    try (Connection conn = datasource.getConnection()) {
      context.get(conn).select(SPAN.id).from(SPAN.table).limit(1).execute();
    } catch (SQLException | RuntimeException e) {
      return CheckResult.failed(e);
    }
    return CheckResult.OK;
  }

  @Override public void close() {
    // didn't open the DataSource or executor
  }

  @Override public String toString() {
    return "PostgresStorage{datasource=" + datasource + ", dialect=" + context.dialect + "}";
  }
}
