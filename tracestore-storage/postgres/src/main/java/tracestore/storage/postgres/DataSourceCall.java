/*
 * Copyright The tracestore Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.storage.postgres;

import java.io.IOException;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.Executor;
import java.util.function.BooleanSupplier;
import java.util.function.Function;
import javax.sql.DataSource;
import org.jooq.DSLContext;
import zipkin2.Call;
import zipkin2.Callback;

/**
 * Runs one query function on its own connection, either on the caller's thread or the executor.
 *
 * <p>Cancelation doesn't abort a query in flight, but its result is discarded and the call fails.
 */
final class DataSourceCall<V> extends Call.Base<V> {
  static final String CANCELED = "tracestore.canceled";

  /**
   * Query functions issuing more than one statement check this between them, so a canceled call
   * stops querying early.
   */
  static boolean isCanceled(DSLContext context) {
    Object canceled = context.data(CANCELED);
    return canceled instanceof BooleanSupplier && ((BooleanSupplier) canceled).getAsBoolean();
  }

  static final class Factory {
    final DataSource datasource;
    final DSLContexts context;
    final Executor executor;

    Factory(DataSource datasource, DSLContexts context, Executor executor) {
      this.datasource = datasource;
      this.context = context;
      this.executor = executor;
    }

    <V> DataSourceCall<V> create(Function<DSLContext, V> queryFunction) {
      return new DataSourceCall<>(this, queryFunction);
    }
  }

  final Factory factory;
  final Function<DSLContext, V> queryFunction;

  DataSourceCall(Factory factory, Function<DSLContext, V> queryFunction) {
    this.factory = factory;
    this.queryFunction = queryFunction;
  }

  @Override protected V doExecute() throws IOException {
    V result;
    try (Connection conn = factory.datasource.getConnection()) {
      DSLContext context = factory.context.get(conn);
      context.data(CANCELED, (BooleanSupplier) this::isCanceled);
      result = queryFunction.apply(context);
    } catch (SQLException e) {
      throw new IOException(e);
    }
    if (isCanceled()) throw new IOException("Canceled");
    return result;
  }

  @Override protected void doEnqueue(Callback<V> callback) {
    class CallbackRunnable implements Runnable {
      @Override public void run() {
        try {
          callback.onSuccess(doExecute());
        } catch (IOException e) {
          // unwrap the exception
          if (e.getCause() instanceof SQLException) {
            callback.onError(e.getCause());
          } else {
            callback.onError(e);
          }
        } catch (Throwable t) {
          propagateIfFatal(t);
          callback.onError(t);
        }
      }
    }
    factory.executor.execute(new CallbackRunnable());
  }

  @Override public String toString() {
    return queryFunction.toString();
  }

  @Override public Call<V> clone() {
    return new DataSourceCall<>(factory, queryFunction);
  }
}
