/*
 * Copyright The tracestore Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.storage;

import tracestore.TraceId;
import zipkin2.Component;

/**
 * A component that provides read access to a trace store.
 *
 * <p>Callers of this class should {@link #close()} it when no longer needed. Implementations
 * don't close resources they were given, such as a connection pool.
 */
public abstract class StorageComponent extends Component {

  public abstract SpanReader spanReader();

  public static abstract class Builder {

    /**
     * Trace IDs are 128-bit, though older writers may have stored only the lower 64 bits. When
     * false, this setting only considers {@link TraceId#low()} when grouping or retrieving traces.
     * Defaults to true.
     */
    public abstract Builder strictTraceId(boolean strictTraceId);

    /**
     * False disables service, operation and trace search, returning empty results without
     * touching storage. Trace and dependency retrieval still work. Defaults to true.
     */
    public abstract Builder searchEnabled(boolean searchEnabled);

    public abstract StorageComponent build();
  }
}
