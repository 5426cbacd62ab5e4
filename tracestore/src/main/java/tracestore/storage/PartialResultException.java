/*
 * Copyright The tracestore Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.storage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Raised when a read fails after some results were already materialized. The {@link #getCause()
 * cause} is the storage error, unchanged. Callers decide whether {@link #partialResult()} is
 * usable.
 */
public final class PartialResultException extends RuntimeException {
  private static final long serialVersionUID = 0L;

  final List<?> partialResult;

  public PartialResultException(String message, List<?> partialResult, Throwable cause) {
    super(message, cause);
    if (partialResult == null) throw new NullPointerException("partialResult == null");
    if (cause == null) throw new NullPointerException("cause == null");
    this.partialResult = Collections.unmodifiableList(new ArrayList<>(partialResult));
  }

  /** Results read before the failure, in the order they were read. */
  public List<?> partialResult() {
    return partialResult;
  }
}
