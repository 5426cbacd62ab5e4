/*
 * Copyright The tracestore Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** The service and tags of the process that reported one or more spans. */
//@Immutable
public final class Process implements Serializable {
  private static final long serialVersionUID = 0L;

  public static Process create(String serviceName, Map<String, String> tags) {
    if (serviceName == null) throw new NullPointerException("serviceName == null");
    if (tags == null) throw new NullPointerException("tags == null");
    return new Process(serviceName,
      tags.isEmpty()
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(tags)));
  }

  public String serviceName() {
    return serviceName;
  }

  public Map<String, String> tags() {
    return tags;
  }

  final String serviceName;
  final Map<String, String> tags;

  Process(String serviceName, Map<String, String> tags) {
    this.serviceName = serviceName;
    this.tags = tags;
  }

  @Override public String toString() {
    return "Process{serviceName=" + serviceName + ", tags=" + tags + "}";
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Process)) return false;
    Process that = (Process) o;
    return serviceName.equals(that.serviceName) && tags.equals(that.tags);
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= serviceName.hashCode();
    h *= 1000003;
    h ^= tags.hashCode();
    return h;
  }
}
