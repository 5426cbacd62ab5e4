/*
 * Copyright The tracestore Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.storage.postgres;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import javax.sql.DataSource;
import tracestore.TraceId;

/** Writes rows the way the write path would, so tests can read them back. */
final class TestRows {
  final DataSource datasource;

  TestRows(DataSource datasource) {
    this.datasource = datasource;
  }

  TestRows service(long id, String name) {
    return insert("INSERT INTO services (id, service_name) VALUES (?, ?)", id, name);
  }

  TestRows operation(long id, String name) {
    return insert("INSERT INTO operations (id, operation_name) VALUES (?, ?)", id, name);
  }

  TestRows span(long id, TraceId traceId, long operationId, long serviceId, String processId,
    String processTags, long startTime, long duration) {
    return insert("INSERT INTO spans (id, trace_id_low, trace_id_high, operation_id, service_id,"
        + " process_id, process_tags, start_time, duration) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
      id, traceId.low(), traceId.high(), operationId, serviceId, processId, processTags,
      startTime, duration);
  }

  /** Records that {@code spanId} references {@code childSpanId}. */
  TestRows ref(long id, long spanId, long childSpanId) {
    return insert("INSERT INTO span_refs (id, span_id, child_span_id) VALUES (?, ?, ?)",
      id, spanId, childSpanId);
  }

  TestRows tag(long spanId, String key, String value) {
    return insert("INSERT INTO span_tags (span_id, tag_key, tag_value) VALUES (?, ?, ?)",
      spanId, key, value);
  }

  TestRows insert(String sql, Object... values) {
    try (Connection conn = datasource.getConnection();
         PreparedStatement statement = conn.prepareStatement(sql)) {
      for (int i = 0; i < values.length; i++) {
        if (values[i] == null) {
          statement.setNull(i + 1, Types.VARCHAR);
        } else {
          statement.setObject(i + 1, values[i]);
        }
      }
      statement.executeUpdate();
    } catch (SQLException e) {
      throw new AssertionError(e);
    }
    return this;
  }
}
